package com.transitbot.core.diagnostics;

/**
 * Reason attached to a failed {@link Outcome}.
 */
public enum CauseCode {
    NONE,
    MISSING_PARAMETER,
    NO_EVENTS,
    INSUFFICIENT_DATA,
    CONSTANT_FLUX,
    NO_VALID_START,
    FIT_NOT_CONVERGED,
    INVALID_BOUNDS,
    NO_PLOT_DATA,
    PLOT_FAILED,
    EVENT_ERROR,
    LOAD_FAILED
}
