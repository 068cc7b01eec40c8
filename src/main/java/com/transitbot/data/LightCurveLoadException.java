package com.transitbot.data;

/**
 * Raised when a light-curve file cannot be read or has no recognisable data section.
 */
public class LightCurveLoadException extends Exception {
    public LightCurveLoadException(String message) {
        super(message);
    }

    public LightCurveLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
