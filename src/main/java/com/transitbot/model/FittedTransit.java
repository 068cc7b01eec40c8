package com.transitbot.model;

/**
 * Result of a successful timing fit: the centre time and the parameters it was fitted with.
 */
public final class FittedTransit {
    public final double t0;
    public final double chi2;
    public final ModelParams params;

    public FittedTransit(double t0, double chi2, ModelParams params) {
        this.t0 = t0;
        this.chi2 = chi2;
        this.params = params;
    }
}
