package com.transitbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Orbital, stellar and observation parameters read from a light-curve header.
 * Every field is optional; {@link ModelParams#from(PhysicalParams, double)} applies the defaults.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class PhysicalParams {
    public static final double DEFAULT_INC = 89.0;
    public static final double DEFAULT_U1 = 0.65;
    public static final double DEFAULT_U2 = 0.08;
    public static final double DEFAULT_ECC = 0.0;
    public static final double DEFAULT_W = 90.0;
    public static final double DEFAULT_EXP_TIME = 0.00068113;
    public static final int DEFAULT_SUPERSAMPLE = 15;
    public static final double DEFAULT_RP = 0.1;
    public static final double DEFAULT_A = 8.0;
    public static final double DEFAULT_DURATION = 0.2;

    Double period;
    Double epoch;
    Double inclination;
    Double u1;
    Double u2;
    Double eccentricity;
    Double periastron;
    Double exposureTime;
    Integer supersampleFactor;
    Double radiusRatio;
    Double axisRatio;
    Double duration;

    Double starRadius;
    Double noiseSigma;
    Double starTeff;
    Double starLogg;
    String dataTypeLabel;
    String objectName;

    public static PhysicalParams empty() {
        return PhysicalParams.builder().build();
    }

    public boolean hasEphemeris() {
        return isFinite(period) && isFinite(epoch);
    }

    public double durationOrDefault() {
        return isFinite(duration) ? duration : DEFAULT_DURATION;
    }

    public double radiusRatioOrDefault() {
        return isFinite(radiusRatio) ? radiusRatio : DEFAULT_RP;
    }

    public double axisRatioOrDefault() {
        return isFinite(axisRatio) ? axisRatio : DEFAULT_A;
    }

    static double orDefault(Double value, double fallback) {
        return isFinite(value) ? value : fallback;
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }
}
