package com.transitbot.model;

/**
 * Fully resolved inputs of the transit model apart from the centre time.
 */
public final class ModelParams {
    public final double period;
    public final double rp;
    public final double a;
    public final double inc;
    public final double u1;
    public final double u2;
    public final double ecc;
    public final double w;
    public final double expTime;
    public final int supersample;
    public final double duration;
    public final double maxTtv;

    public ModelParams(
            double period,
            double rp,
            double a,
            double inc,
            double u1,
            double u2,
            double ecc,
            double w,
            double expTime,
            int supersample,
            double duration,
            double maxTtv
    ) {
        this.period = period;
        this.rp = rp;
        this.a = a;
        this.inc = inc;
        this.u1 = u1;
        this.u2 = u2;
        this.ecc = ecc;
        this.w = w;
        this.expTime = expTime;
        this.supersample = Math.max(1, supersample);
        this.duration = duration;
        this.maxTtv = maxTtv;
    }

    public static ModelParams from(PhysicalParams params, double maxTtv) {
        PhysicalParams p = params == null ? PhysicalParams.empty() : params;
        Integer supersample = p.getSupersampleFactor();
        return new ModelParams(
                PhysicalParams.orDefault(p.getPeriod(), Double.NaN),
                p.radiusRatioOrDefault(),
                p.axisRatioOrDefault(),
                PhysicalParams.orDefault(p.getInclination(), PhysicalParams.DEFAULT_INC),
                PhysicalParams.orDefault(p.getU1(), PhysicalParams.DEFAULT_U1),
                PhysicalParams.orDefault(p.getU2(), PhysicalParams.DEFAULT_U2),
                PhysicalParams.orDefault(p.getEccentricity(), PhysicalParams.DEFAULT_ECC),
                PhysicalParams.orDefault(p.getPeriastron(), PhysicalParams.DEFAULT_W),
                PhysicalParams.orDefault(p.getExposureTime(), PhysicalParams.DEFAULT_EXP_TIME),
                supersample == null ? PhysicalParams.DEFAULT_SUPERSAMPLE : supersample,
                p.durationOrDefault(),
                maxTtv
        );
    }

    public ModelParams withShape(double rp, double a) {
        return new ModelParams(period, rp, a, inc, u1, u2, ecc, w, expTime, supersample, duration, maxTtv);
    }

    @Override
    public String toString() {
        return "ModelParams{period=" + period + ", rp=" + rp + ", a=" + a + ", inc=" + inc
                + ", u1=" + u1 + ", u2=" + u2 + ", ecc=" + ecc + ", w=" + w
                + ", expTime=" + expTime + ", supersample=" + supersample + "}";
    }
}
