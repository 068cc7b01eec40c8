package com.transitbot.fit;

import com.transitbot.model.ModelParams;

/**
 * Transit light curve for a star with quadratic limb darkening.
 *
 * <p>The planet follows a Keplerian orbit; the centre time {@code t0} is the time of
 * inferior conjunction. The occulted flux is integrated over concentric stellar rings using
 * exact circle overlap areas, and each exposure is averaged over {@code supersample}
 * sub-samples spread across {@code expTime}.
 */
public final class QuadraticTransitModel implements TransitModel {
    private static final int DEFAULT_RINGS = 48;
    private static final int KEPLER_MAX_ITER = 50;
    private static final double KEPLER_TOL = 1e-12;
    private static final double ECC_CIRCULAR = 1e-10;

    private final int rings;

    public QuadraticTransitModel() {
        this(DEFAULT_RINGS);
    }

    public QuadraticTransitModel(int rings) {
        this.rings = Math.max(4, rings);
    }

    @Override
    public double[] lightCurve(double[] time, double t0, ModelParams params) {
        Orbit orbit = new Orbit(t0, params);
        double p = Math.abs(params.rp);
        double norm = Math.PI * (1.0 - params.u1 / 3.0 - params.u2 / 6.0);

        int samples = params.supersample > 1 && params.expTime > 0.0 ? params.supersample : 1;
        double[] out = new double[time.length];
        for (int i = 0; i < time.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < samples; j++) {
                double t = samples == 1
                        ? time[i]
                        : time[i] + params.expTime * ((j + 0.5) / samples - 0.5);
                double z = orbit.separation(t);
                sum += 1.0 - occulted(z, p, params.u1, params.u2) / norm;
            }
            out[i] = sum / samples;
        }
        return out;
    }

    double occulted(double z, double p, double u1, double u2) {
        if (p <= 0.0 || !(z < 1.0 + p)) {
            return 0.0;
        }
        double lo = Math.max(0.0, z - p);
        double hi = Math.min(1.0, z + p);
        if (hi <= lo) {
            return 0.0;
        }
        double step = (hi - lo) / rings;
        double blocked = 0.0;
        double prevArea = overlap(lo, p, z);
        for (int k = 1; k <= rings; k++) {
            double r = lo + k * step;
            double area = overlap(r, p, z);
            double mid = r - 0.5 * step;
            blocked += intensity(mid, u1, u2) * (area - prevArea);
            prevArea = area;
        }
        return blocked;
    }

    static double intensity(double r, double u1, double u2) {
        double mu = Math.sqrt(Math.max(0.0, 1.0 - r * r));
        double oneMinusMu = 1.0 - mu;
        return 1.0 - u1 * oneMinusMu - u2 * oneMinusMu * oneMinusMu;
    }

    /**
     * Area shared by a disc of radius {@code r} at the origin and a disc of radius {@code p}
     * whose centre lies at distance {@code z}.
     */
    static double overlap(double r, double p, double z) {
        if (r <= 0.0) {
            return 0.0;
        }
        if (z >= r + p) {
            return 0.0;
        }
        if (z <= Math.abs(r - p)) {
            double m = Math.min(r, p);
            return Math.PI * m * m;
        }
        double k0 = Math.acos(clamp((p * p + z * z - r * r) / (2.0 * p * z)));
        double k1 = Math.acos(clamp((r * r + z * z - p * p) / (2.0 * r * z)));
        double k2 = Math.sqrt(Math.max(0.0, (-z + r + p) * (z + r - p) * (z - r + p) * (z + r + p)));
        return p * p * k0 + r * r * k1 - 0.5 * k2;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    /**
     * Sky-projected star-planet separation in stellar radii.
     */
    static final class Orbit {
        private final double period;
        private final double a;
        private final double ecc;
        private final double omega;
        private final double sinInc;
        private final double tPeri;
        private final boolean circular;

        Orbit(double t0, ModelParams params) {
            this.period = params.period;
            this.a = params.a;
            this.ecc = params.ecc;
            this.omega = Math.toRadians(params.w);
            this.sinInc = Math.sin(Math.toRadians(params.inc));
            this.circular = Math.abs(params.ecc) < ECC_CIRCULAR;

            double fTransit = Math.PI / 2.0 - omega;
            double eTransit = 2.0 * Math.atan(Math.sqrt((1.0 - ecc) / (1.0 + ecc)) * Math.tan(fTransit / 2.0));
            double mTransit = eTransit - ecc * Math.sin(eTransit);
            this.tPeri = t0 - period / (2.0 * Math.PI) * mTransit;
        }

        double separation(double t) {
            double meanAnomaly = 2.0 * Math.PI / period * (t - tPeri);
            double f;
            double radius;
            if (circular) {
                f = meanAnomaly;
                radius = a;
            } else {
                double e = eccentricAnomaly(meanAnomaly);
                f = 2.0 * Math.atan2(Math.sqrt(1.0 + ecc) * Math.sin(e / 2.0), Math.sqrt(1.0 - ecc) * Math.cos(e / 2.0));
                radius = a * (1.0 - ecc * ecc) / (1.0 + ecc * Math.cos(f));
            }
            double s = Math.sin(omega + f);
            if (s <= 0.0) {
                // planet behind the star
                return Double.POSITIVE_INFINITY;
            }
            return radius * Math.sqrt(Math.max(0.0, 1.0 - s * s * sinInc * sinInc));
        }

        private double eccentricAnomaly(double meanAnomaly) {
            double m = meanAnomaly % (2.0 * Math.PI);
            double e = ecc > 0.8 ? Math.PI : m;
            for (int i = 0; i < KEPLER_MAX_ITER; i++) {
                double delta = (e - ecc * Math.sin(e) - m) / (1.0 - ecc * Math.cos(e));
                e -= delta;
                if (Math.abs(delta) < KEPLER_TOL) {
                    break;
                }
            }
            return e;
        }
    }
}
