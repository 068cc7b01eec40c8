package com.transitbot.fit;

import java.util.Arrays;

/**
 * A time/flux slice cut out of a light curve around one transit.
 */
public final class Segment {
    public final double[] time;
    public final double[] flux;

    public Segment(double[] time, double[] flux) {
        this.time = time;
        this.flux = flux;
    }

    /**
     * Samples with {@code |t - center| < halfWidth}.
     */
    public static Segment around(double[] time, double[] flux, double center, double halfWidth) {
        int[] idx = new int[time.length];
        int n = 0;
        for (int i = 0; i < time.length; i++) {
            if (Math.abs(time[i] - center) < halfWidth) {
                idx[n++] = i;
            }
        }
        return pick(time, flux, idx, n);
    }

    /**
     * Samples with {@code center - halfWidth <= t <= center + halfWidth}.
     */
    public static Segment between(double[] time, double[] flux, double center, double halfWidth) {
        double lo = center - halfWidth;
        double hi = center + halfWidth;
        int[] idx = new int[time.length];
        int n = 0;
        for (int i = 0; i < time.length; i++) {
            if (time[i] >= lo && time[i] <= hi) {
                idx[n++] = i;
            }
        }
        return pick(time, flux, idx, n);
    }

    public int size() {
        return time.length;
    }

    public boolean isEmpty() {
        return time.length == 0;
    }

    public boolean isConstantFlux() {
        if (flux.length == 0) {
            return true;
        }
        double first = flux[0];
        for (double f : flux) {
            if (Double.compare(f, first) != 0) {
                return false;
            }
        }
        return true;
    }

    private static Segment pick(double[] time, double[] flux, int[] idx, int n) {
        double[] t = new double[n];
        double[] f = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = time[idx[i]];
            f[i] = flux[idx[i]];
        }
        return new Segment(t, f);
    }

    @Override
    public String toString() {
        return "Segment{size=" + time.length + ", time=" + (time.length == 0 ? "[]"
                : "[" + Arrays.stream(time).min().getAsDouble() + ", " + Arrays.stream(time).max().getAsDouble() + "]") + "}";
    }
}
