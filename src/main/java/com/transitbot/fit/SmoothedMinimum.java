package com.transitbot.fit;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Initial transit-centre guess: the time of the minimum of a centred rolling median of the flux.
 */
public final class SmoothedMinimum {
    public static final int WINDOW = 5;

    private SmoothedMinimum() {
    }

    public static double initialT0(double[] time, double[] flux) {
        if (time.length == 0) {
            throw new IllegalArgumentException("empty segment");
        }
        double[] smoothed = rollingMedian(flux, WINDOW);
        int best = -1;
        for (int i = 0; i < smoothed.length; i++) {
            if (Double.isNaN(smoothed[i])) {
                continue;
            }
            if (best < 0 || smoothed[i] < smoothed[best]) {
                best = i;
            }
        }
        if (best < 0) {
            best = rawArgMin(flux);
        }
        return time[best];
    }

    static double[] rollingMedian(double[] values, int window) {
        int half = window / 2;
        Median median = new Median();
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int begin = Math.max(0, i - half);
            int end = Math.min(values.length, i + half + 1);
            out[i] = median.evaluate(values, begin, end - begin);
        }
        return out;
    }

    private static int rawArgMin(double[] flux) {
        int best = 0;
        for (int i = 1; i < flux.length; i++) {
            if (flux[i] < flux[best]) {
                best = i;
            }
        }
        return best;
    }
}
