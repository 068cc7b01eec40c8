package com.transitbot.fit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Predicts transit centre times {@code t0 + n * period} that fall inside an observed span.
 */
public final class EphemerisPredictor {
    private static final Logger LOG = LogManager.getLogger(EphemerisPredictor.class);

    static final long MAX_EVENTS = 1_000_000L;

    public double[] expectedTransitTimes(double[] time, Double epoch, Double period) {
        if (time == null || time.length == 0 || epoch == null || period == null) {
            return new double[0];
        }
        if (!Double.isFinite(epoch) || !Double.isFinite(period) || period <= 0.0) {
            return new double[0];
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double t : time) {
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            return new double[0];
        }

        double firstCycle = Math.floor((min - epoch) / period);
        double lastCycle = Math.ceil((max - epoch) / period);
        if (lastCycle - firstCycle + 1.0 > MAX_EVENTS) {
            LOG.warn("Period {} gives more than {} candidate transits over [{}, {}], ignoring",
                    period, MAX_EVENTS, min, max);
            return new double[0];
        }
        long nStart = (long) firstCycle;
        long nEnd = (long) lastCycle;
        double margin = 2.0 * meanStep(time.length, min, max, period);

        double[] kept = new double[(int) (nEnd - nStart + 1)];
        int count = 0;
        for (long n = nStart; n <= nEnd; n++) {
            double candidate = epoch + n * period;
            if (candidate >= min - margin && candidate <= max + margin) {
                kept[count++] = candidate;
            }
        }
        double[] out = Arrays.copyOf(kept, count);
        Arrays.sort(out);
        return out;
    }

    // Mean spacing of the sorted samples; P/100 with fewer than two samples.
    static double meanStep(int n, double min, double max, double period) {
        if (n < 2) {
            return period / 100.0;
        }
        return (max - min) / (n - 1);
    }
}
