package com.transitbot.fit;

public final class Residuals {
    private Residuals() {
    }

    public static double sumOfSquares(double[] observed, double[] model) {
        double sum = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double r = observed[i] - model[i];
            sum += r * r;
        }
        return sum;
    }

    public static double rms(double[] observed, double[] model) {
        if (observed.length == 0) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquares(observed, model) / observed.length);
    }
}
