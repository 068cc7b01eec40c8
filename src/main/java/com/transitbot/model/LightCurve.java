package com.transitbot.model;

/**
 * One observed brightness series. Time samples are not required to be sorted.
 */
public final class LightCurve {
    public final String fileName;
    public final double[] time;
    public final double[] flux;
    public final PhysicalParams params;
    public final DataType dataType;

    public LightCurve(String fileName, double[] time, double[] flux, PhysicalParams params, DataType dataType) {
        if (time == null || flux == null || time.length != flux.length) {
            throw new IllegalArgumentException("time and flux must be non-null and of equal length");
        }
        this.fileName = fileName == null ? "" : fileName;
        this.time = time;
        this.flux = flux;
        this.params = params == null ? PhysicalParams.empty() : params;
        this.dataType = dataType == null ? DataType.REAL : dataType;
    }

    public int size() {
        return time.length;
    }

    public double timeMin() {
        double min = Double.POSITIVE_INFINITY;
        for (double t : time) {
            min = Math.min(min, t);
        }
        return min;
    }

    public double timeMax() {
        double max = Double.NEGATIVE_INFINITY;
        for (double t : time) {
            max = Math.max(max, t);
        }
        return max;
    }

    public String stem() {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
