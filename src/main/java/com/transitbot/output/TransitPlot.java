package com.transitbot.output;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Data shown in one transit figure. {@code model} and the fitted values are null when the
 * fit was skipped or failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class TransitPlot {
    double[] time;
    double[] flux;
    double[] model;
    Double t0Fitted;
    double t0Expected;
    Double ttvMinutes;
    Double rmsResiduals;
    int transitIndex;

    public boolean hasModel() {
        return model != null && t0Fitted != null;
    }
}
