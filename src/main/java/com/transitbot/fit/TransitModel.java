package com.transitbot.fit;

import com.transitbot.model.ModelParams;

/**
 * Evaluates relative stellar brightness during a planetary transit.
 * Implementations are deterministic and free of side effects.
 */
public interface TransitModel {
    double[] lightCurve(double[] time, double t0, ModelParams params);
}
