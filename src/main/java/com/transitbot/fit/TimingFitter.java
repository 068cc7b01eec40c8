package com.transitbot.fit;

import com.transitbot.core.diagnostics.CauseCode;
import com.transitbot.core.diagnostics.Outcome;
import com.transitbot.model.FittedTransit;
import com.transitbot.model.ModelParams;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fits the centre time of a single transit with the planet shape held fixed.
 *
 * <p>A bounded Levenberg-Marquardt fit is started from several offsets around the initial
 * guess; the start that reaches the lowest residual sum of squares wins.
 */
public final class TimingFitter {
    private static final Logger LOG = LogManager.getLogger(TimingFitter.class);
    private static final String OWNER = "timing_fit";

    static final double[] START_OFFSETS = {-0.0075, -0.003, 0.0, 0.003, 0.0075};
    static final double SEARCH_PAD_DAYS = 0.02;
    static final int MAX_EVALUATIONS = 10_000;
    static final double TOLERANCE = 1e-10;
    private static final double JACOBIAN_STEP_DAYS = 1e-5;

    private final TransitModel model;

    public TimingFitter(TransitModel model) {
        this.model = model;
    }

    public Outcome<FittedTransit> fit(Segment segment, ModelParams params, double t0Initial) {
        if (segment == null || segment.isEmpty()) {
            return Outcome.failure(CauseCode.INSUFFICIENT_DATA, OWNER);
        }
        if (segment.isConstantFlux()) {
            LOG.warn("Constant flux in transit window, cannot fit");
            return Outcome.failure(CauseCode.CONSTANT_FLUX, OWNER);
        }

        double margin = params.duration / 2.0 + params.maxTtv * 3.0 + SEARCH_PAD_DAYS;
        double lower = t0Initial - margin;
        double upper = t0Initial + margin;

        List<Double> starts = new ArrayList<>();
        for (double offset : START_OFFSETS) {
            double start = t0Initial + offset;
            if (start >= lower && start <= upper) {
                starts.add(start);
            }
        }
        if (starts.isEmpty()) {
            LOG.warn("No valid initial points for t0 fit");
            return Outcome.failure(CauseCode.NO_VALID_START, OWNER);
        }

        double bestT0 = Double.NaN;
        double bestChi2 = Double.POSITIVE_INFINITY;
        int failures = 0;
        for (double start : starts) {
            double localLower = Math.max(lower, start - margin / 2.0);
            double localUpper = Math.min(upper, start + margin / 2.0);
            if (localLower >= localUpper) {
                continue;
            }
            try {
                double t0 = fitFrom(segment, params, start, localLower, localUpper);
                double chi2 = Residuals.sumOfSquares(segment.flux, model.lightCurve(segment.time, t0, params));
                if (chi2 < bestChi2) {
                    bestChi2 = chi2;
                    bestT0 = t0;
                }
            } catch (RuntimeException e) {
                failures++;
                LOG.debug("t0 fit from start={} failed: {}", start, e.getMessage());
            }
        }

        if (Double.isNaN(bestT0)) {
            LOG.warn("All t0 fit attempts failed");
            return Outcome.failure(CauseCode.FIT_NOT_CONVERGED, OWNER, Map.of("starts", starts.size(), "failures", failures));
        }
        return Outcome.success(new FittedTransit(bestT0, bestChi2, params), OWNER);
    }

    // The fitted parameter is the offset from the start point, so relative tolerances stay meaningful
    // for absolute times around 2.45e6 days.
    private double fitFrom(Segment segment, ModelParams params, double start, double lo, double hi) {
        double offsetLo = lo - start;
        double offsetHi = hi - start;
        MultivariateJacobianFunction residualModel = point -> {
            double offset = point.getEntry(0);
            double[] value = model.lightCurve(segment.time, start + offset, params);
            double[] plus = model.lightCurve(segment.time, start + offset + JACOBIAN_STEP_DAYS, params);
            double[] minus = model.lightCurve(segment.time, start + offset - JACOBIAN_STEP_DAYS, params);
            double[][] jacobian = new double[value.length][1];
            for (int i = 0; i < value.length; i++) {
                jacobian[i][0] = (plus[i] - minus[i]) / (2.0 * JACOBIAN_STEP_DAYS);
            }
            RealVector v = new ArrayRealVector(value, false);
            RealMatrix j = new Array2DRowRealMatrix(jacobian, false);
            return new Pair<>(v, j);
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(new double[]{0.0})
                .model(residualModel)
                .target(segment.flux)
                .parameterValidator(p -> {
                    double clamped = Math.max(offsetLo, Math.min(offsetHi, p.getEntry(0)));
                    return new ArrayRealVector(new double[]{clamped}, false);
                })
                .lazyEvaluation(false)
                .maxEvaluations(MAX_EVALUATIONS)
                .maxIterations(MAX_EVALUATIONS)
                .build();

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(TOLERANCE)
                .withParameterRelativeTolerance(TOLERANCE)
                .withOrthoTolerance(TOLERANCE);
        LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
        double offset = optimum.getPoint().getEntry(0);
        return start + Math.max(offsetLo, Math.min(offsetHi, offset));
    }
}
