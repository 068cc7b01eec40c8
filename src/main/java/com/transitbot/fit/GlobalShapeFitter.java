package com.transitbot.fit;

import com.transitbot.core.diagnostics.CauseCode;
import com.transitbot.core.diagnostics.Outcome;
import com.transitbot.model.ModelParams;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Fits one planet radius ratio and scaled semi-major axis shared by every transit of a light curve.
 *
 * <p>For each trial shape the centre time of every transit is re-solved with a bounded 1-D
 * minimisation, and the residual sums of squares are added up. Windows whose inner fit fails
 * contribute {@link #PENALTY}.
 */
public final class GlobalShapeFitter {
    private static final Logger LOG = LogManager.getLogger(GlobalShapeFitter.class);
    private static final String OWNER = "global_shape_fit";

    public static final double PENALTY = 1e20;
    static final double RANGE_FRACTION = 0.15;
    static final double MIN_RP = 1e-4;
    static final double MAX_RP = 1.0;
    static final double MIN_A = 1.0;
    static final int MIN_WINDOW_SAMPLES = 5;
    static final double INNER_PAD_DAYS = 0.1;
    static final int MAX_OUTER_EVALUATIONS = 1000;
    static final int MAX_INNER_EVALUATIONS = 500;

    private final TransitModel model;

    public GlobalShapeFitter(TransitModel model) {
        this.model = model;
    }

    /**
     * Returns the fitted (rp, a) pair, or the seed pair if the outer optimisation fails.
     */
    public double[] fit(double[] time, double[] flux, ModelParams seed, double[] expectedT0s) {
        Outcome<double[]> outcome = optimize(time, flux, seed, expectedT0s);
        if (!outcome.success) {
            LOG.warn("Global fit failed ({}), keeping rp={} a={}", outcome.causeCode, seed.rp, seed.a);
            return new double[]{seed.rp, seed.a};
        }
        return outcome.value;
    }

    Outcome<double[]> optimize(double[] time, double[] flux, ModelParams seed, double[] expectedT0s) {
        double rpLower = Math.max(seed.rp * (1.0 - RANGE_FRACTION), MIN_RP);
        double rpUpper = Math.min(seed.rp * (1.0 + RANGE_FRACTION), MAX_RP);
        double aLower = Math.max(seed.a * (1.0 - RANGE_FRACTION), MIN_A);
        double aUpper = seed.a * (1.0 + RANGE_FRACTION);
        if (!(rpLower < rpUpper) || !(aLower < aUpper)) {
            return Outcome.failure(CauseCode.INVALID_BOUNDS, OWNER,
                    Map.of("rp", rpLower + ".." + rpUpper, "a", aLower + ".." + aUpper));
        }

        double[] lower = {rpLower, aLower};
        double[] span = {rpUpper - rpLower, aUpper - aLower};
        double[] start = {
                clampUnit((seed.rp - rpLower) / span[0]),
                clampUnit((seed.a - aLower) / span[1])
        };

        Segment[] windows = shapeWindows(time, flux, expectedT0s, seed.duration);
        MultivariateFunction chi2 = x -> totalChi2(
                windows,
                expectedT0s,
                seed.withShape(lower[0] + x[0] * span[0], lower[1] + x[1] * span[1])
        );

        try {
            BOBYQAOptimizer optimizer = new BOBYQAOptimizer(5, 0.1, 1e-6);
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(MAX_OUTER_EVALUATIONS),
                    new ObjectiveFunction(chi2),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new SimpleBounds(new double[]{0.0, 0.0}, new double[]{1.0, 1.0})
            );
            double[] x = optimum.getPoint();
            double rp = lower[0] + clampUnit(x[0]) * span[0];
            double a = lower[1] + clampUnit(x[1]) * span[1];
            return Outcome.success(new double[]{rp, a}, OWNER, Map.of("chi2", optimum.getValue()));
        } catch (RuntimeException e) {
            return Outcome.failure(CauseCode.FIT_NOT_CONVERGED, OWNER, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    double totalChi2(Segment[] windows, double[] expectedT0s, ModelParams trial) {
        double total = 0.0;
        for (int i = 0; i < windows.length; i++) {
            if (windows[i] == null) {
                continue;
            }
            Outcome<Double> inner = fitCentre(windows[i], expectedT0s[i], trial);
            total += inner.success ? inner.value : PENALTY;
        }
        return total;
    }

    /**
     * Minimised residual sum of squares of one window over the transit centre time.
     */
    Outcome<Double> fitCentre(Segment window, double expectedT0, ModelParams trial) {
        double guess;
        try {
            guess = SmoothedMinimum.initialT0(window.time, window.flux);
        } catch (RuntimeException e) {
            return Outcome.failure(CauseCode.INSUFFICIENT_DATA, OWNER);
        }
        double margin = trial.duration / 2.0 + INNER_PAD_DAYS;
        double lo = expectedT0 - margin;
        double hi = expectedT0 + margin;
        double start = Math.max(lo, Math.min(hi, guess));
        try {
            BrentOptimizer brent = new BrentOptimizer(1e-12, 1e-9);
            UnivariatePointValuePair best = brent.optimize(
                    new MaxEval(MAX_INNER_EVALUATIONS),
                    new UnivariateObjectiveFunction(t0 -> Residuals.sumOfSquares(
                            window.flux, model.lightCurve(window.time, t0, trial))),
                    GoalType.MINIMIZE,
                    new SearchInterval(lo, hi, start)
            );
            double chi2 = Residuals.sumOfSquares(window.flux, model.lightCurve(window.time, best.getPoint(), trial));
            if (!Double.isFinite(chi2)) {
                return Outcome.failure(CauseCode.FIT_NOT_CONVERGED, OWNER);
            }
            return Outcome.success(chi2, OWNER);
        } catch (RuntimeException e) {
            return Outcome.failure(CauseCode.FIT_NOT_CONVERGED, OWNER, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    // Windows that are too sparse are left null and skipped by the objective.
    static Segment[] shapeWindows(double[] time, double[] flux, double[] expectedT0s, double duration) {
        double halfWidth = Math.max(duration * 1.5, 0.5);
        Segment[] out = new Segment[expectedT0s.length];
        for (int i = 0; i < expectedT0s.length; i++) {
            Segment window = Segment.around(time, flux, expectedT0s[i], halfWidth);
            out[i] = window.size() <= MIN_WINDOW_SAMPLES ? null : window;
        }
        return out;
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
