package com.transitbot.fit;

import com.transitbot.model.ModelParams;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuadraticTransitModelTest {

    private final QuadraticTransitModel model = new QuadraticTransitModel();

    static ModelParams params(double rp, double a, double inc, double u1, double u2) {
        return new ModelParams(3.0, rp, a, inc, u1, u2, 0.0, 90.0, 0.0, 1, 0.2, 2.0);
    }

    @Test
    void lightCurve_shouldBeOneOutOfTransit() {
        double[] flux = model.lightCurve(new double[]{0.5, 0.75, 1.5, -0.6}, 0.0, params(0.1, 8.0, 89.0, 0.65, 0.08));

        for (double f : flux) {
            assertEquals(1.0, f, 0.0);
        }
    }

    @Test
    void lightCurve_shouldHaveDepthRpSquaredForUniformDiscAtCentre() {
        double[] flux = model.lightCurve(new double[]{0.0}, 0.0, params(0.1, 8.0, 90.0, 0.0, 0.0));

        assertEquals(1.0 - 0.01, flux[0], 1e-12);
    }

    @Test
    void lightCurve_shouldBeDeeperThanRpSquaredWithLimbDarkening() {
        double[] flux = model.lightCurve(new double[]{0.0}, 0.0, params(0.1, 8.0, 90.0, 0.65, 0.08));

        assertTrue(1.0 - flux[0] > 0.01);
        assertTrue(1.0 - flux[0] < 0.02);
    }

    @Test
    void lightCurve_shouldBeSymmetricAroundCentreForCircularOrbit() {
        ModelParams p = params(0.1, 8.0, 89.0, 0.65, 0.08);
        double t0 = 2454833.59;
        double[] dt = {0.01, 0.03, 0.05, 0.06, 0.08};
        double[] before = new double[dt.length];
        double[] after = new double[dt.length];
        for (int i = 0; i < dt.length; i++) {
            before[i] = t0 - dt[i];
            after[i] = t0 + dt[i];
        }

        double[] fb = model.lightCurve(before, t0, p);
        double[] fa = model.lightCurve(after, t0, p);

        for (int i = 0; i < dt.length; i++) {
            assertEquals(fb[i], fa[i], 1e-8);
        }
    }

    @Test
    void lightCurve_shouldDeepenTowardsCentre() {
        ModelParams p = params(0.1, 8.0, 89.0, 0.65, 0.08);

        double[] flux = model.lightCurve(new double[]{0.0, 0.03, 0.055, 0.2}, 0.0, p);

        assertTrue(flux[0] < flux[1]);
        assertTrue(flux[1] < flux[2]);
        assertTrue(flux[2] < flux[3]);
        assertEquals(1.0, flux[3], 0.0);
    }

    @Test
    void lightCurve_shouldAverageExposureSubsamples() {
        ModelParams sharp = params(0.1, 8.0, 89.0, 0.65, 0.08);
        ModelParams smeared = new ModelParams(3.0, 0.1, 8.0, 89.0, 0.65, 0.08, 0.0, 90.0, 0.02, 15, 0.2, 2.0);
        double ingress = 0.062;

        double a = model.lightCurve(new double[]{ingress}, 0.0, sharp)[0];
        double b = model.lightCurve(new double[]{ingress}, 0.0, smeared)[0];

        assertTrue(Math.abs(a - b) > 1e-6);
    }

    @Test
    void overlap_shouldCoverContainmentAndDisjointCases() {
        assertEquals(0.0, QuadraticTransitModel.overlap(1.0, 0.1, 1.2), 0.0);
        assertEquals(Math.PI * 0.01, QuadraticTransitModel.overlap(1.0, 0.1, 0.5), 1e-15);
        assertEquals(Math.PI * 0.25, QuadraticTransitModel.overlap(0.5, 0.9, 0.1), 1e-15);
        double partial = QuadraticTransitModel.overlap(1.0, 0.1, 1.0);
        assertTrue(partial > 0.0 && partial < Math.PI * 0.01);
    }

    @Test
    void lightCurve_shouldHandleEccentricOrbit() {
        ModelParams p = new ModelParams(3.0, 0.1, 8.0, 90.0, 0.0, 0.0, 0.2, 60.0, 0.0, 1, 0.2, 2.0);

        double[] flux = model.lightCurve(new double[]{0.0, 1.5}, 0.0, p);

        assertEquals(0.99, flux[0], 1e-9);
        assertEquals(1.0, flux[1], 0.0);
    }
}
