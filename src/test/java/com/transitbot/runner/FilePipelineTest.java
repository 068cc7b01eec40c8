package com.transitbot.runner;

import com.transitbot.core.diagnostics.CauseCode;
import com.transitbot.data.LightCurveLoadException;
import com.transitbot.data.LightCurveLoader;
import com.transitbot.fit.TransitModel;
import com.transitbot.model.DataType;
import com.transitbot.model.LightCurve;
import com.transitbot.model.PhysicalParams;
import com.transitbot.model.TransitRecord;
import com.transitbot.output.TransitPlot;
import com.transitbot.output.TransitPlotRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilePipelineTest {

    static final double PERIOD = 2.36;
    static final double EPOCH = 2454833.59;
    static final double[] CENTRES = {2454833.59, 2454835.95, 2454838.31, 2454840.67};

    @TempDir
    Path outputDir;

    /** Gaussian dip whose depth follows rp and whose width shrinks with a. */
    static final TransitModel DIP_MODEL = (time, t0, p) -> {
        double width = 0.4 / p.a;
        double[] out = new double[time.length];
        for (int i = 0; i < time.length; i++) {
            double z = (time[i] - t0) / width;
            out[i] = 1.0 - p.rp * p.rp * Math.exp(-z * z);
        }
        return out;
    };

    static class RecordingRenderer implements TransitPlotRenderer {
        final List<TransitPlot> plots = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void render(TransitPlot plot, Path output) throws IOException {
            plots.add(plot);
            Files.createDirectories(output.getParent());
            Files.write(output, new byte[]{1});
        }
    }

    static double[] grid() {
        double[] t = new double[1001];
        for (int i = 0; i < t.length; i++) {
            t[i] = 2454833.0 + i * 0.01;
        }
        return t;
    }

    static double[] dips(double[] time, double[] centres) {
        double[] flux = new double[time.length];
        Arrays.fill(flux, 1.0);
        for (double c : centres) {
            for (int i = 0; i < time.length; i++) {
                double z = (time[i] - c) / 0.05;
                flux[i] -= 0.01 * Math.exp(-z * z);
            }
        }
        return flux;
    }

    static PhysicalParams header() {
        return PhysicalParams.builder()
                .period(PERIOD)
                .epoch(EPOCH)
                .radiusRatio(0.1)
                .axisRatio(8.0)
                .duration(0.2)
                .build();
    }

    static LightCurveLoader loaderOf(LightCurve lc) {
        return file -> lc;
    }

    private static LightCurve curve(double[] time, double[] flux, PhysicalParams params) {
        return new LightCurve("sim_01.csv", time, flux, params, DataType.SIMULATED);
    }

    private FilePipeline pipeline(LightCurve lc, RecordingRenderer renderer, PipelineOptions options) {
        return new FilePipeline(loaderOf(lc), DIP_MODEL, renderer, options, null);
    }

    private static PipelineOptions skipFitting() {
        return PipelineOptions.builder().skipFitting(true).build();
    }

    @Test
    void plotFileName_shouldZeroPadIndex() {
        assertEquals("sim_01_transit_007.png", FilePipeline.plotFileName("sim_01", 7));
        assertEquals("x_transit_123.png", FilePipeline.plotFileName("x", 123));
    }

    @Test
    void process_shouldPlotEveryTransitWhenSkippingFit() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        RecordingRenderer renderer = new RecordingRenderer();

        FileResult result = pipeline(lc, renderer, skipFitting()).process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(4, result.transitRecords.size());
        assertEquals(4, result.plotted);
        assertEquals(4, result.curveRecord.getExpectedTransits());
        assertEquals(4, result.curveRecord.getFoundTransits());
        assertTrue(result.newlyFailed.isEmpty());
        for (int i = 0; i < 4; i++) {
            TransitRecord r = result.transitRecords.get(i);
            assertEquals(i + 1, r.getTransitIndex());
            assertEquals(CENTRES[i], r.getT0Expected(), 1e-9);
            assertNull(r.getT0Fitted());
            assertNull(r.getTtvMinutes());
            assertEquals(FilePipeline.plotFileName("sim_01", i + 1), r.getPlotFile());
            assertTrue(Files.exists(outputDir.resolve(r.getPlotFile())));
        }
        assertFalse(renderer.plots.get(0).hasModel());
    }

    @Test
    void process_shouldSkipFileWhenAllPlotsExist() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        pipeline(lc, new RecordingRenderer(), skipFitting()).process(Path.of("sim_01.csv"), outputDir, Set.of());

        RecordingRenderer second = new RecordingRenderer();
        FileResult result = pipeline(lc, second, PipelineOptions.builder().build())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertTrue(result.transitRecords.isEmpty());
        assertNotNull(result.curveRecord);
        assertEquals(0, result.curveRecord.getFoundTransits());
        assertEquals(4, result.curveRecord.getExpectedTransits());
        assertTrue(second.plots.isEmpty());
    }

    @Test
    void process_shouldNotRetryPreviouslyFailedTransits() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        RecordingRenderer renderer = new RecordingRenderer();

        FileResult result = pipeline(lc, renderer, skipFitting()).process(Path.of("sim_01.csv"), outputDir, Set.of(2));

        assertEquals(4, result.transitRecords.size());
        assertEquals(3, result.plotted);
        assertEquals(3, renderer.plots.size());
        assertTrue(result.newlyFailed.isEmpty());
        TransitRecord skipped = result.transitRecords.get(0);
        assertEquals(2, skipped.getTransitIndex());
        assertNull(skipped.getPlotFile());
        assertNull(skipped.getT0Fitted());
        assertFalse(Files.exists(outputDir.resolve(FilePipeline.plotFileName("sim_01", 2))));
    }

    @Test
    void process_shouldRedoEverythingWhenForced() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        pipeline(lc, new RecordingRenderer(), skipFitting()).process(Path.of("sim_01.csv"), outputDir, Set.of());

        RecordingRenderer renderer = new RecordingRenderer();
        PipelineOptions forced = PipelineOptions.builder().skipFitting(true).force(true).build();
        FileResult result = pipeline(lc, renderer, forced).process(Path.of("sim_01.csv"), outputDir, Set.of(2));

        assertEquals(4, renderer.plots.size());
        assertEquals(4, result.plotted);
        assertEquals(4, result.curveRecord.getFoundTransits());
    }

    @Test
    void process_shouldFailTransitWithTooFewSamples() throws Exception {
        double[] full = grid();
        List<Double> kept = new ArrayList<>();
        for (double t : full) {
            if (Math.abs(t - CENTRES[2]) >= 0.46) {
                kept.add(t);
            }
        }
        double[] time = kept.stream().mapToDouble(Double::doubleValue).toArray();
        LightCurve lc = curve(time, dips(time, CENTRES), header());

        FileResult result = pipeline(lc, new RecordingRenderer(), skipFitting())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(List.of(3), result.newlyFailed);
        assertEquals(3, result.plotted);
        assertEquals(4, result.transitRecords.size());
        TransitRecord failed = result.transitRecords.get(2);
        assertEquals(3, failed.getTransitIndex());
        assertNull(failed.getPlotFile());
    }

    @Test
    void process_shouldFitTimingAndReportTtv() throws Exception {
        double[] time = grid();
        double[] shifted = CENTRES.clone();
        shifted[2] += 0.002;
        LightCurve lc = curve(time, dips(time, shifted), header());
        RecordingRenderer renderer = new RecordingRenderer();

        FileResult result = pipeline(lc, renderer, PipelineOptions.builder().build())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(4, result.plotted);
        assertTrue(result.newlyFailed.isEmpty());
        TransitRecord first = result.transitRecords.get(0);
        TransitRecord third = result.transitRecords.get(2);
        assertNotNull(first.getT0Fitted());
        assertEquals(0.0, first.getTtvMinutes(), 0.5);
        assertEquals(0.002 * 1440.0, third.getTtvMinutes(), 0.5);
        assertNotNull(third.getRmsResiduals());
        assertTrue(renderer.plots.get(2).hasModel());
        assertEquals(0.1, result.curveRecord.getRp(), 0.02);
    }

    @Test
    void process_shouldMarkTransitFailedWhenWindowHasNoSignal() throws Exception {
        double[] time = grid();
        double[] flux = dips(time, new double[]{CENTRES[0], CENTRES[2], CENTRES[3]});
        for (int i = 0; i < time.length; i++) {
            if (Math.abs(time[i] - CENTRES[1]) < 0.6) {
                flux[i] = 1.0;
            }
        }
        LightCurve lc = curve(time, flux, header());
        RecordingRenderer renderer = new RecordingRenderer();

        FileResult result = pipeline(lc, renderer, PipelineOptions.builder().build())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(List.of(2), result.newlyFailed);
        assertEquals(3, result.plotted);
        assertEquals(3, renderer.plots.size());
    }

    @Test
    void process_shouldSkipFileWithoutPeriod() throws Exception {
        double[] time = grid();
        PhysicalParams noPeriod = header().toBuilder().period(null).build();
        LightCurve lc = curve(time, dips(time, CENTRES), noPeriod);

        FileResult result = pipeline(lc, new RecordingRenderer(), skipFitting())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertTrue(result.isSkipped());
        assertEquals(CauseCode.MISSING_PARAMETER, result.causeCode);
        assertTrue(result.transitRecords.isEmpty());
    }

    @Test
    void process_shouldSkipFileWhenNoTransitFallsInRange() throws Exception {
        double[] time = {2454833.70, 2454833.71, 2454833.72};
        LightCurve lc = curve(time, new double[]{1.0, 1.0, 1.0}, header());

        FileResult result = pipeline(lc, new RecordingRenderer(), skipFitting())
                .process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(CauseCode.NO_EVENTS, result.causeCode);
        assertNull(result.curveRecord);
    }

    @Test
    void process_shouldSkipUnreadableFile() throws Exception {
        LightCurveLoader broken = file -> {
            throw new LightCurveLoadException("no data header in " + file);
        };
        FilePipeline p = new FilePipeline(broken, DIP_MODEL, new RecordingRenderer(), skipFitting(), null);

        FileResult result = p.process(Path.of("bad.csv"), outputDir, Set.of());

        assertEquals(CauseCode.LOAD_FAILED, result.causeCode);
        assertEquals("bad.csv", result.file);
    }

    // Writes a partial file for the given transit and then fails, like a full disk would.
    static final class FailingOnIndexRenderer extends RecordingRenderer {
        private final int failingIndex;
        private final RuntimeException runtimeFailure;

        FailingOnIndexRenderer(int failingIndex, RuntimeException runtimeFailure) {
            this.failingIndex = failingIndex;
            this.runtimeFailure = runtimeFailure;
        }

        @Override
        public void render(TransitPlot plot, Path output) throws IOException {
            if (plot.getTransitIndex() == failingIndex) {
                Files.write(output, new byte[]{0});
                if (runtimeFailure != null) {
                    throw runtimeFailure;
                }
                throw new IOException("disk full");
            }
            super.render(plot, output);
        }
    }

    @Test
    void process_shouldKeepOtherTransitsWhenOnePlotCannotBeWritten() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        FilePipeline p = new FilePipeline(loaderOf(lc), DIP_MODEL, new FailingOnIndexRenderer(3, null), skipFitting(), null);

        FileResult result = p.process(Path.of("sim_01.csv"), outputDir, Set.of());

        assertEquals(4, result.transitRecords.size());
        assertEquals(3, result.plotted);
        assertEquals(List.of(3), result.newlyFailed);
        assertEquals(3, result.curveRecord.getFoundTransits());
        for (int i : new int[]{0, 1, 3}) {
            TransitRecord r = result.transitRecords.get(i);
            assertEquals(FilePipeline.plotFileName("sim_01", i + 1), r.getPlotFile());
        }
        TransitRecord failed = result.transitRecords.get(2);
        assertEquals(3, failed.getTransitIndex());
        assertNull(failed.getPlotFile());
        assertFalse(Files.exists(outputDir.resolve(FilePipeline.plotFileName("sim_01", 3))));
    }

    @Test
    void process_shouldRecordFailedPlotForLedgerOnNextRun() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        FilePipeline first = new FilePipeline(loaderOf(lc), DIP_MODEL, new FailingOnIndexRenderer(3, null), skipFitting(), null);
        FileResult firstResult = first.process(Path.of("sim_01.csv"), outputDir, Set.of());

        RecordingRenderer renderer = new RecordingRenderer();
        FileResult second = pipeline(lc, renderer, skipFitting())
                .process(Path.of("sim_01.csv"), outputDir, Set.copyOf(firstResult.newlyFailed));

        assertTrue(renderer.plots.isEmpty());
        assertEquals(1, second.transitRecords.size());
        assertEquals(3, second.transitRecords.get(0).getTransitIndex());
    }

    @Test
    void process_shouldIsolateUnexpectedErrorInOneTransitWithWorkerPool() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            FilePipeline p = new FilePipeline(loaderOf(lc), DIP_MODEL,
                    new FailingOnIndexRenderer(2, new IllegalStateException("bad axis range")), skipFitting(), pool);

            FileResult result = p.process(Path.of("sim_01.csv"), outputDir, Set.of());

            assertEquals(List.of(2), result.newlyFailed);
            assertEquals(3, result.plotted);
            assertEquals(4, result.transitRecords.size());
            assertNull(result.transitRecords.get(1).getPlotFile());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void process_shouldKeepTransitOrderWithWorkerPool() throws Exception {
        double[] time = grid();
        LightCurve lc = curve(time, dips(time, CENTRES), header());
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            FilePipeline p = new FilePipeline(loaderOf(lc), DIP_MODEL, new RecordingRenderer(), skipFitting(), pool);

            FileResult result = p.process(Path.of("sim_01.csv"), outputDir, Set.of());

            assertEquals(4, result.plotted);
            for (int i = 0; i < 4; i++) {
                assertEquals(i + 1, result.transitRecords.get(i).getTransitIndex());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
