package com.transitbot.runner;

import com.transitbot.core.diagnostics.CauseCode;
import com.transitbot.core.diagnostics.Outcome;
import com.transitbot.data.LightCurveLoadException;
import com.transitbot.data.LightCurveLoader;
import com.transitbot.fit.EphemerisPredictor;
import com.transitbot.fit.GlobalShapeFitter;
import com.transitbot.fit.Residuals;
import com.transitbot.fit.Segment;
import com.transitbot.fit.SmoothedMinimum;
import com.transitbot.fit.TimingFitter;
import com.transitbot.fit.TransitModel;
import com.transitbot.model.FittedTransit;
import com.transitbot.model.LightCurve;
import com.transitbot.model.LightCurveRecord;
import com.transitbot.model.ModelParams;
import com.transitbot.model.PhysicalParams;
import com.transitbot.model.TransitRecord;
import com.transitbot.output.TransitPlot;
import com.transitbot.output.TransitPlotRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Processes one light-curve file: predicts its transits, decides which of them still need
 * work, fits and plots those, and builds the summary records.
 *
 * <p>The failure ledger is not touched here. Indices that fail in this run are returned in
 * {@link FileResult#newlyFailed} for the caller to persist.
 */
public class FilePipeline {
    private static final Logger LOG = LogManager.getLogger(FilePipeline.class);

    static final int MIN_SEARCH_SAMPLES = 10;
    static final double SEARCH_WINDOW_FACTOR = 2.0;
    static final double MIN_SEARCH_HALF_WIDTH = 0.5;
    static final double PLOT_WINDOW_FACTOR = 1.25;
    static final double MINUTES_PER_DAY = 24.0 * 60.0;

    private final LightCurveLoader loader;
    private final EphemerisPredictor ephemeris;
    private final GlobalShapeFitter shapeFitter;
    private final TimingFitter timingFitter;
    private final TransitModel model;
    private final TransitPlotRenderer renderer;
    private final PipelineOptions options;
    private final ExecutorService executor;

    public FilePipeline(
            LightCurveLoader loader,
            TransitModel model,
            TransitPlotRenderer renderer,
            PipelineOptions options,
            ExecutorService executor
    ) {
        this.loader = loader;
        this.model = model;
        this.renderer = renderer;
        this.options = options == null ? PipelineOptions.builder().build() : options;
        this.executor = executor;
        this.ephemeris = new EphemerisPredictor();
        this.shapeFitter = new GlobalShapeFitter(model);
        this.timingFitter = new TimingFitter(model);
    }

    public static String plotFileName(String stem, int transitIndex) {
        return String.format(Locale.ROOT, "%s_transit_%03d.png", stem, transitIndex);
    }

    /**
     * A failure while fitting or plotting one transit marks only that transit as failed.
     *
     * @param previouslyFailed 1-based indices the ledger already holds for this file
     * @throws IOException when the calling thread is interrupted while waiting for workers
     */
    public FileResult process(Path file, Path outputDir, Set<Integer> previouslyFailed) throws IOException {
        String name = file.getFileName().toString();
        LOG.info("Processing {}", name);

        LightCurve lc;
        try {
            lc = loader.load(file);
        } catch (LightCurveLoadException e) {
            LOG.error("Failed to load {}: {}", file, e.getMessage());
            return FileResult.skipped(name, CauseCode.LOAD_FAILED);
        }

        PhysicalParams physical = lc.params;
        if (!physical.hasEphemeris()) {
            LOG.error("Missing period or epoch in {}", name);
            return FileResult.skipped(name, CauseCode.MISSING_PARAMETER);
        }

        double[] expected = ephemeris.expectedTransitTimes(lc.time, physical.getEpoch(), physical.getPeriod());
        if (expected.length == 0) {
            LOG.warn("No transits found in data range for {}", name);
            return FileResult.skipped(name, CauseCode.NO_EVENTS);
        }
        LOG.info("Found {} expected transits", expected.length);

        ModelParams seed = ModelParams.from(physical, options.getMaxTtvDays());
        Set<Integer> failedBefore = previouslyFailed == null ? Set.of() : previouslyFailed;

        List<Integer> pending = new ArrayList<>();
        List<Integer> skippedFailed = new ArrayList<>();
        for (int i = 0; i < expected.length; i++) {
            int index = i + 1;
            if (!options.isForce()) {
                if (Files.exists(outputDir.resolve(plotFileName(lc.stem(), index)))) {
                    continue;
                }
                if (failedBefore.contains(index)) {
                    LOG.debug("Transit {}: previously failed, skipping", index);
                    skippedFailed.add(index);
                    continue;
                }
            }
            pending.add(index);
        }

        if (pending.isEmpty() && skippedFailed.isEmpty()) {
            LOG.info("All {} plots already exist, skipping {}", expected.length, name);
            return new FileResult(name, List.of(), curveRecord(lc, expected, 0, seed), List.of(), 0, CauseCode.NONE);
        }
        if (!pending.isEmpty()) {
            LOG.info("{} of {} plots need to be generated", pending.size(), expected.length);
        }

        ModelParams shaped = seed;
        if (!pending.isEmpty() && !options.isSkipFitting()) {
            LOG.info("Performing global parameter fit...");
            double[] shape = shapeFitter.fit(lc.time, lc.flux, seed, expected);
            shaped = seed.withShape(shape[0], shape[1]);
            LOG.info(String.format(Locale.US, "Global fit: rp=%.6f, a=%.6f", shaped.rp, shaped.a));
        }

        List<TransitRecord> records = new ArrayList<>();
        for (int index : skippedFailed) {
            records.add(emptyRecord(lc, index, expected[index - 1], shaped));
        }

        List<EventResult> results = runEvents(lc, expected, pending, shaped, outputDir);
        List<Integer> newlyFailed = new ArrayList<>();
        int plotted = 0;
        for (EventResult result : results) {
            records.add(result.record);
            if (result.failed) {
                newlyFailed.add(result.record.getTransitIndex());
            } else {
                plotted++;
            }
        }

        if (!newlyFailed.isEmpty()) {
            LOG.info("Marked {} transits as failed for {}", newlyFailed.size(), name);
        }
        LOG.info("Generated {} plots for {}", plotted, name);
        return new FileResult(name, records, curveRecord(lc, expected, plotted, shaped), newlyFailed, plotted, CauseCode.NONE);
    }

    private List<EventResult> runEvents(LightCurve lc, double[] expected, List<Integer> pending,
                                        ModelParams shaped, Path outputDir) throws IOException {
        List<EventResult> results = new ArrayList<>(pending.size());
        if (executor == null || pending.size() < 2) {
            for (int index : pending) {
                results.add(processEventIsolated(lc, index, expected[index - 1], shaped, outputDir));
            }
            return results;
        }

        List<Future<EventResult>> futures = new ArrayList<>(pending.size());
        for (int index : pending) {
            double t0Expected = expected[index - 1];
            futures.add(executor.submit(() -> processEventIsolated(lc, index, t0Expected, shaped, outputDir)));
        }
        try {
            for (Future<EventResult> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new InterruptedIOException("Interrupted while processing " + lc.fileName);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Transit task failed for " + lc.fileName, cause);
        }
        return results;
    }

    EventResult processEventIsolated(LightCurve lc, int index, double t0Expected, ModelParams shaped, Path outputDir) {
        try {
            return processEvent(lc, index, t0Expected, shaped, outputDir);
        } catch (IOException e) {
            LOG.error("Transit {} of {}: could not write plot: {}", index, lc.fileName, e.getMessage(), e);
            discardPlot(outputDir.resolve(plotFileName(lc.stem(), index)));
            return EventResult.failed(emptyRecord(lc, index, t0Expected, shaped), CauseCode.PLOT_FAILED);
        } catch (RuntimeException e) {
            LOG.error("Transit {} of {}: {}", index, lc.fileName, e.getMessage(), e);
            discardPlot(outputDir.resolve(plotFileName(lc.stem(), index)));
            return EventResult.failed(emptyRecord(lc, index, t0Expected, shaped), CauseCode.EVENT_ERROR);
        }
    }

    // A half-written plot would otherwise count as done on the next run.
    private static void discardPlot(Path plot) {
        try {
            Files.deleteIfExists(plot);
        } catch (IOException e) {
            LOG.warn("Could not remove incomplete plot {}: {}", plot, e.getMessage());
        }
    }

    EventResult processEvent(LightCurve lc, int index, double t0Expected, ModelParams shaped, Path outputDir)
            throws IOException {
        LOG.debug("Processing transit {} of {}", index, lc.fileName);
        double duration = shaped.duration;

        Segment search = Segment.around(lc.time, lc.flux, t0Expected,
                Math.max(duration * SEARCH_WINDOW_FACTOR, MIN_SEARCH_HALF_WIDTH));
        if (search.size() < MIN_SEARCH_SAMPLES) {
            LOG.warn("Transit {}: insufficient data points ({})", index, search.size());
            return EventResult.failed(emptyRecord(lc, index, t0Expected, shaped), CauseCode.INSUFFICIENT_DATA);
        }

        Double t0Fitted = null;
        if (!options.isSkipFitting()) {
            double t0Initial = SmoothedMinimum.initialT0(search.time, search.flux);
            Outcome<FittedTransit> fit = timingFitter.fit(search, shaped, t0Initial);
            if (!fit.success) {
                LOG.warn("Transit {}: timing fit failed ({})", index, fit.causeCode);
                return EventResult.failed(emptyRecord(lc, index, t0Expected, shaped), fit.causeCode);
            }
            t0Fitted = fit.value.t0;
        }

        double center = t0Fitted != null ? t0Fitted : t0Expected;
        Segment window = Segment.between(lc.time, lc.flux, center, duration * PLOT_WINDOW_FACTOR);
        if (window.isEmpty()) {
            LOG.warn("Transit {}: no data in plot window", index);
            return EventResult.failed(emptyRecord(lc, index, t0Expected, shaped), CauseCode.NO_PLOT_DATA);
        }

        double[] modelFlux = null;
        Double rms = null;
        Double ttv = null;
        if (t0Fitted != null) {
            modelFlux = model.lightCurve(window.time, t0Fitted, shaped);
            rms = Residuals.rms(window.flux, modelFlux);
            ttv = (t0Fitted - t0Expected) * MINUTES_PER_DAY;
        }

        String plotFile = plotFileName(lc.stem(), index);
        TransitPlot plot = TransitPlot.builder()
                .time(window.time)
                .flux(window.flux)
                .model(modelFlux)
                .t0Fitted(t0Fitted)
                .t0Expected(t0Expected)
                .ttvMinutes(ttv)
                .rmsResiduals(rms)
                .transitIndex(index)
                .build();
        renderer.render(plot, outputDir.resolve(plotFile));
        LOG.debug("Saved {}", plotFile);

        TransitRecord record = emptyRecord(lc, index, t0Expected, shaped).toBuilder()
                .t0Fitted(t0Fitted)
                .ttvMinutes(ttv)
                .rmsResiduals(rms)
                .plotFile(plotFile)
                .build();
        return EventResult.done(record);
    }

    private static TransitRecord emptyRecord(LightCurve lc, int index, double t0Expected, ModelParams shaped) {
        return TransitRecord.builder()
                .file(lc.fileName)
                .transitIndex(index)
                .t0Expected(t0Expected)
                .rpFitted(shaped.rp)
                .aFitted(shaped.a)
                .period(shaped.period)
                .duration(shaped.duration)
                .inc(shaped.inc)
                .u1(shaped.u1)
                .u2(shaped.u2)
                .build();
    }

    private static LightCurveRecord curveRecord(LightCurve lc, double[] expected, int found, ModelParams shaped) {
        return LightCurveRecord.builder()
                .file(lc.fileName)
                .timeMin(lc.timeMin())
                .timeMax(lc.timeMax())
                .expectedTransits(expected.length)
                .foundTransits(found)
                .dataType(lc.dataType)
                .period(shaped.period)
                .epoch(lc.params.getEpoch())
                .duration(shaped.duration)
                .rp(shaped.rp)
                .a(shaped.a)
                .inc(shaped.inc)
                .u1(shaped.u1)
                .u2(shaped.u2)
                .build();
    }

    static final class EventResult {
        final TransitRecord record;
        final boolean failed;
        final CauseCode causeCode;

        private EventResult(TransitRecord record, boolean failed, CauseCode causeCode) {
            this.record = record;
            this.failed = failed;
            this.causeCode = causeCode;
        }

        static EventResult done(TransitRecord record) {
            return new EventResult(record, false, CauseCode.NONE);
        }

        static EventResult failed(TransitRecord record, CauseCode causeCode) {
            return new EventResult(record, true, causeCode);
        }
    }
}
