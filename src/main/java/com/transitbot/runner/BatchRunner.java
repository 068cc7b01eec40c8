package com.transitbot.runner;

import com.transitbot.config.Config;
import com.transitbot.data.LightCurveLoader;
import com.transitbot.fit.TransitModel;
import com.transitbot.model.LightCurveRecord;
import com.transitbot.model.TransitRecord;
import com.transitbot.output.SummaryTableWriter;
import com.transitbot.output.TransitPlotRenderer;
import com.transitbot.state.FailureLedger;
import com.transitbot.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the file pipeline over a set of light-curve files and merges the results into the
 * summary tables. A failure in one file never stops the batch.
 */
public class BatchRunner {
    private static final Logger LOG = LogManager.getLogger(BatchRunner.class);

    private final Config config;
    private final LightCurveLoader loader;
    private final TransitModel model;
    private final TransitPlotRenderer renderer;
    private final SummaryTableWriter tableWriter;

    public BatchRunner(
            Config config,
            LightCurveLoader loader,
            TransitModel model,
            TransitPlotRenderer renderer,
            SummaryTableWriter tableWriter
    ) {
        this.config = config;
        this.loader = loader;
        this.model = model;
        this.renderer = renderer;
        this.tableWriter = tableWriter;
    }

    /**
     * Input files in processing order: the named files that exist, or every {@code *.csv} in
     * the input directory sorted by name.
     */
    public List<Path> listInputs(Path inputDir, List<String> names) throws IOException {
        List<Path> out = new ArrayList<>();
        if (names != null && !names.isEmpty()) {
            for (String name : names) {
                Path candidate = inputDir.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    out.add(candidate);
                } else {
                    LOG.warn("Input file not found, skipping: {}", candidate);
                }
            }
            return out;
        }
        if (!Files.isDirectory(inputDir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, "*.csv")) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    out.add(p);
                }
            }
        }
        out.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return out;
    }

    public BatchSummary run(List<String> names, boolean dryRun) throws IOException {
        StepTimer timer = new StepTimer();
        timer.start(StepTimer.TOTAL);

        timer.start(StepTimer.LOAD);
        Path inputDir = config.getPath(Config.INPUT_DIR);
        Path outputDir = config.getPath(Config.OUTPUT_DIR);
        List<Path> inputs = listInputs(inputDir, names);
        if (inputs.isEmpty()) {
            LOG.warn("No CSV files found in {}", inputDir);
            return BatchSummary.empty(outputDir);
        }
        LOG.info("Found {} CSV files to process", inputs.size());

        if (dryRun) {
            for (Path p : inputs) {
                LOG.info("  {}", p.getFileName());
            }
            return new BatchSummary(inputs, 0, 0, 0, outputDir.resolve(config.getString(Config.TRANSITS_FILE)), true);
        }

        Files.createDirectories(outputDir);
        Path ledgerPath = outputDir.resolve(config.getString(Config.FAILED_FILE));
        FailureLedger ledger = FailureLedger.load(ledgerPath);
        timer.end(StepTimer.LOAD);

        List<TransitRecord> transitRecords = new ArrayList<>();
        List<LightCurveRecord> curveRecords = new ArrayList<>();
        int failedFiles = 0;

        int threads = Math.max(1, config.getInt(Config.FIT_THREADS));
        ExecutorService pool = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
        try {
            FilePipeline pipeline = new FilePipeline(loader, model, renderer, PipelineOptions.from(config), pool);
            timer.start(StepTimer.FIT);
            for (Path input : inputs) {
                String name = input.getFileName().toString();
                FileResult result;
                try {
                    result = pipeline.process(input, outputDir, ledger.failedFor(name));
                } catch (Exception e) {
                    failedFiles++;
                    LOG.error("Error processing {}: {}", input, e.getMessage(), e);
                    continue;
                }
                if (result.isSkipped()) {
                    LOG.info("Skipped {} ({})", name, result.causeCode);
                }
                transitRecords.addAll(result.transitRecords);
                if (result.curveRecord != null) {
                    curveRecords.add(result.curveRecord);
                }
                if (ledger.markFailed(name, result.newlyFailed)) {
                    ledger.save(ledgerPath);
                }
            }
            timer.end(StepTimer.FIT);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        timer.start(StepTimer.MERGE);
        Path transitsPath = outputDir.resolve(config.getString(Config.TRANSITS_FILE));
        Path curvesPath = outputDir.resolve(config.getString(Config.CURVES_FILE));
        if (tableWriter.mergeTransits(transitsPath, transitRecords) > 0) {
            LOG.info("Saved transit summary to {}", transitsPath);
        }
        if (tableWriter.mergeCurves(curvesPath, curveRecords) > 0) {
            LOG.info("Saved light curves to {}", curvesPath);
        }
        timer.end(StepTimer.MERGE);

        timer.end(StepTimer.TOTAL);
        LOG.info(timer.summaryText());
        return new BatchSummary(inputs, transitRecords.size(), curveRecords.size(), failedFiles, transitsPath, false);
    }
}
