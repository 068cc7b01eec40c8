package com.transitbot.runner;

import com.transitbot.config.Config;
import com.transitbot.data.LightCurveLoadException;
import com.transitbot.data.LightCurveLoader;
import com.transitbot.model.DataType;
import com.transitbot.model.LightCurve;
import com.transitbot.output.SummaryTableWriter;
import com.transitbot.state.FailureLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchRunnerTest {

    @TempDir
    Path workDir;

    private Path inputDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectories(workDir.resolve("data"));
        outputDir = workDir.resolve("plots");
    }

    private Config config(Map<String, String> extra) {
        Config config = Config.of(workDir, Map.of(Config.INPUT_DIR, "data", Config.OUTPUT_DIR, "plots"));
        extra.forEach(config::override);
        return config;
    }

    private void touch(String name) throws Exception {
        Files.writeString(inputDir.resolve(name), "placeholder", StandardCharsets.UTF_8);
    }

    // Files named "broken*" blow up, "gap*" lose the samples around the third transit.
    private static LightCurveLoader loader() {
        return file -> {
            String name = file.getFileName().toString();
            if (name.startsWith("broken")) {
                throw new IllegalStateException("unexpected content in " + name);
            }
            if (name.startsWith("unreadable")) {
                throw new LightCurveLoadException("no data header in " + name);
            }
            double[] time = FilePipelineTest.grid();
            if (name.startsWith("gap")) {
                List<Double> kept = new ArrayList<>();
                for (double t : time) {
                    if (Math.abs(t - FilePipelineTest.CENTRES[2]) >= 0.46) {
                        kept.add(t);
                    }
                }
                time = kept.stream().mapToDouble(Double::doubleValue).toArray();
            }
            double[] flux = FilePipelineTest.dips(time, FilePipelineTest.CENTRES);
            return new LightCurve(name, time, flux, FilePipelineTest.header(), DataType.SIMULATED);
        };
    }

    private BatchRunner runner(Config config) {
        return new BatchRunner(config, loader(), FilePipelineTest.DIP_MODEL,
                new FilePipelineTest.RecordingRenderer(), new SummaryTableWriter());
    }

    @Test
    void listInputs_shouldSortCsvFilesAndHonourNames() throws Exception {
        touch("b.csv");
        touch("a.csv");
        touch("notes.txt");
        BatchRunner runner = runner(config(Map.of()));

        List<Path> all = runner.listInputs(inputDir, List.of());
        List<Path> named = runner.listInputs(inputDir, List.of("b.csv", "missing.csv"));

        assertEquals(List.of(inputDir.resolve("a.csv"), inputDir.resolve("b.csv")), all);
        assertEquals(List.of(inputDir.resolve("b.csv")), named);
    }

    @Test
    void run_shouldWriteNothingOnDryRun() throws Exception {
        touch("a.csv");

        BatchSummary summary = runner(config(Map.of())).run(List.of(), true);

        assertTrue(summary.dryRun);
        assertEquals(1, summary.inputs.size());
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void run_shouldIsolateFailingFiles() throws Exception {
        touch("a.csv");
        touch("broken.csv");
        touch("unreadable.csv");
        Config config = config(Map.of(Config.FIT_SKIP, "true"));

        BatchSummary summary = runner(config).run(List.of(), false);

        assertEquals(3, summary.inputs.size());
        assertEquals(1, summary.failedFiles);
        assertEquals(4, summary.transitRecords);
        assertEquals(1, summary.curveRecords);
        List<String> curves = Files.readAllLines(outputDir.resolve("curves.csv"), StandardCharsets.UTF_8);
        assertEquals(2, curves.size());
        assertTrue(curves.get(1).startsWith("a.csv,"));
        assertEquals(5, Files.readAllLines(summary.summaryPath, StandardCharsets.UTF_8).size());
    }

    @Test
    void run_shouldPersistNewFailuresAndSkipThemNextTime() throws Exception {
        touch("gap.csv");
        Config config = config(Map.of(Config.FIT_SKIP, "true"));

        runner(config).run(List.of(), false);

        FailureLedger ledger = FailureLedger.load(outputDir.resolve("_failed_transits.json"));
        assertEquals(Set.of(3), ledger.failedFor("gap.csv"));

        BatchSummary second = runner(config).run(List.of(), false);
        assertEquals(1, second.transitRecords);
        List<String> rows = Files.readAllLines(outputDir.resolve("transits.csv"), StandardCharsets.UTF_8);
        assertEquals(5, rows.size());
        assertTrue(rows.get(3).startsWith("gap.csv,3,"));
        assertTrue(rows.get(3).endsWith(","));
    }

    @Test
    void run_shouldReturnEmptySummaryWithoutInputs() throws Exception {
        BatchSummary summary = runner(config(Map.of())).run(List.of(), false);

        assertTrue(summary.inputs.isEmpty());
        assertEquals(0, summary.transitRecords);
        assertFalse(Files.exists(outputDir.resolve("transits.csv")));
    }
}
