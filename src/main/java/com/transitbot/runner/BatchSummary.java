package com.transitbot.runner;

import java.nio.file.Path;
import java.util.List;

public final class BatchSummary {
    public final List<Path> inputs;
    public final int transitRecords;
    public final int curveRecords;
    public final int failedFiles;
    public final Path summaryPath;
    public final boolean dryRun;

    public BatchSummary(List<Path> inputs, int transitRecords, int curveRecords, int failedFiles,
                        Path summaryPath, boolean dryRun) {
        this.inputs = inputs == null ? List.of() : List.copyOf(inputs);
        this.transitRecords = transitRecords;
        this.curveRecords = curveRecords;
        this.failedFiles = failedFiles;
        this.summaryPath = summaryPath;
        this.dryRun = dryRun;
    }

    static BatchSummary empty(Path outputDir) {
        return new BatchSummary(List.of(), 0, 0, 0, outputDir, false);
    }
}
