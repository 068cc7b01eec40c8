package com.transitbot.runner;

import com.transitbot.core.diagnostics.CauseCode;
import com.transitbot.model.LightCurveRecord;
import com.transitbot.model.TransitRecord;

import java.util.List;

/**
 * What one light-curve file produced. {@code curveRecord} is null when processing stopped
 * before transit prediction succeeded; {@code causeCode} then says why.
 */
public final class FileResult {
    public final String file;
    public final List<TransitRecord> transitRecords;
    public final LightCurveRecord curveRecord;
    public final List<Integer> newlyFailed;
    public final int plotted;
    public final CauseCode causeCode;

    public FileResult(
            String file,
            List<TransitRecord> transitRecords,
            LightCurveRecord curveRecord,
            List<Integer> newlyFailed,
            int plotted,
            CauseCode causeCode
    ) {
        this.file = file;
        this.transitRecords = transitRecords == null ? List.of() : List.copyOf(transitRecords);
        this.curveRecord = curveRecord;
        this.newlyFailed = newlyFailed == null ? List.of() : List.copyOf(newlyFailed);
        this.plotted = plotted;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
    }

    public static FileResult skipped(String file, CauseCode causeCode) {
        return new FileResult(file, List.of(), null, List.of(), 0, causeCode);
    }

    public boolean isSkipped() {
        return curveRecord == null;
    }
}
