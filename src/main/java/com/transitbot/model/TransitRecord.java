package com.transitbot.model;

import com.transitbot.utils.NumberText;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One row of the per-transit table, keyed by (file, transitIndex).
 * Null fields are written as empty cells.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class TransitRecord {
    public static final List<String> COLUMNS = List.of(
            "file", "transit_index", "t0_expected", "t0_fitted", "ttv_minutes",
            "rp_fitted", "a_fitted", "rms_residuals", "period", "duration",
            "inc", "u1", "u2", "plot_file"
    );

    String file;
    int transitIndex;
    double t0Expected;
    Double t0Fitted;
    Double ttvMinutes;
    double rpFitted;
    double aFitted;
    Double rmsResiduals;
    double period;
    Double duration;
    double inc;
    double u1;
    double u2;
    String plotFile;

    public List<String> toRow() {
        return List.of(
                NumberText.orEmpty(file),
                String.valueOf(transitIndex),
                NumberText.format(t0Expected),
                NumberText.format(t0Fitted),
                NumberText.format(ttvMinutes),
                NumberText.format(rpFitted),
                NumberText.format(aFitted),
                NumberText.format(rmsResiduals),
                NumberText.format(period),
                NumberText.format(duration),
                NumberText.format(inc),
                NumberText.format(u1),
                NumberText.format(u2),
                NumberText.orEmpty(plotFile)
        );
    }
}
