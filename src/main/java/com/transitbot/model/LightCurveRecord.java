package com.transitbot.model;

import com.transitbot.utils.NumberText;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One row of the per-file table, keyed by file name.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class LightCurveRecord {
    public static final List<String> COLUMNS = List.of(
            "file", "time_min", "time_max", "expected_transits", "found_transits",
            "data_type", "period", "epoch", "duration", "rp", "a", "inc", "u1", "u2"
    );

    String file;
    double timeMin;
    double timeMax;
    int expectedTransits;
    int foundTransits;
    DataType dataType;
    double period;
    double epoch;
    Double duration;
    double rp;
    double a;
    double inc;
    double u1;
    double u2;

    public List<String> toRow() {
        return List.of(
                NumberText.orEmpty(file),
                NumberText.format(timeMin),
                NumberText.format(timeMax),
                String.valueOf(expectedTransits),
                String.valueOf(foundTransits),
                dataType == null ? "" : dataType.label(),
                NumberText.format(period),
                NumberText.format(epoch),
                NumberText.format(duration),
                NumberText.format(rp),
                NumberText.format(a),
                NumberText.format(inc),
                NumberText.format(u1),
                NumberText.format(u2)
        );
    }
}
