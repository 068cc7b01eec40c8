package com.transitbot.runner;

import com.transitbot.config.Config;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-run switches of the file pipeline.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class PipelineOptions {
    boolean skipFitting;
    boolean force;
    @Builder.Default
    double maxTtvDays = 2.0;

    public static PipelineOptions from(Config config) {
        return PipelineOptions.builder()
                .skipFitting(config.getBoolean(Config.FIT_SKIP))
                .force(config.getBoolean(Config.FIT_FORCE))
                .maxTtvDays(config.getDouble(Config.FIT_MAX_TTV_DAYS))
                .build();
    }
}
