package com.analyzer.report.reporter;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for a {@link SummaryReporter}.
 */
@Value
@Builder
public class ReporterConfig {

    /**
     * Messages below this level are not summarized.
     */
    @NonNull
    @Builder.Default
    Level minimumLevel = Level.ALL;

    @NonNull
    @Builder.Default
    NoCurrentUnitPolicy noCurrentUnitPolicy = NoCurrentUnitPolicy.FAIL;

    public static ReporterConfig defaults() {
        return ReporterConfig.builder().build();
    }
}
