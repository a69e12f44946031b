package com.analyzer.report.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.analyzer.report.report.ReportFormat;
import com.analyzer.report.reporter.ReporterConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps SummarizeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedSummarizeOptions {
    ReporterConfig reporterConfig;
    List<Path> logFiles;
    ReportFormat format;
    boolean failOnReplayErrors;
}
