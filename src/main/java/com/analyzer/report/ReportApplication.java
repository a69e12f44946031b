package com.analyzer.report;

import com.analyzer.report.cli.SummarizeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the analyzer report tool.
 * Replays checker diagnostics logs and prints the per-package summary table.
 */
public class ReportApplication {

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new SummarizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }
}
