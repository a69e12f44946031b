package com.analyzer.report.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analyzer.report.cli.exception.OptionsValidationException;
import com.analyzer.report.cli.model.SummarizeOptions;
import com.analyzer.report.cli.model.ValidatedSummarizeOptions;
import com.analyzer.report.cli.output.SummaryResultsPrinter;
import com.analyzer.report.cli.validation.SummarizeOptionsValidator;
import com.analyzer.report.replay.DiagnosticsLogReader;
import com.analyzer.report.replay.ReplayResult;
import com.analyzer.report.report.SummaryReportFormatter;
import com.analyzer.report.reporter.SummaryReporter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that replays diagnostics logs into one summary and prints the report.
 */
@Command(
        name = "analyzer-report",
        mixinStandardHelpOptions = true,
        version = "analyzer-report 1.0.0",
        description = "Summarizes checker diagnostics per package and prints them as a table."
)
public class SummarizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SummarizeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Mixin
    private SummarizeOptions options;

    @Spec
    private CommandSpec spec;

    private final SummarizeOptionsValidator validator = new SummarizeOptionsValidator();
    private final SummaryResultsPrinter printer = new SummaryResultsPrinter();

    @Override
    public Integer call() {
        ValidatedSummarizeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return EXIT_USAGE;
        }

        try {
            printer.printBanner(validated);

            SummaryReporter reporter = new SummaryReporter(validated.getReporterConfig());
            DiagnosticsLogReader reader = new DiagnosticsLogReader();
            int replayErrors = 0;
            for (Path logFile : validated.getLogFiles()) {
                ReplayResult result = reader.replay(logFile, reporter);
                printer.printReplay(logFile, result);
                replayErrors += result.getErrors().size();
            }

            String report = SummaryReportFormatter.summaryToString(reporter.getResult(), validated.getFormat());
            printer.printReport(spec.commandLine().getOut(), report);

            if (replayErrors > 0 && validated.isFailOnReplayErrors()) {
                log.error("{} diagnostics line(s) could not be replayed", replayErrors);
                return EXIT_FAILURE;
            }
            return EXIT_OK;

        } catch (IOException e) {
            log.error("Failed to read diagnostics log", e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Report failed with exception", e);
            return EXIT_FAILURE;
        }
    }
}
