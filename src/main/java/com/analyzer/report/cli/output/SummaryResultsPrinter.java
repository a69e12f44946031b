package com.analyzer.report.cli.output;

import java.io.PrintWriter;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analyzer.report.cli.model.ValidatedSummarizeOptions;
import com.analyzer.report.replay.ReplayResult;

/**
 * Responsible only for printing CLI output for the summarize command.
 * Progress goes to the log; the report itself goes to the command's output stream.
 */
public class SummaryResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SummaryResultsPrinter.class);

    public void printBanner(ValidatedSummarizeOptions v) {
        log.info("=================================================");
        log.info("Analyzer Report");
        log.info("=================================================");
        log.info("Diagnostics Logs: {}", v.getLogFiles().size());
        log.info("Minimum Level: {}", v.getReporterConfig().getMinimumLevel());
        log.info("Orphan Messages: {}", v.getReporterConfig().getNoCurrentUnitPolicy());
        log.info("Format: {}", v.getFormat());
        log.info("=================================================");
    }

    public void printReplay(Path logFile, ReplayResult result) {
        log.info("Replayed {}: {} units, {} messages", logFile, result.getUnitsEntered(), result.getMessagesRead());
        for (String error : result.getErrors()) {
            log.warn("{}: {}", logFile, error);
        }
    }

    public void printReport(PrintWriter out, String report) {
        out.print(report);
        out.flush();
    }
}
