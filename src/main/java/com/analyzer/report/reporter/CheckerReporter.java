package com.analyzer.report.reporter;

/**
 * Receives messages from the checker.
 */
public interface CheckerReporter {
    void log(Message message);
}
