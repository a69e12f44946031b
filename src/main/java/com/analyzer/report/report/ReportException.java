package com.analyzer.report.report;

/**
 * Base class for failures while building a report. There is no partial report.
 */
public class ReportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportException(String message) {
        super(message);
    }
}
