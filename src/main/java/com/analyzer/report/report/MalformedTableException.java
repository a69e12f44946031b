package com.analyzer.report.report;

/**
 * Table rows are incomplete: entries were not added in multiples of the column count.
 */
public class MalformedTableException extends ReportException {

    private static final long serialVersionUID = 1L;

    public MalformedTableException(String message) {
        super(message);
    }
}
