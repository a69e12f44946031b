package com.analyzer.report.report;

/**
 * A column was declared after entries were added.
 */
public class SchemaFrozenException extends ReportException {

    private static final long serialVersionUID = 1L;

    public SchemaFrozenException(String column) {
        super("Cannot declare column '" + column + "' after entries were added");
    }
}
