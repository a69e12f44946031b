package com.analyzer.report.cli.exception;

import java.util.List;

/**
 * Every problem found in the summarize options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
