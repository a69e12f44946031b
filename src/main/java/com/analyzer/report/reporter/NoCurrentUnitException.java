package com.analyzer.report.reporter;

/**
 * A message was logged while no library or HTML unit was entered.
 */
public class NoCurrentUnitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Message rejected;

    public NoCurrentUnitException(Message rejected) {
        super("No library or HTML unit is entered; cannot record [" + rejected.getKind() + "] " + rejected.getText());
        this.rejected = rejected;
    }

    public Message getRejected() {
        return rejected;
    }
}
