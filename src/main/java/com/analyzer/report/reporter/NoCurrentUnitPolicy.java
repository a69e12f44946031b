package com.analyzer.report.reporter;

/**
 * What {@link SummaryReporter#log(Message)} does with a message logged while no unit is entered.
 */
public enum NoCurrentUnitPolicy {
    /** Throw {@link NoCurrentUnitException}. */
    FAIL,
    /** Drop the message (logged at debug). */
    DROP
}
