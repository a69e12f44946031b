package com.analyzer.report.model;

/**
 * An HTML unit; only its messages are tracked.
 */
public class HtmlSummary extends IndividualSummary {

    public HtmlSummary(String name) {
        super(name);
    }

    @Override
    public void accept(SummaryVisitor visitor) {
        visitor.visit(this);
    }
}
