package com.analyzer.report.model;

import lombok.Getter;

/**
 * A library unit. {@code lines} accumulates across compilation units and passes until it is
 * explicitly reset.
 */
@Getter
public class LibrarySummary extends IndividualSummary {

    private int lines;

    public LibrarySummary(String name) {
        super(name);
    }

    public void addLines(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Line count must be >= 0. Got: " + count);
        }
        lines += count;
    }

    public void resetLines() {
        lines = 0;
    }

    @Override
    public void accept(SummaryVisitor visitor) {
        visitor.visit(this);
    }
}
