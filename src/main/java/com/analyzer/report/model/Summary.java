package com.analyzer.report.model;

/**
 * Base class for all nodes of the summary tree.
 */
public abstract class Summary {

    public abstract void accept(SummaryVisitor visitor);
}
