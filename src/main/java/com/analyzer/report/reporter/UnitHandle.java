package com.analyzer.report.reporter;

import com.analyzer.report.model.GlobalSummary;
import com.analyzer.report.model.IndividualSummary;
import com.analyzer.report.model.LibrarySummary;

import lombok.Getter;

/**
 * An entered unit. Messages and line counts go through the handle, so recording into a unit
 * that was never entered cannot happen.
 *
 * Closing leaves the unit. A handle cannot be used once it is closed or once the reporter has
 * been cleared.
 */
public final class UnitHandle implements AutoCloseable {

    private final SummaryReporter owner;
    private final GlobalSummary tree;

    @Getter
    private final IndividualSummary summary;

    private boolean closed;

    UnitHandle(SummaryReporter owner, GlobalSummary tree, IndividualSummary summary) {
        this.owner = owner;
        this.tree = tree;
        this.summary = summary;
    }

    public void log(Message message) {
        ensureOpen();
        owner.record(summary, message);
    }

    /**
     * Adds {@code count} lines to the unit if it is a library; HTML units do not track lines.
     */
    public void recordLineCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Line count must be >= 0. Got: " + count);
        }
        ensureOpen();
        if (summary instanceof LibrarySummary library) {
            library.addLines(count);
        }
    }

    public boolean isOpen() {
        return !closed && owner.getResult() == tree;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            owner.release(this);
        }
    }

    private void ensureOpen() {
        if (!isOpen()) {
            throw new IllegalStateException("Unit " + summary.getName() + " is no longer entered");
        }
    }
}
