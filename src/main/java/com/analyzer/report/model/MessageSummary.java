package com.analyzer.report.model;

import com.analyzer.report.source.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * One recorded diagnostic.
 */
@Value
@EqualsAndHashCode(callSuper = false)
@ToString(callSuper = false)
public class MessageSummary extends Summary {

    /** Category of the diagnostic, e.g. the checker's error class name. */
    @NonNull
    String kind;

    /** Lower-case level name. */
    @NonNull
    String level;

    SourceSpan span;

    @NonNull
    String message;

    @Override
    public void accept(SummaryVisitor visitor) {
        visitor.visit(this);
    }
}
