package com.analyzer.report.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * A single analyzed unit and the messages reported against it, in reporting order.
 */
@Getter
public abstract class IndividualSummary extends Summary {

    @NonNull
    private final String name;

    private final List<MessageSummary> messages = new ArrayList<>();

    protected IndividualSummary(@NonNull String name) {
        this.name = name;
    }
}
