package com.analyzer.report.replay;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Outcome of replaying one diagnostics log.
 */
@Getter
public class ReplayResult {
    private int unitsEntered;
    private int messagesRead;
    private final List<String> errors = new ArrayList<>();

    void unitEntered() {
        unitsEntered++;
    }

    void messageRead() {
        messagesRead++;
    }

    void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
