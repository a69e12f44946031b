package com.analyzer.report.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * All libraries reported for one distribution package.
 */
@Getter
@RequiredArgsConstructor
public class PackageSummary extends Summary {

    @NonNull
    private final String name;

    private final Map<String, LibrarySummary> libraries = new LinkedHashMap<>();

    @Override
    public void accept(SummaryVisitor visitor) {
        visitor.visit(this);
    }

    public LibrarySummary getOrCreateLibrary(String id) {
        return libraries.computeIfAbsent(id, LibrarySummary::new);
    }
}
