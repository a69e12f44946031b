package com.analyzer.report.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Root of the summary tree: everything reported during one session.
 *
 * Maps keep insertion order so reports come out the same way every run.
 */
@Getter
public class GlobalSummary extends Summary {

    /** Platform libraries keyed by identifier. */
    private final Map<String, LibrarySummary> system = new LinkedHashMap<>();

    /** Packages keyed by package name. */
    private final Map<String, PackageSummary> packages = new LinkedHashMap<>();

    /** Libraries and HTML files that belong neither to the platform nor to a package. */
    private final Map<String, IndividualSummary> loose = new LinkedHashMap<>();

    @Override
    public void accept(SummaryVisitor visitor) {
        visitor.visit(this);
    }

    public PackageSummary getOrCreatePackage(String name) {
        return packages.computeIfAbsent(name, PackageSummary::new);
    }

    public LibrarySummary getOrCreateSystemLibrary(String id) {
        return system.computeIfAbsent(id, LibrarySummary::new);
    }

    public LibrarySummary getOrCreateLooseLibrary(String id) {
        IndividualSummary existing = loose.computeIfAbsent(id, LibrarySummary::new);
        if (!(existing instanceof LibrarySummary library)) {
            throw new IllegalStateException("Loose unit " + id + " was already reported as HTML");
        }
        return library;
    }

    public HtmlSummary getOrCreateHtml(String id) {
        IndividualSummary existing = loose.computeIfAbsent(id, HtmlSummary::new);
        if (!(existing instanceof HtmlSummary html)) {
            throw new IllegalStateException("Loose unit " + id + " was already reported as a library");
        }
        return html;
    }

    public boolean isEmpty() {
        return system.isEmpty() && packages.isEmpty() && loose.isEmpty();
    }
}
