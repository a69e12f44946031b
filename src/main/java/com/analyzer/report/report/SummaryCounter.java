package com.analyzer.report.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.analyzer.report.model.LibrarySummary;
import com.analyzer.report.model.MessageSummary;
import com.analyzer.report.model.PackageSummary;
import com.analyzer.report.model.RecursiveSummaryVisitor;

import lombok.Getter;

/**
 * Counts messages per package and kind, and lines of code per package.
 *
 * The traversal order (system, packages, loose) comes from {@link RecursiveSummaryVisitor}.
 * Units outside a package (system and loose) are counted under {@value #OTHER_PACKAGE}.
 * All maps keep first-seen order.
 */
@Getter
public class SummaryCounter extends RecursiveSummaryVisitor {

    public static final String OTHER_PACKAGE = "*other*";

    private final Map<String, Map<String, Integer>> errorCount = new LinkedHashMap<>();
    private final Map<String, Integer> linesOfCode = new LinkedHashMap<>();
    private final Map<String, Integer> totals = new LinkedHashMap<>();
    private int totalLinesOfCode;

    private final Set<String> packages = new LinkedHashSet<>();

    private String currentPackage;

    public String getCurrentPackage() {
        return currentPackage != null ? currentPackage : OTHER_PACKAGE;
    }

    public Set<String> getPackages() {
        return Collections.unmodifiableSet(packages);
    }

    @Override
    public void visit(PackageSummary pkg) {
        currentPackage = pkg.getName();
        try {
            super.visit(pkg);
        } finally {
            currentPackage = null;
        }
    }

    @Override
    public void visit(LibrarySummary library) {
        super.visit(library);
        String pkg = getCurrentPackage();
        packages.add(pkg);
        linesOfCode.merge(pkg, library.getLines(), Integer::sum);
        totalLinesOfCode += library.getLines();
    }

    @Override
    public void visit(MessageSummary message) {
        String pkg = getCurrentPackage();
        packages.add(pkg);
        errorCount.computeIfAbsent(pkg, k -> new LinkedHashMap<>())
                .merge(message.getKind(), 1, Integer::sum);
        totals.merge(message.getKind(), 1, Integer::sum);
    }

    public int count(String pkg, String kind) {
        Map<String, Integer> counts = errorCount.get(pkg);
        if (counts == null) {
            return 0;
        }
        return counts.getOrDefault(kind, 0);
    }
}
