package com.analyzer.report.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.analyzer.report.model.GlobalSummary;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Produces the per-package report of a {@link GlobalSummary}.
 *
 * Layout: one row per package with the count of every message kind and the lines of code,
 * then a divider, the header again, a {@code total} row and a {@code %} row (counts per 100
 * lines of code).
 */
@UtilityClass
public class SummaryReportFormatter {

    public static final String ANALYZER_ERROR = "AnalyzerError";
    public static final String LINES_OF_CODE = "LinesOfCode";

    public static String summaryToString(GlobalSummary summary) {
        return summaryToString(summary, ReportFormat.TABLE);
    }

    public static String summaryToString(@NonNull GlobalSummary summary, @NonNull ReportFormat format) {
        TextTable table = buildTable(summary);
        return format == ReportFormat.CSV ? table.renderCsv() : table.render();
    }

    public static TextTable buildTable(@NonNull GlobalSummary summary) {
        SummaryCounter counter = new SummaryCounter();
        summary.accept(counter);

        List<String> kinds = new ArrayList<>(counter.getTotals().keySet());
        kinds.remove(ANALYZER_ERROR);

        TextTable table = new TextTable();
        table.declareColumn("package");
        table.declareColumn(ANALYZER_ERROR, true);
        kinds.forEach(kind -> table.declareColumn(kind, true));
        table.declareColumn(LINES_OF_CODE, true);
        table.addHeader();

        for (String pkg : counter.getPackages()) {
            table.addEntry(pkg);
            table.addEntry(counter.count(pkg, ANALYZER_ERROR));
            kinds.forEach(kind -> table.addEntry(counter.count(pkg, kind)));
            table.addEntry(counter.getLinesOfCode().getOrDefault(pkg, 0));
        }

        table.addDivider();
        table.addHeader();

        table.addEntry("total");
        table.addEntry(counter.getTotals().getOrDefault(ANALYZER_ERROR, 0));
        kinds.forEach(kind -> table.addEntry(counter.getTotals().getOrDefault(kind, 0)));
        table.addEntry(counter.getTotalLinesOfCode());

        int totalLines = counter.getTotalLinesOfCode();
        table.addEntry("%");
        table.addEntry(percent(counter.getTotals().getOrDefault(ANALYZER_ERROR, 0), totalLines));
        kinds.forEach(kind -> table.addEntry(percent(counter.getTotals().getOrDefault(kind, 0), totalLines)));
        table.addEntry(100);

        return table;
    }

    /**
     * {@code count * 100 / total} with two decimals; {@code 0.00} when there are no lines.
     */
    static String percent(int count, int total) {
        if (total == 0) {
            return String.format(Locale.ROOT, "%.2f", 0.0);
        }
        return String.format(Locale.ROOT, "%.2f", count * 100.0 / total);
    }
}
