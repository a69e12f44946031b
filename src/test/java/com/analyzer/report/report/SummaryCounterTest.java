package com.analyzer.report.report;

import org.junit.jupiter.api.Test;

import com.analyzer.report.model.GlobalSummary;
import com.analyzer.report.reporter.Level;
import com.analyzer.report.reporter.Message;
import com.analyzer.report.reporter.SummaryReporter;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SummaryCounter.
 */
class SummaryCounterTest {

    @Test
    void testCountsPerPackageAndKind() {
        SummaryReporter reporter = new SummaryReporter();
        report(reporter, "package:p/a.dart", 10, "TypeError", "TypeError", "DownCast");
        report(reporter, "package:p/b.dart", 4, "DownCast");
        report(reporter, "package:q/q.dart", 7);
        report(reporter, "dart:core", 5, "TypeError");
        report(reporter, "file:///tool.dart", 3, "Hint");

        SummaryCounter counter = count(reporter.getResult());

        assertThat(counter.getErrorCount()).containsOnlyKeys("p", SummaryCounter.OTHER_PACKAGE);
        assertThat(counter.count("p", "TypeError")).isEqualTo(2);
        assertThat(counter.count("p", "DownCast")).isEqualTo(2);
        assertThat(counter.count(SummaryCounter.OTHER_PACKAGE, "TypeError")).isEqualTo(1);
        assertThat(counter.count(SummaryCounter.OTHER_PACKAGE, "Hint")).isEqualTo(1);
        assertThat(counter.count("q", "TypeError")).isZero();

        assertThat(counter.getTotals()).containsEntry("TypeError", 3)
                .containsEntry("DownCast", 2)
                .containsEntry("Hint", 1);

        assertThat(counter.getLinesOfCode()).containsEntry("p", 14)
                .containsEntry("q", 7)
                .containsEntry(SummaryCounter.OTHER_PACKAGE, 8);
        assertThat(counter.getTotalLinesOfCode()).isEqualTo(29);
    }

    @Test
    void testOrderFollowsTraversal() {
        SummaryReporter reporter = new SummaryReporter();
        report(reporter, "package:p/a.dart", 1, "Zeta");
        report(reporter, "dart:core", 1, "Alpha");
        report(reporter, "package:q/q.dart", 1);

        SummaryCounter counter = count(reporter.getResult());

        assertThat(counter.getTotals().keySet()).containsExactly("Alpha", "Zeta");
        assertThat(counter.getPackages()).containsExactly(SummaryCounter.OTHER_PACKAGE, "p", "q");
    }

    @Test
    void testHtmlMessagesCountTowardsOther() {
        SummaryReporter reporter = new SummaryReporter();
        reporter.enterHtml("package:p/index.html");
        reporter.log(new Message("HtmlError", "bad", Level.SEVERE, 0, 0));
        reporter.leaveHtml();

        SummaryCounter counter = count(reporter.getResult());

        assertThat(counter.count(SummaryCounter.OTHER_PACKAGE, "HtmlError")).isEqualTo(1);
        assertThat(counter.getLinesOfCode()).isEmpty();
        assertThat(counter.getTotalLinesOfCode()).isZero();
    }

    @Test
    void testEmptySummary() {
        SummaryCounter counter = count(new GlobalSummary());

        assertThat(counter.getErrorCount()).isEmpty();
        assertThat(counter.getTotals()).isEmpty();
        assertThat(counter.getPackages()).isEmpty();
        assertThat(counter.getTotalLinesOfCode()).isZero();
    }

    static void report(SummaryReporter reporter, String uri, int lines, String... kinds) {
        reporter.enterLibrary(uri);
        reporter.recordLineCount(lines);
        for (String kind : kinds) {
            reporter.log(new Message(kind, kind + " in " + uri, Level.SEVERE, 0, 0));
        }
        reporter.leaveLibrary();
    }

    private static SummaryCounter count(GlobalSummary summary) {
        SummaryCounter counter = new SummaryCounter();
        summary.accept(counter);
        return counter;
    }
}
