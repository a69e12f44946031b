package com.analyzer.report.replay;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.analyzer.report.model.GlobalSummary;
import com.analyzer.report.model.LibrarySummary;
import com.analyzer.report.model.MessageSummary;
import com.analyzer.report.reporter.LogReporter;
import com.analyzer.report.reporter.NoCurrentUnitPolicy;
import com.analyzer.report.reporter.ReporterConfig;
import com.analyzer.report.reporter.SummaryReporter;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiagnosticsLogReader.
 */
class DiagnosticsLogReaderTest {

    @TempDir
    Path tempDir;

    private final DiagnosticsLogReader reader = new DiagnosticsLogReader();

    @Test
    void testReplayBuildsSummary() {
        List<String> lines = List.of(
                "# checker output",
                "library package:foo/foo.dart lines=12",
                "severe TypeError 0:4 Type mismatch",
                "warning DownCast 5:9",
                "",
                "library dart:core lines=3",
                "info Hint 1:2 unused import",
                "html web/index.html",
                "severe HtmlError 0:1 bad tag");

        SummaryReporter reporter = new SummaryReporter();
        ReplayResult result = reader.replay(lines, reporter);

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.getUnitsEntered()).isEqualTo(3);
        assertThat(result.getMessagesRead()).isEqualTo(4);

        GlobalSummary summary = reporter.getResult();
        LibrarySummary foo = summary.getPackages().get("foo").getLibraries().get("package:foo/foo.dart");
        assertThat(foo.getLines()).isEqualTo(12);
        assertThat(foo.getMessages()).extracting(MessageSummary::getKind, MessageSummary::getLevel, MessageSummary::getMessage)
                .containsExactly(
                        tuple("TypeError", "severe", "Type mismatch"),
                        tuple("DownCast", "warning", ""));
        assertThat(summary.getSystem().get("dart:core").getLines()).isEqualTo(3);
        assertThat(summary.getLoose().get("web/index.html").getMessages()).hasSize(1);
        assertThat(reporter.getCurrentUnit()).isNull();
    }

    @Test
    void testLineCountsReachAnyReporter() {
        List<String> emitted = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        LogReporter reporter = new LogReporter((level, text) -> emitted.add(text)) {
            @Override
            public void recordLineCount(int count) {
                counts.add(count);
            }
        };

        ReplayResult result = reader.replay(List.of(
                "library package:foo/foo.dart lines=12",
                "severe TypeError 0:4 Type mismatch",
                "html web/index.html lines=3"), reporter);

        assertThat(result.hasErrors()).isFalse();
        assertThat(counts).containsExactly(12, 3);
        assertThat(emitted).containsExactly("line 1, column 1: [TypeError] Type mismatch");
    }

    @Test
    void testBadLinesAreCollected() {
        List<String> lines = List.of(
                "severe TypeError 0:1 before any unit",
                "library package:foo/foo.dart lines=abc",
                "library package:foo/foo.dart",
                "loud TypeError 0:1 unknown level",
                "what is this",
                "severe TypeError 0:1 recorded");

        SummaryReporter reporter = new SummaryReporter();
        ReplayResult result = reader.replay(lines, reporter);

        assertThat(result.getErrors()).hasSize(4);
        assertThat(result.getErrors().get(0)).startsWith("Line 1:");
        assertThat(result.getErrors().get(1)).startsWith("Line 2:");
        assertThat(result.getErrors().get(2)).isEqualTo("Line 4: Unknown level: loud");
        assertThat(result.getErrors().get(3)).startsWith("Line 5: Invalid diagnostics line");
        assertThat(reporter.getResult().getPackages().get("foo").getLibraries().get("package:foo/foo.dart").getMessages())
                .hasSize(1);
    }

    @Test
    void testOrphanMessagesCanBeDropped() {
        SummaryReporter reporter = new SummaryReporter(ReporterConfig.builder()
                .noCurrentUnitPolicy(NoCurrentUnitPolicy.DROP)
                .build());

        ReplayResult result = reader.replay(List.of("severe TypeError 0:1 orphan"), reporter);

        assertThat(result.hasErrors()).isFalse();
        assertThat(reporter.getResult().isEmpty()).isTrue();
    }

    @Test
    void testClearDirectives() {
        List<String> lines = List.of(
                "library package:foo/foo.dart lines=10",
                "severe TypeError 0:1",
                "html web/index.html",
                "severe HtmlError 0:1",
                "clear-library package:foo/foo.dart",
                "clear-html web/index.html");

        SummaryReporter reporter = new SummaryReporter();
        reader.replay(lines, reporter);

        LibrarySummary foo = reporter.getResult().getPackages().get("foo").getLibraries().get("package:foo/foo.dart");
        assertThat(foo.getMessages()).isEmpty();
        assertThat(foo.getLines()).isZero();
        assertThat(reporter.getResult().getLoose().get("web/index.html").getMessages()).isEmpty();

        reader.replay(List.of("library dart:core", "clear-all"), reporter);
        assertThat(reporter.getResult().isEmpty()).isTrue();
    }

    @Test
    void testSourceFilesAreResolvedNextToTheLog() throws IOException {
        Files.createDirectories(tempDir.resolve("lib"));
        String source = "import 'dart:async';\n\nmain() {\n  int x = 'a';\n}\n";
        Files.writeString(tempDir.resolve("lib/app.dart"), source);
        int begin = source.indexOf("'a'");
        Path logFile = tempDir.resolve("checker.log");
        Files.writeString(logFile, String.join("\n",
                "library package:app/app.dart source=lib/app.dart",
                "severe StaticTypeError " + begin + ":" + (begin + 3) + " String is not an int"));

        SummaryReporter reporter = new SummaryReporter();
        ReplayResult result = reader.replay(logFile, reporter);

        assertThat(result.hasErrors()).isFalse();
        LibrarySummary app = reporter.getResult().getPackages().get("app").getLibraries().get("package:app/app.dart");
        assertThat(app.getLines()).isEqualTo(5);
        MessageSummary message = app.getMessages().get(0);
        assertThat(message.getSpan().getText()).isEqualTo("'a'");
        assertThat(message.getSpan().getStart().getLine()).isEqualTo(3);
        assertThat(message.getSpan().getSourceUrl()).isEqualTo("lib/app.dart");
    }

    @Test
    void testMissingSourceFileIsReported() {
        SummaryReporter reporter = new SummaryReporter();

        ReplayResult result = new DiagnosticsLogReader(tempDir)
                .replay(List.of("library package:app/app.dart source=missing.dart"), reporter);

        assertThat(result.getErrors()).hasSize(1);
        assertThat(reporter.getResult().isEmpty()).isTrue();
    }
}
