package com.analyzer.report.replay;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analyzer.report.reporter.CompilerReporter;
import com.analyzer.report.reporter.Level;
import com.analyzer.report.reporter.Message;
import com.analyzer.report.source.SourceFile;

/**
 * Replays a diagnostics log into a {@link CompilerReporter}, playing the part of the compiler
 * driver.
 *
 * Format:
 * - Library:  library package:foo/foo.dart lines=120 source=lib/foo.dart
 * - HTML:     html web/index.html
 * - Message:  warning DownCast 10:24 List is implicitly cast to List&lt;int&gt;
 * - Clear:    clear-library ID | clear-html ID | clear-all
 * - Comments: # comment
 *
 * A library or html line leaves the previous unit. Messages belong to the open unit.
 * Lines that cannot be applied are reported in the result and skipped.
 */
public class DiagnosticsLogReader {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsLogReader.class);

    private static final Pattern UNIT_PATTERN = Pattern.compile("^(library|html)\\s+(\\S+)((?:\\s+\\S+)*)$");

    private static final Pattern CLEAR_PATTERN = Pattern.compile("^(clear-library|clear-html)\\s+(\\S+)$");

    private static final Pattern OPTION_PATTERN = Pattern.compile("^(lines|source)=(.+)$");

    private static final Pattern MESSAGE_PATTERN = Pattern.compile(
            "^([A-Za-z]+)\\s+(\\S+)\\s+(\\d+):(\\d+)(?:\\s+(.*))?$"
    );

    private final Path baseDir;

    public DiagnosticsLogReader() {
        this(null);
    }

    /**
     * @param baseDir directory that relative {@code source=} paths are resolved against;
     *                {@code null} for the working directory
     */
    public DiagnosticsLogReader(Path baseDir) {
        this.baseDir = baseDir;
    }

    public ReplayResult replay(Path logFile, CompilerReporter reporter) throws IOException {
        List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        Path parent = logFile.toAbsolutePath().getParent();
        return new DiagnosticsLogReader(parent).replay(lines, reporter);
    }

    public ReplayResult replay(List<String> lines, CompilerReporter reporter) {
        ReplayResult result = new ReplayResult();
        OpenUnit open = OpenUnit.NONE;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                open = applyLine(trimmed, open, reporter, result);
            } catch (Exception e) {
                result.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to replay diagnostics line {}: {}", lineNum, e.getMessage());
            }
        }

        leave(open, reporter);
        return result;
    }

    private OpenUnit applyLine(String line, OpenUnit open, CompilerReporter reporter, ReplayResult result)
            throws IOException {
        if (line.equals("clear-all")) {
            reporter.clearAll();
            return OpenUnit.NONE;
        }

        Matcher clear = CLEAR_PATTERN.matcher(line);
        if (clear.matches()) {
            if (clear.group(1).equals("clear-library")) {
                reporter.clearLibrary(clear.group(2));
            } else {
                reporter.clearHtml(clear.group(2));
            }
            return open;
        }

        Matcher unit = UNIT_PATTERN.matcher(line);
        if (unit.matches()) {
            UnitOptions options = parseUnitOptions(unit.group(3).trim());
            leave(open, reporter);
            String id = unit.group(2);
            boolean library = unit.group(1).equals("library");
            if (library) {
                reporter.enterLibrary(id);
            } else {
                reporter.enterHtml(id);
            }
            result.unitEntered();
            if (options.source() != null) {
                reporter.enterCompilationUnit(options.source());
            }
            if (options.lines() > 0) {
                reporter.recordLineCount(options.lines());
            }
            return library ? OpenUnit.LIBRARY : OpenUnit.HTML;
        }

        Matcher message = MESSAGE_PATTERN.matcher(line);
        if (message.matches()) {
            Level level = Level.parse(message.group(1))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown level: " + message.group(1)));
            String text = message.group(5) == null ? "" : message.group(5);
            reporter.log(new Message(message.group(2), text, level,
                    Integer.parseInt(message.group(3)), Integer.parseInt(message.group(4))));
            result.messageRead();
            return open;
        }

        throw new IllegalArgumentException("Invalid diagnostics line: " + line);
    }

    private UnitOptions parseUnitOptions(String options) throws IOException {
        int lines = 0;
        SourceFile source = null;
        if (options.isEmpty()) {
            return new UnitOptions(lines, source);
        }
        for (String option : options.split("\\s+")) {
            Matcher matcher = OPTION_PATTERN.matcher(option);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid unit option: " + option);
            }
            String value = matcher.group(2);
            if (matcher.group(1).equals("lines")) {
                lines = Integer.parseInt(value);
                if (lines < 0) {
                    throw new IllegalArgumentException("Line count must be >= 0. Got: " + lines);
                }
            } else {
                Path sourcePath = baseDir == null ? Path.of(value) : baseDir.resolve(value);
                source = new SourceFile(value, Files.readString(sourcePath, StandardCharsets.UTF_8));
            }
        }
        return new UnitOptions(lines, source);
    }

    private static void leave(OpenUnit open, CompilerReporter reporter) {
        reporter.leaveCompilationUnit();
        if (open == OpenUnit.LIBRARY) {
            reporter.leaveLibrary();
        } else if (open == OpenUnit.HTML) {
            reporter.leaveHtml();
        }
    }

    private enum OpenUnit { NONE, LIBRARY, HTML }

    private record UnitOptions(int lines, SourceFile source) {
    }
}
