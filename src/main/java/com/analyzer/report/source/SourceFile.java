package com.analyzer.report.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * The text of one compilation unit, indexed by line so offsets can be turned into
 * line/column locations and spans.
 */
public class SourceFile {

    @Getter
    private final String url;
    @Getter
    private final String content;
    private final List<Integer> lineStarts;

    public SourceFile(@NonNull String url, @NonNull String content) {
        this.url = url;
        this.content = content;
        this.lineStarts = computeLineStarts(content);
    }

    /**
     * A source without content, for spans reported outside of any compilation unit.
     */
    public static SourceFile empty(String url) {
        return new SourceFile(url == null ? "" : url, "");
    }

    private static List<Integer> computeLineStarts(String content) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return Collections.unmodifiableList(starts);
    }

    /**
     * Number of lines, i.e. the 1-based line of the last character. A trailing newline
     * does not open a new line; empty content has no lines.
     */
    public int getLineCount() {
        if (content.isEmpty()) {
            return 0;
        }
        return lineOf(content.length() - 1) + 1;
    }

    public SourceLocation location(int offset) {
        int clamped = clamp(offset);
        int line = lineOf(clamped);
        return new SourceLocation(url, clamped, line, clamped - lineStarts.get(line));
    }

    public SourceSpan span(int begin, int end) {
        int start = clamp(begin);
        int stop = Math.max(start, clamp(end));
        SourceLocation startLocation = location(start);
        return new SourceSpan(startLocation, location(stop), content.substring(start, stop), lineText(startLocation.getLine()));
    }

    /**
     * Text of the given 0-based line without its line terminator.
     */
    public String lineText(int line) {
        if (line < 0 || line >= lineStarts.size()) {
            return "";
        }
        int start = lineStarts.get(line);
        int end = line + 1 < lineStarts.size() ? lineStarts.get(line + 1) : content.length();
        String text = content.substring(start, end);
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, content.length()));
    }

    private int lineOf(int offset) {
        int index = Collections.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }
}
