package com.analyzer.report.source;

import lombok.Value;

/**
 * A range of a {@link SourceFile} together with the line it starts on.
 */
@Value
public class SourceSpan {
    SourceLocation start;
    SourceLocation end;
    String text;
    String context;

    /**
     * A span known only by its offsets in {@code url}. Lines are unknown, so the column is the
     * offset and there is no text or context.
     */
    public static SourceSpan ofOffsets(String url, int begin, int end) {
        int start = Math.max(0, begin);
        int stop = Math.max(start, end);
        String sourceUrl = url == null ? "" : url;
        return new SourceSpan(
                new SourceLocation(sourceUrl, start, 0, start),
                new SourceLocation(sourceUrl, stop, 0, stop),
                "", "");
    }

    public String getSourceUrl() {
        return start.getSourceUrl();
    }

    /**
     * Formats {@code message} as {@code line L, column C of URL: message}, followed by the
     * context line with the span underlined when context is available.
     */
    public String message(String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("line ").append(start.getLine() + 1)
                .append(", column ").append(start.getColumn() + 1);
        if (getSourceUrl() != null && !getSourceUrl().isEmpty()) {
            sb.append(" of ").append(getSourceUrl());
        }
        sb.append(": ").append(message);

        if (context != null && !context.isEmpty()) {
            int column = Math.min(start.getColumn(), context.length());
            int width = start.getLine() == end.getLine() ? end.getColumn() - start.getColumn() : context.length() - column;
            sb.append('\n').append(context)
                    .append('\n').append(" ".repeat(column))
                    .append("^".repeat(Math.max(1, Math.min(width, context.length() - column))));
        }
        return sb.toString();
    }
}
