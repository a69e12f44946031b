package com.analyzer.report.source;

import lombok.Value;

/**
 * A resolved offset. {@code line} and {@code column} are 0-based.
 */
@Value
public class SourceLocation {
    String sourceUrl;
    int offset;
    int line;
    int column;
}
