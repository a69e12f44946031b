package com.analyzer.report.reporter;

/**
 * Where {@link LogReporter} writes formatted messages.
 */
@FunctionalInterface
public interface MessageSink {
    void emit(Level level, String formattedMessage);
}
