package com.analyzer.report.reporter;

import lombok.NonNull;
import lombok.Value;

/**
 * A message (error or warning) produced by the checker.
 *
 * {@code begin} and {@code end} are offsets in the compilation unit that is current when the
 * message is logged.
 */
@Value
public class Message {
    @NonNull
    String kind;
    @NonNull
    String text;
    @NonNull
    Level level;
    int begin;
    int end;
}
