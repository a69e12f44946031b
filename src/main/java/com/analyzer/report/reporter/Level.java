package com.analyzer.report.reporter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Severity levels used by the checker, ordered by {@link #getValue()}.
 */
@Getter
@RequiredArgsConstructor
public enum Level {
    ALL(0),
    FINEST(300),
    FINER(400),
    FINE(500),
    CONFIG(700),
    INFO(800),
    WARNING(900),
    SEVERE(1000),
    SHOUT(1200),
    OFF(2000);

    private final int value;

    public boolean isBelow(Level other) {
        return value < other.value;
    }

    /**
     * Lower-case name as stored in message summaries.
     */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Level> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.name().equals(normalized))
                .findFirst();
    }
}
