package com.analyzer.report.identity;

/**
 * Where an analyzed unit comes from.
 */
public enum UnitScope {
    /** Provided by the platform (e.g. {@code dart:core}). */
    SYSTEM,
    /** Belongs to a named distribution package. */
    PACKAGE,
    /** Anything else: local files, unknown schemes, malformed identifiers. */
    LOOSE
}
