package com.scheep.debug;

/** Severity of a debug message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel threshold) {
        return ordinal() >= threshold.ordinal();
    }

    /** Lenient parse used by the CLI flags; unknown names fall back to {@code fallback}. */
    public static DebugLevel parse(String name, DebugLevel fallback) {
        if (name == null || name.trim().isEmpty()) return fallback;
        try {
            return DebugLevel.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
