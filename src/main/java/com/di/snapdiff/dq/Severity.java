package com.di.snapdiff.dq;

/**
 * Ordered DQ outcome level. Only {@link #CRITICAL} blocks promotion.
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Parses a level, accepting the legacy {@code MINOR}/{@code MAJOR} labels written by older
     * snapshot writers. Unknown labels fail closed as CRITICAL.
     */
    public static Severity parseLenient(String level) {
        if (level == null || level.isBlank()) {
            return null;
        }
        switch (level.trim().toUpperCase()) {
            case "INFO":
            case "MINOR":
                return INFO;
            case "WARNING":
            case "WARN":
            case "MAJOR":
                return WARNING;
            default:
                return CRITICAL;
        }
    }
}
