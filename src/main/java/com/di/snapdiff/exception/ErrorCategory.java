package com.di.snapdiff.exception;

import com.di.snapdiff.discovery.HashMismatchException;
import com.di.snapdiff.dq.DqCheckException;
import com.di.snapdiff.manifest.ManifestConflictException;
import org.springframework.boot.context.properties.bind.BindException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for run logging and process exit codes.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The cause chain is searched, so a {@link ConfigurationException} wrapped by Spring during
 * context startup is still reported as a configuration error, as is an invalid
 * {@code snapdiff.*} property value. To add a category: add the
 * constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Routing or DQ rules are malformed or a raw source is unmatched", 2),
    USAGE_ERROR("Usage error", "Missing or invalid command-line arguments", 2),
    MANIFEST_CONFLICT("Manifest conflict", "Concurrent or stale write on a manifest key", 3),
    INTEGRITY_ERROR("Integrity error", "Declared content hash disagrees with the file", 1),
    DQ_CHECK_ERROR("DQ check error", "A data quality check could not execute", 1),
    DATABASE_ERROR("Database error", "Manifest store operation failed", 1),
    IO_ERROR("I/O error", "Reading raw snapshots or writing artifacts failed", 1),
    APPLICATION_ERROR("Application error", "General application error", 1),
    UNKNOWN("Unknown error", "Unclassified or unknown error type", 1);

    private final String name;
    private final String description;
    private final int exitCode;

    ErrorCategory(String name, String description, int exitCode) {
        this.name = name;
        this.description = description;
        this.exitCode = exitCode;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getExitCode() {
        return exitCode;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof ConfigurationException || t instanceof BindException, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof ManifestConflictException, MANIFEST_CONFLICT);
        MATCHERS.put(t -> t instanceof HashMismatchException, INTEGRITY_ERROR);
        MATCHERS.put(t -> t instanceof DqCheckException, DQ_CHECK_ERROR);
        MATCHERS.put(ErrorCategory::isDatabaseError, DATABASE_ERROR);
        MATCHERS.put(ErrorCategory::isIoError, IO_ERROR);
        MATCHERS.put(t -> t instanceof IllegalArgumentException, USAGE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            for (Throwable t = exception; t != null; t = t.getCause() == t ? null : t.getCause()) {
                if (e.getKey().test(t)) {
                    return e.getValue();
                }
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isDatabaseError(Throwable t) {
        return t instanceof SQLException
                || t instanceof org.springframework.dao.DataAccessException;
    }

    private static boolean isIoError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    @Override
    public String toString() {
        return name();
    }
}
