package com.di.snapdiff.exception;

/**
 * Malformed routing or DQ rules, an unmatched raw source, or an unparseable raw partition id.
 * Always raised before any manifest mutation of the run.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
