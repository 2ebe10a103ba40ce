package com.di.snapdiff.dq;

/**
 * A check that could not execute, e.g. a missing column or reference set.
 * The gate turns it into a CRITICAL result.
 */
public class DqCheckException extends RuntimeException {

    public DqCheckException(String message) {
        super(message);
    }

    public DqCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
