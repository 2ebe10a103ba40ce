package com.di.snapdiff.discovery;

import lombok.Getter;

/**
 * Declared sidecar hash disagrees with the hash recomputed from the file.
 */
@Getter
public class HashMismatchException extends RuntimeException {

    private final String file;
    private final String declaredHash;
    private final String computedHash;

    public HashMismatchException(String file, String declaredHash, String computedHash) {
        super("Hash mismatch for " + file + ": declared=" + declaredHash + " computed=" + computedHash);
        this.file = file;
        this.declaredHash = declaredHash;
        this.computedHash = computedHash;
    }
}
