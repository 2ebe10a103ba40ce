package com.di.snapdiff.manifest;

import lombok.Getter;

/**
 * Raised when an upsert carries a stale version, or when two raw sources collide on the same
 * canonical key within one run.
 */
@Getter
public class ManifestConflictException extends RuntimeException {

    /** Version the caller supplied. */
    private final long expectedVersion;

    /** Stored version at the time of the write, or -1 when not known. */
    private final long actualVersion;

    private final transient PartitionKey key;
    private final Layer layer;

    public ManifestConflictException(PartitionKey key, Layer layer, long expectedVersion, long actualVersion) {
        super(String.format("Manifest conflict on %s [%s]: expected version %d but found %d",
                key, layer, expectedVersion, actualVersion));
        this.key = key;
        this.layer = layer;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public ManifestConflictException(PartitionKey key, Layer layer, String message) {
        super(String.format("Manifest conflict on %s [%s]: %s", key, layer, message));
        this.key = key;
        this.layer = layer;
        this.expectedVersion = -1;
        this.actualVersion = -1;
    }
}
