package com.di.snapdiff.manifest;

/**
 * Raw-state status of a manifest entry as seen by the last discovery run.
 */
public enum ManifestStatus {
    /** First time the partition was seen. */
    NEW,
    /** Seen before with a different content hash. */
    DIRTY,
    /** Seen before with an identical content hash. */
    CLEAN,
    /** No longer present in the latest snapshot. Kept for lineage. */
    DELETED;

    public boolean isDirty() {
        return this == NEW || this == DIRTY;
    }
}
