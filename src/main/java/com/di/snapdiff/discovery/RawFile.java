package com.di.snapdiff.discovery;

import com.di.snapdiff.routing.RawPartitionId;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One part file of a raw snapshot with its resolved fingerprint.
 */
@Value
@Builder
public class RawFile {
    Path path;
    String rawSourceId;
    RawPartitionId partitionId;

    /** Declared hash when trusted, otherwise the recomputed one. */
    String hash;

    long bytes;

    /**
     * The sidecar record for this file, or one synthesised from the filesystem when the writer
     * left none; {@code records} is null in that case.
     */
    SnapshotSummary summary;

    boolean sidecarPresent;

    /** Set when the declared hash disagrees with the recomputed one. */
    HashMismatchException mismatch;

    public String fileName() {
        return path.getFileName().toString();
    }
}
