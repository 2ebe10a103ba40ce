package com.di.snapdiff.discovery;

import com.di.snapdiff.manifest.PartitionKey;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one discovery run did, for the CLI and for tests.
 */
@Value
@Builder
public class DiscoveryReport {
    String runId;
    String snapshotVersion;
    DirtySet dirtySet;
    int newCount;
    int dirtyCount;
    int cleanCount;
    List<PartitionKey> deleted;
    /** Keys that could not be written, with the reason. */
    Map<PartitionKey, String> conflicts;
    /** Files whose declared hash disagreed with the recomputed one. */
    List<String> hashMismatches;
    /** Keys withheld from the dirty set because a contributor failed the integrity check. */
    Set<PartitionKey> integrityFlagged;
    long durationMs;

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
