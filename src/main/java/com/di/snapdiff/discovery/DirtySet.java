package com.di.snapdiff.discovery;

import com.di.snapdiff.manifest.PartitionKey;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Canonical partitions that changed in one discovery run, sorted by key. Handed to the next
 * stage once: {@link #consume()} may be called a single time.
 */
public class DirtySet {

    private final String snapshotVersion;
    private final String runId;
    private final List<DirtyPartition> partitions;
    private final AtomicBoolean consumed = new AtomicBoolean();

    public DirtySet(String snapshotVersion, String runId, List<DirtyPartition> partitions) {
        this.snapshotVersion = snapshotVersion;
        this.runId = runId;
        this.partitions = List.copyOf(partitions);
    }

    public String getSnapshotVersion() {
        return snapshotVersion;
    }

    public String getRunId() {
        return runId;
    }

    /** Read-only view; does not consume. */
    public List<DirtyPartition> getPartitions() {
        return partitions;
    }

    public List<PartitionKey> keys() {
        return partitions.stream().map(DirtyPartition::key).toList();
    }

    public boolean isEmpty() {
        return partitions.isEmpty();
    }

    public int size() {
        return partitions.size();
    }

    /**
     * @throws IllegalStateException on a second call
     */
    public List<DirtyPartition> consume() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("DirtySet for run " + runId + " already consumed");
        }
        return partitions;
    }
}
