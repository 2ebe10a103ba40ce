package com.di.snapdiff.manifest;

import java.util.List;

/**
 * Provenance of canonical partitions. Links are insert-only; re-linking the same
 * (key, file, hash) is a no-op.
 */
public interface PartitionLinkStore {

    void link(PartitionLink link);

    /** Newest snapshot version first, then by file path. */
    List<PartitionLink> findByPartition(PartitionKey key);
}
