package com.di.snapdiff.discovery;

import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.PartitionKey;

/**
 * @param status NEW or DIRTY
 */
public record DirtyPartition(PartitionKey key, ManifestStatus status, String contentHash, String grain) {
}
