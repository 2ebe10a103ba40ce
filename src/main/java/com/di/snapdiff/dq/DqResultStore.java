package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;

import java.util.List;

/**
 * Append-only audit trail of DQ results.
 */
public interface DqResultStore {

    void append(List<DQResult> results);

    List<DQResult> findByPartition(PartitionKey key, Layer layer);
}
