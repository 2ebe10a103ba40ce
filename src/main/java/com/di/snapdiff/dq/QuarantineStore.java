package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;

import java.util.List;

public interface QuarantineStore {

    void save(List<QuarantineRecord> records);

    List<QuarantineRecord> findByPartition(PartitionKey key, Layer layer);
}
