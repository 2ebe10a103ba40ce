package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A row held back from promotion, with the check that rejected it and the row as JSON.
 */
@Value
@Builder
public class QuarantineRecord {
    String quarantineId;
    PartitionKey key;
    Layer layer;
    String snapshotVersion;
    String checkName;
    String reason;
    String payload;
    Instant createdAt;
}
