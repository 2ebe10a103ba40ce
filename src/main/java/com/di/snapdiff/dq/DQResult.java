package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one check on one partition in one layer. Appended to {@code dq_results}, never updated.
 */
@Value
@Builder(toBuilder = true)
public class DQResult {
    String resultId;
    PartitionKey key;
    Layer layer;
    String snapshotVersion;
    String checkName;

    /** Severity the check is configured with; it only counts when the check failed. */
    Severity severity;

    boolean passed;
    Double metricValue;
    String detail;
    Instant createdAt;

    /** True when this result blocks promotion. */
    public boolean isBlocking() {
        return !passed && severity == Severity.CRITICAL;
    }
}
