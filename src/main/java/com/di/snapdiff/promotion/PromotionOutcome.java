package com.di.snapdiff.promotion;

import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class PromotionOutcome {
    PartitionKey key;
    Layer layer;
    String snapshotVersion;
    PromotionState state;
    boolean promoted;
    Severity dqLevel;
    boolean dqPassed;
    int rowsIn;
    /** Rows visible to the next layer: accepted rows when promoted, otherwise zero. */
    int rowsOut;
    int quarantined;
    Path summaryPath;
}
