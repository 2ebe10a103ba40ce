package com.di.snapdiff.promotion;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of a batch evaluation. Partial promotion is a normal outcome.
 */
@Value
public class PromotionReport {
    Layer layer;
    String snapshotVersion;
    List<PromotionOutcome> outcomes;
    /** Partitions whose evaluation threw, with the error message. */
    Map<PartitionKey, String> failed;

    public List<PartitionKey> promotedKeys() {
        return outcomes.stream().filter(PromotionOutcome::isPromoted).map(PromotionOutcome::getKey).toList();
    }

    public List<PartitionKey> rejectedKeys() {
        return outcomes.stream().filter(o -> !o.isPromoted()).map(PromotionOutcome::getKey).toList();
    }

    /** True only when something was evaluated and nothing was promoted. */
    public boolean isAllRejected() {
        return !outcomes.isEmpty() && promotedKeys().isEmpty();
    }
}
