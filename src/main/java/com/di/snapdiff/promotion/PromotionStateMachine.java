package com.di.snapdiff.promotion;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.dq.GateVerdict;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.ManifestWriteTemplate;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.metrics.SnapDiffMetrics;
import com.di.snapdiff.routing.Grain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * {@code PENDING -> EVALUATED -> PROMOTED | REJECTED} per (partition, layer, snapshot version),
 * persisted on the layer's manifest entry. Every transition is one conflict-checked write.
 *
 * <p>PROMOTED and REJECTED are terminal for their snapshot version; {@link #begin} with a newer
 * version restarts at PENDING. On layers outside {@code snapdiff.promotion.gated-layers} the
 * decision is always PROMOTED, with the DQ outcome still recorded.
 */
@Slf4j
@Component
public class PromotionStateMachine {

    private final ManifestWriteTemplate writer;
    private final Set<Layer> gatedLayers;
    private final SnapDiffMetrics metrics;

    public PromotionStateMachine(ManifestWriteTemplate writer, SnapDiffProperties properties, SnapDiffMetrics metrics) {
        this.writer = writer;
        this.gatedLayers = properties.getPromotion().getGatedLayers().isEmpty()
                ? EnumSet.noneOf(Layer.class)
                : EnumSet.copyOf(properties.getPromotion().getGatedLayers());
        this.metrics = metrics;
    }

    public boolean isGated(Layer layer) {
        return gatedLayers.contains(layer);
    }

    /**
     * Enters PENDING for {@code snapshotVersion}. A partition already PENDING for that version is
     * left as is; one that was EVALUATED (an interrupted run) is reset.
     *
     * @throws IllegalStateException if the partition is already decided for this version
     */
    public ManifestEntry begin(PartitionKey key, Layer layer, String snapshotVersion) {
        return writer.write(key, layer, current -> {
            if (current.isPresent() && snapshotVersion.equals(current.get().getSnapshotVersion())) {
                PromotionState state = current.get().getPromotionState();
                if (state != null && state.isTerminal()) {
                    throw new IllegalStateException(key + " [" + layer + "] already " + state
                            + " for snapshot " + snapshotVersion);
                }
                if (state == PromotionState.PENDING) {
                    return null;
                }
            }
            ManifestEntry base = current.orElseGet(() -> ManifestEntry.builder().build());
            return base.toBuilder()
                    .grain(base.getGrain() != null ? base.getGrain() : Grain.ofPartitionId(key.getPartitionId()).label())
                    .status(statusOnBegin(current, snapshotVersion))
                    .snapshotVersion(snapshotVersion)
                    .promotionState(PromotionState.PENDING)
                    .promoted(false)
                    .dqLevel(null)
                    .dqPassed(null)
                    .build();
        });
    }

    /**
     * PENDING to EVALUATED with the gate's outcome.
     *
     * @param contentHash hash of the evaluated output, or null to keep the stored one
     * @param recordCount rows that passed row-level checks, or null to keep the stored count
     */
    public ManifestEntry evaluate(PartitionKey key, Layer layer, String snapshotVersion, GateVerdict verdict,
                                  String contentHash, Long recordCount) {
        return writer.write(key, layer, current -> {
            ManifestEntry entry = require(current, key, layer, snapshotVersion, PromotionState.PENDING);
            ManifestEntry.ManifestEntryBuilder next = entry.toBuilder()
                    .promotionState(PromotionState.EVALUATED)
                    .dqLevel(verdict.getDqLevel())
                    .dqPassed(verdict.isDqPassed());
            if (contentHash != null) next.contentHash(contentHash);
            if (recordCount != null) next.recordCount(recordCount);
            return next.build();
        });
    }

    /**
     * EVALUATED to PROMOTED or REJECTED.
     */
    public ManifestEntry decide(PartitionKey key, Layer layer, String snapshotVersion) {
        ManifestEntry decided = writer.write(key, layer, current -> {
            ManifestEntry entry = require(current, key, layer, snapshotVersion, PromotionState.EVALUATED);
            boolean promote = !isGated(layer) || Boolean.TRUE.equals(entry.getDqPassed());
            return entry.toBuilder()
                    .promotionState(promote ? PromotionState.PROMOTED : PromotionState.REJECTED)
                    .promoted(promote)
                    .build();
        });
        metrics.recordPromotion(layer, decided.getPromotionState());
        if (decided.isPromoted() && Boolean.FALSE.equals(decided.getDqPassed())) {
            log.warn("[PROMOTION] {} [{}] promoted with dq_passed=false (layer not gated), dq_level={}",
                    key, layer, decided.getDqLevel());
        } else {
            log.info("[PROMOTION] {} [{}] {} dq_level={}", key, layer, decided.getPromotionState(), decided.getDqLevel());
        }
        return decided;
    }

    /** begin, evaluate and decide in one go. */
    public ManifestEntry advance(PartitionKey key, Layer layer, String snapshotVersion, GateVerdict verdict,
                                 String contentHash, Long recordCount) {
        begin(key, layer, snapshotVersion);
        evaluate(key, layer, snapshotVersion, verdict, contentHash, recordCount);
        return decide(key, layer, snapshotVersion);
    }

    /**
     * Absent or deleted entries start NEW. An entry without a promotion state (just written by
     * discovery) or already on this version keeps its status. An entry re-entering after an
     * earlier decision is DIRTY.
     */
    private static ManifestStatus statusOnBegin(Optional<ManifestEntry> current, String snapshotVersion) {
        if (current.isEmpty() || current.get().getStatus() == null
                || current.get().getStatus() == ManifestStatus.DELETED) {
            return ManifestStatus.NEW;
        }
        ManifestEntry e = current.get();
        boolean fresh = e.getPromotionState() == null || snapshotVersion.equals(e.getSnapshotVersion());
        return fresh ? e.getStatus() : ManifestStatus.DIRTY;
    }

    private static ManifestEntry require(Optional<ManifestEntry> current, PartitionKey key, Layer layer,
                                         String snapshotVersion, PromotionState expected) {
        if (current.isEmpty()) {
            throw new IllegalStateException(key + " [" + layer + "] has no manifest entry; call begin first");
        }
        ManifestEntry e = current.get();
        if (!snapshotVersion.equals(e.getSnapshotVersion()) || e.getPromotionState() != expected) {
            throw new IllegalStateException(key + " [" + layer + "] expected " + expected + " for snapshot "
                    + snapshotVersion + " but is " + e.getPromotionState() + " for snapshot " + e.getSnapshotVersion());
        }
        return e;
    }
}
