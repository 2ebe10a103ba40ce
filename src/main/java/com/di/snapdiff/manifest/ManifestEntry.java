package com.di.snapdiff.manifest;

import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.promotion.PromotionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain model for the {@code manifest_entries} table. One row per (partition key, layer).
 *
 * <p>Raw-state fields ({@code contentHash}, {@code recordCount}, {@code byteSize},
 * {@code snapshotVersion}, {@code status}) are written by discovery. Promotion fields
 * ({@code promotionState}, {@code promoted}, {@code dqLevel}, {@code dqPassed}) are written by
 * the promotion state machine. {@code version} is the optimistic lock: callers hand back the
 * version they read, {@code 0} for an entry they believe absent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ManifestEntry {

    private PartitionKey key;
    private Layer layer;

    /** {@code year} or {@code month}. */
    private String grain;

    private String contentHash;
    private Long recordCount;
    private Long byteSize;
    private String snapshotVersion;
    private ManifestStatus status;

    private PromotionState promotionState;
    private boolean promoted;
    private Severity dqLevel;
    private Boolean dqPassed;

    private Instant createdAt;
    private Instant lastSeenAt;

    private long version;

    /**
     * True when both entries carry the same observable state, ignoring timestamps and version.
     * Writing such an entry again only refreshes {@code lastSeenAt}.
     */
    public boolean sameContentAs(ManifestEntry other) {
        if (other == null) return false;
        return Objects.equals(key, other.key)
                && layer == other.layer
                && Objects.equals(grain, other.grain)
                && Objects.equals(contentHash, other.contentHash)
                && Objects.equals(recordCount, other.recordCount)
                && Objects.equals(byteSize, other.byteSize)
                && Objects.equals(snapshotVersion, other.snapshotVersion)
                && status == other.status
                && promotionState == other.promotionState
                && promoted == other.promoted
                && dqLevel == other.dqLevel
                && Objects.equals(dqPassed, other.dqPassed);
    }
}
