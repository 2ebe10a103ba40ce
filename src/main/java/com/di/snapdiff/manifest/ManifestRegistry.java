package com.di.snapdiff.manifest;

import com.di.snapdiff.promotion.PromotionState;

import java.util.List;
import java.util.Optional;

/**
 * Durable (partition key, layer) → last-known state. Single source of truth for incremental state.
 * Implementations can be in-memory or JDBC (see schema/snapdiff-schema.sql).
 *
 * <p>Upserts are conflict-checked: the caller supplies the version it read ({@code 0} when it saw
 * no entry). A write whose content equals the stored content only refreshes
 * {@code lastSeenAt}; any other write with a stale version raises
 * {@link ManifestConflictException}. Writes to different keys never block each other.
 */
public interface ManifestRegistry {

    Optional<ManifestEntry> lookup(PartitionKey key, Layer layer);

    /**
     * @return the stored entry after the write, carrying its new version
     * @throws ManifestConflictException if {@code entry.getVersion()} is stale
     */
    ManifestEntry upsert(ManifestEntry entry);

    List<PartitionKey> listByStatus(Layer layer, ManifestStatus status);

    List<PartitionKey> listByPromotionState(Layer layer, PromotionState state);

    /** All entries of a layer, any status. */
    List<ManifestEntry> listByLayer(Layer layer);
}
