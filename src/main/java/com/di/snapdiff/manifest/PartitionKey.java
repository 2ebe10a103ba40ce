package com.di.snapdiff.manifest;

import lombok.NonNull;
import lombok.Value;

/**
 * Canonical partition identity: (source, entity, partition id). Partition ids are {@code YYYY}
 * or {@code YYYY-MM}.
 */
@Value
public class PartitionKey implements Comparable<PartitionKey> {

    @NonNull String sourceId;
    @NonNull String entity;
    @NonNull String partitionId;

    public static PartitionKey of(String sourceId, String entity, String partitionId) {
        return new PartitionKey(sourceId, entity, partitionId);
    }

    /** Parses the {@code source/entity/partition} form produced by {@link #toString()}. */
    public static PartitionKey parse(String text) {
        String[] parts = text == null ? new String[0] : text.split("/");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected source/entity/partition but got: " + text);
        }
        return new PartitionKey(parts[0], parts[1], parts[2]);
    }

    @Override
    public int compareTo(PartitionKey o) {
        int c = sourceId.compareTo(o.sourceId);
        if (c != 0) return c;
        c = entity.compareTo(o.entity);
        if (c != 0) return c;
        return partitionId.compareTo(o.partitionId);
    }

    @Override
    public String toString() {
        return sourceId + "/" + entity + "/" + partitionId;
    }
}
