package com.di.snapdiff.routing;

import com.di.snapdiff.manifest.PartitionKey;

/**
 * One canonical partition produced from one raw partition.
 *
 * @param scopedHash the raw hash scoped to this slice; equal to the raw hash when the raw
 *                   partition maps to exactly one key, null when routing without a hash
 */
public record RoutedPartition(PartitionKey key,
                              String routeId,
                              Grain grain,
                              String rawSourceId,
                              String rawPartitionId,
                              String scopedHash) {
}
