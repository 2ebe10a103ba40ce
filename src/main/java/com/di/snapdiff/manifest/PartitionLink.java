package com.di.snapdiff.manifest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code partition_links} table: one raw file's contribution to one
 * canonical partition, with the rule that routed it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionLink {

    private PartitionKey key;
    private String rawSourceId;
    private String rawPartitionId;
    private String filePath;

    /** Hash of the raw file, before slicing. */
    private String contentHash;

    private String routeId;
    private String snapshotVersion;
    private Instant linkedAt;
}
