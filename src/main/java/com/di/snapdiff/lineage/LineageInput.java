package com.di.snapdiff.lineage;

/**
 * One input of a lineage event: a raw file or an upstream partition.
 */
public record LineageInput(String layer,
                           String entity,
                           String partitionKey,
                           String filePath,
                           String contentHash,
                           String routeId) {
}
