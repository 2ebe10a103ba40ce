package com.di.snapdiff.promotion;

import com.di.snapdiff.manifest.PartitionKey;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output rows of one partition's transformation, ready for the gate.
 */
public record PartitionInput(PartitionKey key,
                             List<Map<String, Object>> rows,
                             Map<String, Set<String>> references) {
}
