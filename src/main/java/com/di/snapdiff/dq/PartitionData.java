package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.routing.Grain;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows of one canonical partition as handed to the gate, plus the named reference sets that
 * foreign-key checks look values up in.
 */
public record PartitionData(PartitionKey key,
                            Layer layer,
                            List<Map<String, Object>> rows,
                            Map<String, Set<String>> references) {

    public PartitionData {
        rows = rows == null ? List.of() : List.copyOf(rows);
        references = references == null ? Map.of() : Map.copyOf(references);
    }

    public Grain grain() {
        return Grain.ofPartitionId(key.getPartitionId());
    }
}
