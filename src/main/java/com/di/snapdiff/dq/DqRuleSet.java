package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;

import java.util.List;
import java.util.Map;

/**
 * Validated, immutable DQ checks per entity and layer.
 */
public record DqRuleSet(Map<String, Map<Layer, List<DqCheck>>> checks) {

    public DqRuleSet {
        checks = checks == null ? Map.of() : Map.copyOf(checks);
    }

    public static DqRuleSet empty() {
        return new DqRuleSet(Map.of());
    }

    public List<DqCheck> checksFor(String entity, Layer layer) {
        Map<Layer, List<DqCheck>> byLayer = checks.get(entity);
        if (byLayer == null) {
            return List.of();
        }
        return byLayer.getOrDefault(layer, List.of());
    }
}
