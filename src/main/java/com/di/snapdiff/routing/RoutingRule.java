package com.di.snapdiff.routing;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * One validated routing rule. Immutable for the life of the run.
 */
@Value
@Builder
public class RoutingRule {

    String routeId;

    /** Full-match regex against the raw source id. */
    Pattern pattern;

    /** Canonical source id; null means the raw source id is kept. */
    String sourceId;

    String entity;
    Grain grain;
    boolean enabled;

    /** Raw field name to canonical field name. Consumed by downstream harmonization. */
    Map<String, String> fieldMapping;

    public boolean matches(String rawSourceId) {
        return enabled && pattern.matcher(rawSourceId).matches();
    }

    public String canonicalSource(String rawSourceId) {
        return sourceId == null || sourceId.isBlank() ? rawSourceId : sourceId;
    }
}
