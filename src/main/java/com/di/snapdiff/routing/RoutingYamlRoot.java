package com.di.snapdiff.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw shape of the routing YAML, before validation.
 */
@Data
public class RoutingYamlRoot {

    private List<RuleYaml> rules = new ArrayList<>();

    @Data
    public static class RuleYaml {
        @JsonProperty("route_id")
        private String routeId;
        private String pattern;
        @JsonProperty("source_id")
        private String sourceId;
        private String entity;
        private String grain;
        private Boolean enabled;
        @JsonProperty("field_mapping")
        private Map<String, String> fieldMapping = new LinkedHashMap<>();
    }
}
