package com.di.snapdiff.routing;

import com.di.snapdiff.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads and validates the routing YAML once per process. Any defect in the file is a
 * {@link ConfigurationException}; nothing is skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final ResourceLoader resourceLoader;

    public RoutingRuleSet load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Routing file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RoutingRuleSet rules = parse(in);
            log.info("[ROUTER] loaded {} rule(s) ({} enabled) from {}",
                    rules.rules().size(), rules.enabledRules().size(), location);
            return rules;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read routing file " + location + ": " + e.getMessage(), e);
        }
    }

    public RoutingRuleSet parse(InputStream in) {
        RoutingYamlRoot root;
        try {
            root = YAML_MAPPER.readValue(in, RoutingYamlRoot.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed routing YAML: " + e.getMessage(), e);
        }
        if (root == null || root.getRules() == null || root.getRules().isEmpty()) {
            throw new ConfigurationException("Routing YAML defines no rules");
        }
        List<RoutingRule> rules = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (RoutingYamlRoot.RuleYaml r : root.getRules()) {
            String where = "rule #" + index++;
            require(r.getRouteId(), "route_id", where);
            where = "rule '" + r.getRouteId() + "'";
            require(r.getPattern(), "pattern", where);
            require(r.getEntity(), "entity", where);
            require(r.getGrain(), "grain", where);
            if (!seen.add(r.getRouteId())) {
                throw new ConfigurationException("Duplicate route_id '" + r.getRouteId() + "'");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(r.getPattern());
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid pattern in " + where + ": " + e.getDescription(), e);
            }
            rules.add(RoutingRule.builder()
                    .routeId(r.getRouteId())
                    .pattern(pattern)
                    .sourceId(r.getSourceId())
                    .entity(r.getEntity())
                    .grain(Grain.parse(r.getGrain()))
                    .enabled(r.getEnabled() == null || r.getEnabled())
                    .fieldMapping(r.getFieldMapping() == null ? Map.of() : Map.copyOf(r.getFieldMapping()))
                    .build());
        }
        return new RoutingRuleSet(rules);
    }

    private static void require(String value, String field, String where) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing '" + field + "' in " + where);
        }
    }
}
