package com.di.snapdiff.dq;

import com.di.snapdiff.dq.check.ForeignKeyCheck;
import com.di.snapdiff.dq.check.MinRecordsCheck;
import com.di.snapdiff.dq.check.NonNegativeCheck;
import com.di.snapdiff.dq.check.NotNullCheck;
import com.di.snapdiff.dq.check.PartitionMatchesKeyCheck;
import com.di.snapdiff.dq.check.PartitionSingleValueCheck;
import com.di.snapdiff.dq.check.PrimaryKeyUniqueCheck;
import com.di.snapdiff.dq.check.ReconcileSumCheck;
import com.di.snapdiff.dq.check.SchemaCheck;
import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.manifest.Layer;
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
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the DQ rule YAML once per process and builds the checks. A malformed file, unknown
 * check type or severity, or a check missing its columns is a {@link ConfigurationException}.
 * A missing file yields an empty rule set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DqRuleLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final ResourceLoader resourceLoader;

    public DqRuleSet load(String location) {
        if (location == null || location.isBlank()) {
            return DqRuleSet.empty();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[DQ] rule file {} not found; no checks configured", location);
            return DqRuleSet.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            DqRuleSet rules = parse(in);
            log.info("[DQ] loaded rules for {} entit(ies) from {}", rules.checks().size(), location);
            return rules;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read DQ rule file " + location + ": " + e.getMessage(), e);
        }
    }

    public DqRuleSet parse(InputStream in) {
        DqRulesYamlRoot root;
        try {
            root = YAML_MAPPER.readValue(in, DqRulesYamlRoot.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed DQ rule YAML: " + e.getMessage(), e);
        }
        if (root == null || root.getEntities() == null) {
            return DqRuleSet.empty();
        }
        Map<String, Map<Layer, List<DqCheck>>> checks = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<DqCheckSpec>>> entity : root.getEntities().entrySet()) {
            Map<Layer, List<DqCheck>> byLayer = new EnumMap<>(Layer.class);
            if (entity.getValue() != null) {
                for (Map.Entry<String, List<DqCheckSpec>> layerEntry : entity.getValue().entrySet()) {
                    Layer layer = parseLayer(layerEntry.getKey(), entity.getKey());
                    List<DqCheck> built = new ArrayList<>();
                    Set<String> names = new HashSet<>();
                    for (DqCheckSpec spec : layerEntry.getValue() == null ? List.<DqCheckSpec>of() : layerEntry.getValue()) {
                        DqCheck check = create(spec, entity.getKey() + "." + layerEntry.getKey());
                        if (!names.add(check.name())) {
                            throw new ConfigurationException("Duplicate check name '" + check.name() + "' in "
                                    + entity.getKey() + "." + layerEntry.getKey());
                        }
                        built.add(check);
                    }
                    byLayer.put(layer, List.copyOf(built));
                }
            }
            checks.put(entity.getKey(), byLayer);
        }
        return new DqRuleSet(checks);
    }

    static DqCheck create(DqCheckSpec spec, String where) {
        if (spec == null || spec.getType() == null || spec.getType().isBlank()) {
            throw new ConfigurationException("DQ check without 'type' in " + where);
        }
        String type = spec.getType().trim().toLowerCase(Locale.ROOT);
        String name = spec.getName() == null || spec.getName().isBlank() ? type : spec.getName();
        Severity severity = parseSeverity(spec.getSeverity(), name, where);
        List<String> columns = spec.getColumns() == null ? List.of() : spec.getColumns();

        return switch (type) {
            case "schema" -> new SchemaCheck(name, severity, requireColumns(columns, 1, name, where));
            case "pk_not_null" -> new NotNullCheck(name, severity, requireColumns(columns, 1, name, where), "null_pk");
            case "not_null" -> new NotNullCheck(name, severity, requireColumns(columns, 1, name, where), "null");
            case "pk_unique" -> new PrimaryKeyUniqueCheck(name, severity, requireColumns(columns, 1, name, where));
            case "partition_single_value" ->
                    new PartitionSingleValueCheck(name, severity, requireColumns(columns, 1, name, where));
            case "partition_matches_key" ->
                    new PartitionMatchesKeyCheck(name, severity, requireColumns(columns, 1, name, where));
            case "non_negative" -> new NonNegativeCheck(name, severity, requireColumns(columns, 1, name, where));
            case "foreign_key" -> {
                if (spec.getReference() == null || spec.getReference().isBlank()) {
                    throw new ConfigurationException("Check '" + name + "' in " + where + " needs 'reference'");
                }
                yield new ForeignKeyCheck(name, severity, requireColumns(columns, 1, name, where), spec.getReference());
            }
            case "reconcile_sum" -> new ReconcileSumCheck(name, severity, requireColumns(columns, 2, name, where));
            case "min_records" -> {
                if (spec.getThreshold() == null || spec.getThreshold() < 0) {
                    throw new ConfigurationException("Check '" + name + "' in " + where + " needs a non-negative 'threshold'");
                }
                yield new MinRecordsCheck(name, severity, spec.getThreshold().longValue());
            }
            default -> throw new ConfigurationException("Unknown DQ check type '" + spec.getType() + "' in " + where);
        };
    }

    private static Layer parseLayer(String value, String entity) {
        try {
            return Layer.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown layer '" + value + "' for entity " + entity, e);
        }
    }

    private static Severity parseSeverity(String value, String name, String where) {
        if (value == null || value.isBlank()) {
            return Severity.CRITICAL;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown severity '" + value + "' for check '" + name + "' in " + where, e);
        }
    }

    private static List<String> requireColumns(List<String> columns, int min, String name, String where) {
        if (columns.size() < min) {
            throw new ConfigurationException("Check '" + name + "' in " + where + " needs at least " + min + " column(s)");
        }
        return columns;
    }
}
