package com.di.snapdiff.dq;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw shape of the DQ rule YAML: entity, then lower-case layer name, then checks.
 */
@Data
public class DqRulesYamlRoot {
    private Map<String, Map<String, List<DqCheckSpec>>> entities = new LinkedHashMap<>();
}
