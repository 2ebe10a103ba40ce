package com.di.snapdiff.routing;

import java.util.List;

/**
 * The loaded, validated rule list. Rules keep their file order.
 */
public record RoutingRuleSet(List<RoutingRule> rules) {

    public RoutingRuleSet {
        rules = List.copyOf(rules);
    }

    public List<RoutingRule> enabledRules() {
        return rules.stream().filter(RoutingRule::isEnabled).toList();
    }
}
