package com.di.snapdiff.routing;

import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.hashing.ContentHasher;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw (source, partition) identifiers onto canonical partition keys. Pure function of the
 * rule set; performs no I/O.
 *
 * <ul>
 *   <li>Same grain: one key per covered year or month.</li>
 *   <li>Expansion (year file, month entity): one key per month, each with a slice hash.</li>
 *   <li>Collapse (month files, year entity): several raw partitions share one key; its hash is
 *       {@link #collapseHash(Collection)} over all contributors.</li>
 * </ul>
 * A raw source matched by no enabled rule is a {@link ConfigurationException}.
 */
@Slf4j
public class Router {

    private final RoutingRuleSet ruleSet;

    public Router(RoutingRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    public List<PartitionKey> resolve(String rawSourceId, String rawPartitionId) {
        return route(rawSourceId, RawPartitionId.parse(rawPartitionId), null).stream()
                .map(RoutedPartition::key)
                .toList();
    }

    /**
     * @param rawHash content hash of the raw partition, or null to skip hash scoping
     */
    public List<RoutedPartition> route(String rawSourceId, RawPartitionId rawId, String rawHash) {
        List<RoutingRule> matched = ruleSet.enabledRules().stream()
                .filter(r -> r.matches(rawSourceId))
                .toList();
        if (matched.isEmpty()) {
            throw new ConfigurationException("No routing rule matches raw source '" + rawSourceId + "'");
        }

        List<RoutedPartition> out = new ArrayList<>();
        Map<PartitionKey, String> routeByKey = new HashMap<>();
        for (RoutingRule rule : matched) {
            List<String> partitionIds = rawId.expand(rule.getGrain());
            boolean sliced = partitionIds.size() > 1;
            for (String pid : partitionIds) {
                PartitionKey key = PartitionKey.of(rule.canonicalSource(rawSourceId), rule.getEntity(), pid);
                String previous = routeByKey.putIfAbsent(key, rule.getRouteId());
                if (previous != null) {
                    throw new ConfigurationException("Rules '" + previous + "' and '" + rule.getRouteId()
                            + "' both route raw source '" + rawSourceId + "' to " + key);
                }
                String scoped = rawHash == null ? null : (sliced ? ContentHasher.slice(rawHash, pid) : rawHash);
                out.add(new RoutedPartition(key, rule.getRouteId(), rule.getGrain(),
                        rawSourceId, rawId.token(), scoped));
            }
        }
        log.debug("[ROUTER] {}:{} -> {} key(s)", rawSourceId, rawId, out.size());
        return out;
    }

    /**
     * Canonical hash of a key fed by several raw partitions. Order-independent; any contributor
     * change changes the result.
     */
    public static String collapseHash(Collection<RoutedPartition> contributions) {
        if (contributions.size() == 1) {
            return contributions.iterator().next().scopedHash();
        }
        List<String> parts = new ArrayList<>(contributions.size());
        for (RoutedPartition c : contributions) {
            parts.add(c.rawSourceId() + "|" + c.rawPartitionId() + "|" + c.scopedHash());
        }
        return ContentHasher.combine(parts);
    }

    public RoutingRuleSet ruleSet() {
        return ruleSet;
    }
}
