package com.di.snapdiff.manifest;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory PartitionLinkStore, paired with InMemoryManifestRegistry.
 */
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "memory")
public class InMemoryPartitionLinkStore implements PartitionLinkStore {

    private final Map<PartitionKey, Map<String, PartitionLink>> linksByKey = new ConcurrentHashMap<>();

    @Override
    public void link(PartitionLink link) {
        linksByKey.computeIfAbsent(link.getKey(), k -> new ConcurrentHashMap<>())
                .putIfAbsent(link.getFilePath() + "#" + link.getContentHash(), link);
    }

    @Override
    public List<PartitionLink> findByPartition(PartitionKey key) {
        Map<String, PartitionLink> links = linksByKey.get(key);
        if (links == null) return List.of();
        List<PartitionLink> out = new ArrayList<>(links.values());
        out.sort(Comparator.comparing(PartitionLink::getSnapshotVersion).reversed()
                .thenComparing(PartitionLink::getFilePath));
        return out;
    }
}
