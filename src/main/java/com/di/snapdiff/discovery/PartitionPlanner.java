package com.di.snapdiff.discovery;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.ManifestRegistry;
import com.di.snapdiff.manifest.PartitionLink;
import com.di.snapdiff.manifest.PartitionLinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Work list for the next stage: NEW and DIRTY partitions of a layer, oldest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PartitionPlanner {

    private static final Comparator<ManifestEntry> ORDER = Comparator
            .comparing(ManifestEntry::getLastSeenAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(e -> e.getKey().getEntity())
            .thenComparing(e -> e.getKey().getPartitionId())
            .thenComparing(e -> e.getKey().getSourceId());

    private final ManifestRegistry registry;
    private final PartitionLinkStore linkStore;

    public List<PartitionPlan> plan(Layer layer) {
        List<PartitionPlan> plans = registry.listByLayer(layer).stream()
                .filter(e -> e.getStatus() != null && e.getStatus().isDirty())
                .sorted(ORDER)
                .map(e -> new PartitionPlan(e, latestInputs(e)))
                .toList();
        log.info("[DISCOVERY] plan for {}: {} dirty partition(s)", layer, plans.size());
        return plans;
    }

    private List<PartitionLink> latestInputs(ManifestEntry entry) {
        List<PartitionLink> links = linkStore.findByPartition(entry.getKey());
        if (links.isEmpty()) {
            return List.of();
        }
        String latest = links.get(0).getSnapshotVersion();
        return links.stream()
                .filter(l -> latest.equals(l.getSnapshotVersion()))
                .sorted(Comparator.comparing(PartitionLink::getFilePath))
                .toList();
    }
}
