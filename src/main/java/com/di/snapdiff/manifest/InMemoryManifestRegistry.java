package com.di.snapdiff.manifest;

import com.di.snapdiff.promotion.PromotionState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory ManifestRegistry. Suitable for single-process runs and tests; state is lost on exit.
 * When snapdiff.manifest.store=jdbc, JdbcManifestRegistry is used instead.
 *
 * <p>{@link ConcurrentHashMap#compute} serializes writers of one key without locking other keys.
 */
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "memory")
public class InMemoryManifestRegistry implements ManifestRegistry {

    private final Map<Layer, ConcurrentHashMap<PartitionKey, ManifestEntry>> entriesByLayer = new EnumMap<>(Layer.class);
    private final Clock clock;

    public InMemoryManifestRegistry(Clock clock) {
        this.clock = clock;
        for (Layer layer : Layer.values()) {
            entriesByLayer.put(layer, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<ManifestEntry> lookup(PartitionKey key, Layer layer) {
        ManifestEntry e = entriesByLayer.get(layer).get(key);
        return e == null ? Optional.empty() : Optional.of(e.toBuilder().build());
    }

    @Override
    public ManifestEntry upsert(ManifestEntry entry) {
        if (entry == null || entry.getKey() == null || entry.getLayer() == null) {
            throw new IllegalArgumentException("Manifest entry requires key and layer");
        }
        Instant now = clock.instant();
        AtomicReference<ManifestEntry> written = new AtomicReference<>();
        entriesByLayer.get(entry.getLayer()).compute(entry.getKey(), (k, current) -> {
            if (current != null && current.sameContentAs(entry)) {
                ManifestEntry touched = current.toBuilder().lastSeenAt(now).build();
                written.set(touched);
                return touched;
            }
            long currentVersion = current == null ? 0L : current.getVersion();
            if (entry.getVersion() != currentVersion) {
                throw new ManifestConflictException(k, entry.getLayer(), entry.getVersion(), currentVersion);
            }
            ManifestEntry next = entry.toBuilder()
                    .createdAt(current == null ? now : current.getCreatedAt())
                    .lastSeenAt(now)
                    .version(currentVersion + 1)
                    .build();
            written.set(next);
            return next;
        });
        return written.get().toBuilder().build();
    }

    @Override
    public List<PartitionKey> listByStatus(Layer layer, ManifestStatus status) {
        return entriesByLayer.get(layer).values().stream()
                .filter(e -> e.getStatus() == status)
                .map(ManifestEntry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<PartitionKey> listByPromotionState(Layer layer, PromotionState state) {
        return entriesByLayer.get(layer).values().stream()
                .filter(e -> e.getPromotionState() == state)
                .map(ManifestEntry::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<ManifestEntry> listByLayer(Layer layer) {
        return entriesByLayer.get(layer).values().stream()
                .map(e -> e.toBuilder().build())
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .collect(Collectors.toList());
    }
}
