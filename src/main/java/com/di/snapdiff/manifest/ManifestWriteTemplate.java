package com.di.snapdiff.manifest;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.metrics.SnapDiffMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-modify-write against the {@link ManifestRegistry} with bounded retry.
 *
 * <p>The mutation receives the current entry (if any) and returns the desired entry, or
 * {@code null} to skip the write. The template stamps the read version onto the result, so a
 * concurrent writer in between surfaces as a conflict, triggering a re-read. After
 * {@code snapdiff.manifest.max-conflict-retries} retries the conflict is raised for that key.
 */
@Slf4j
@Component
public class ManifestWriteTemplate {

    private final ManifestRegistry registry;
    private final int maxRetries;
    private final SnapDiffMetrics metrics;

    public ManifestWriteTemplate(ManifestRegistry registry, SnapDiffProperties properties, SnapDiffMetrics metrics) {
        this.registry = registry;
        this.maxRetries = properties.getManifest().getMaxConflictRetries();
        this.metrics = metrics;
    }

    /**
     * @return the entry as stored after the write, or the current entry when the mutation skipped
     * @throws ManifestConflictException when every attempt hit a stale version
     */
    public ManifestEntry write(PartitionKey key, Layer layer,
                               Function<Optional<ManifestEntry>, ManifestEntry> mutation) {
        ManifestConflictException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Optional<ManifestEntry> current = registry.lookup(key, layer);
            ManifestEntry desired = mutation.apply(current);
            if (desired == null) {
                return current.orElse(null);
            }
            desired = desired.toBuilder()
                    .key(key)
                    .layer(layer)
                    .version(current.map(ManifestEntry::getVersion).orElse(0L))
                    .build();
            try {
                return registry.upsert(desired);
            } catch (ManifestConflictException e) {
                last = e;
                if (attempt < maxRetries) {
                    metrics.recordRetry();
                    log.debug("[MANIFEST] conflict on {} [{}], retry {}/{}", key, layer, attempt + 1, maxRetries);
                }
            }
        }
        metrics.recordConflict();
        log.warn("[MANIFEST] giving up on {} [{}] after {} attempts: {}", key, layer, maxRetries + 1, last.getMessage());
        throw last;
    }
}
