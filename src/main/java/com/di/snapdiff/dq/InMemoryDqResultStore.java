package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory DqResultStore. Active when snapdiff.manifest.store=memory.
 */
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "memory")
public class InMemoryDqResultStore implements DqResultStore {

    private final List<DQResult> results = new CopyOnWriteArrayList<>();

    @Override
    public void append(List<DQResult> batch) {
        results.addAll(batch);
    }

    @Override
    public List<DQResult> findByPartition(PartitionKey key, Layer layer) {
        return results.stream()
                .filter(r -> r.getKey().equals(key) && r.getLayer() == layer)
                .toList();
    }
}
