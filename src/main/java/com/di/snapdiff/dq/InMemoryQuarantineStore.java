package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "memory")
public class InMemoryQuarantineStore implements QuarantineStore {

    private final List<QuarantineRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void save(List<QuarantineRecord> batch) {
        records.addAll(batch);
    }

    @Override
    public List<QuarantineRecord> findByPartition(PartitionKey key, Layer layer) {
        return records.stream()
                .filter(r -> r.getKey().equals(key) && r.getLayer() == layer)
                .toList();
    }
}
