package com.di.snapdiff.discovery;

import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.PartitionLink;
import lombok.Value;

import java.util.List;

/**
 * A dirty partition and the raw files to rebuild it from.
 */
@Value
public class PartitionPlan {
    ManifestEntry entry;
    /** Links of the latest snapshot version that fed this partition, by file path. */
    List<PartitionLink> inputs;

    public List<String> inputFiles() {
        return inputs.stream().map(PartitionLink::getFilePath).toList();
    }
}
