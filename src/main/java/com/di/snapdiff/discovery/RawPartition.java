package com.di.snapdiff.discovery;

import com.di.snapdiff.hashing.ContentHasher;
import com.di.snapdiff.routing.RawPartitionId;
import lombok.Value;

import java.util.List;

/**
 * All part files of one raw source sharing one coverage token.
 */
@Value
public class RawPartition {
    String rawSourceId;
    RawPartitionId id;
    List<RawFile> files;
    String contentHash;
    /** Null when any part's record count is unknown. */
    Long recordCount;
    long byteSize;

    public static RawPartition of(String rawSourceId, RawPartitionId id, List<RawFile> files) {
        String hash = files.size() == 1
                ? files.get(0).getHash()
                : ContentHasher.combine(files.stream().map(RawFile::getHash).toList());
        Long records = 0L;
        long bytes = 0;
        for (RawFile f : files) {
            Long r = f.getSummary().getRecords();
            records = records == null || r == null ? null : records + r;
            bytes += f.getBytes();
        }
        return new RawPartition(rawSourceId, id, List.copyOf(files), hash, records, bytes);
    }

    public boolean hasHashMismatch() {
        return files.stream().anyMatch(f -> f.getMismatch() != null);
    }
}
