package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Aggregate of all check results for one partition in one layer.
 * {@code dqLevel} is the highest severity among failed checks (INFO when none failed);
 * {@code dqPassed} is false iff a CRITICAL check failed.
 */
@Value
@Builder
public class GateVerdict {
    PartitionKey key;
    Layer layer;
    String snapshotVersion;
    List<DQResult> results;
    Severity dqLevel;
    boolean dqPassed;

    /** Rejected rows by check name, in check order. */
    Map<String, List<RejectedRow>> rejectedByCheck;

    int rowCount;

    public static GateVerdict of(PartitionKey key, Layer layer, String snapshotVersion,
                                 List<DQResult> results, Map<String, List<RejectedRow>> rejectedByCheck,
                                 int rowCount) {
        return GateVerdict.builder()
                .key(key)
                .layer(layer)
                .snapshotVersion(snapshotVersion)
                .results(List.copyOf(results))
                .dqLevel(levelOf(results))
                .dqPassed(passedOf(results))
                .rejectedByCheck(rejectedByCheck == null ? Map.of() : rejectedByCheck)
                .rowCount(rowCount)
                .build();
    }

    public static Severity levelOf(Collection<DQResult> results) {
        Severity level = Severity.INFO;
        for (DQResult r : results) {
            if (!r.isPassed()) {
                level = Severity.max(level, r.getSeverity());
            }
        }
        return level;
    }

    public static boolean passedOf(Collection<DQResult> results) {
        return results.stream().noneMatch(DQResult::isBlocking);
    }

    /** Distinct row indexes rejected by any check. */
    public Set<Integer> rejectedRowIndexes() {
        Set<Integer> idx = new TreeSet<>();
        rejectedByCheck.values().forEach(rows -> rows.forEach(r -> idx.add(r.rowIndex())));
        return idx;
    }

    public int acceptedRowCount() {
        return rowCount - rejectedRowIndexes().size();
    }

    public long failedCount() {
        return results.stream().filter(r -> !r.isPassed()).count();
    }
}
