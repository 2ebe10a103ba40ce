package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The partition column equals the partition id on every row. Metric: mismatched row count.
 */
public class PartitionMatchesKeyCheck extends AbstractDqCheck {

    public PartitionMatchesKeyCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        String column = columns.get(0);
        requireColumns(data, List.of(column));
        String expected = data.key().getPartitionId();
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            String actual = PartitionValues.normalize(rows.get(i).get(column), data.grain());
            if (!expected.equals(actual)) {
                rejected.add(new RejectedRow(i, "partition_mismatch:" + actual));
            }
        }
        return outcome(rejected, rejected.size(),
                rejected.size() + " row(s) where " + column + " != " + expected);
    }
}
