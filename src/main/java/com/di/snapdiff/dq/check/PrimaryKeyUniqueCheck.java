package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * No two rows share the same key tuple. The first occurrence is kept; later ones are rejected.
 * Metric: duplicate row count.
 */
public class PrimaryKeyUniqueCheck extends AbstractDqCheck {

    public PrimaryKeyUniqueCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        requireColumns(data, columns);
        Set<List<String>> seen = new HashSet<>();
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            List<String> tuple = new ArrayList<>(columns.size());
            for (String c : columns) {
                Object v = rows.get(i).get(c);
                tuple.add(v == null ? null : v.toString());
            }
            if (!seen.add(tuple)) {
                rejected.add(new RejectedRow(i, "duplicate_pk:" + tuple));
            }
        }
        return outcome(rejected, rejected.size(), rejected.size() + " duplicate key row(s) on " + columns);
    }
}
