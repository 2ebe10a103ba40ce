package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.Severity;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * At most one distinct non-null value of the partition column. Metric: distinct value count.
 */
public class PartitionSingleValueCheck extends AbstractDqCheck {

    public PartitionSingleValueCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        String column = columns.get(0);
        requireColumns(data, List.of(column));
        TreeSet<String> distinct = new TreeSet<>();
        for (Map<String, Object> row : data.rows()) {
            Object v = row.get(column);
            if (!isNull(v)) {
                distinct.add(PartitionValues.normalize(v, data.grain()));
            }
        }
        return distinct.size() <= 1
                ? CheckOutcome.pass(name, severity, (double) distinct.size())
                : CheckOutcome.fail(name, severity, (double) distinct.size(),
                "multiple values of " + column + ": " + distinct);
    }
}
