package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.Severity;

import java.util.List;
import java.util.Set;

/**
 * Required columns are present. Metric: number of missing columns.
 */
public class SchemaCheck extends AbstractDqCheck {

    public SchemaCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        if (data.rows().isEmpty()) {
            return CheckOutcome.pass(name, severity, 0d);
        }
        Set<String> present = presentColumns(data);
        List<String> missing = columns.stream().filter(c -> !present.contains(c)).toList();
        return missing.isEmpty()
                ? CheckOutcome.pass(name, severity, 0d)
                : CheckOutcome.fail(name, severity, (double) missing.size(), "missing_columns:" + missing);
    }
}
