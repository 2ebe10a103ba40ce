package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.Severity;

import java.util.List;

/**
 * Partition has at least {@code threshold} rows. Metric: row count.
 */
public class MinRecordsCheck extends AbstractDqCheck {

    private final long threshold;

    public MinRecordsCheck(String name, Severity severity, long threshold) {
        super(name, severity, List.of());
        this.threshold = threshold;
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        int n = data.rows().size();
        return n >= threshold
                ? CheckOutcome.pass(name, severity, (double) n)
                : CheckOutcome.fail(name, severity, (double) n, "records " + n + " < " + threshold);
    }
}
