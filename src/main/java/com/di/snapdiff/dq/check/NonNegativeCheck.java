package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Numeric columns are {@code >= 0}. Nulls are left to {@code not_null}; non-numeric text is
 * rejected. Metric: rejected row count.
 */
public class NonNegativeCheck extends AbstractDqCheck {

    public NonNegativeCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        requireColumns(data, columns);
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            for (String c : columns) {
                String reason = null;
                try {
                    Double v = toDouble(rows.get(i).get(c));
                    if (v != null && v < 0) {
                        reason = "negative:" + c;
                    }
                } catch (NumberFormatException e) {
                    reason = "not_numeric:" + c;
                }
                if (reason != null) {
                    rejected.add(new RejectedRow(i, reason));
                    break;
                }
            }
        }
        return outcome(rejected, rejected.size(), rejected.size() + " row(s) negative or non-numeric in " + columns);
    }
}
