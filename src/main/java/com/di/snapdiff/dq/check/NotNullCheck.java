package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Every listed column is non-null on every row. Backs both {@code not_null} and
 * {@code pk_not_null}; only the reason prefix differs. Metric: rejected row count.
 */
public class NotNullCheck extends AbstractDqCheck {

    private final String reason;

    public NotNullCheck(String name, Severity severity, List<String> columns, String reason) {
        super(name, severity, columns);
        this.reason = reason;
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        requireColumns(data, columns);
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            for (String c : columns) {
                if (isNull(rows.get(i).get(c))) {
                    rejected.add(new RejectedRow(i, reason + ":" + c));
                    break;
                }
            }
        }
        return outcome(rejected, rejected.size(), rejected.size() + " row(s) with " + reason + " in " + columns);
    }
}
