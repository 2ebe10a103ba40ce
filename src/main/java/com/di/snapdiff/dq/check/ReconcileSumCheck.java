package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The first column equals the sum of the others, within {@link #TOLERANCE}. Null parts count as
 * zero; rows with a null total are skipped. Metric: rejected row count.
 */
public class ReconcileSumCheck extends AbstractDqCheck {

    static final double TOLERANCE = 1e-6;

    public ReconcileSumCheck(String name, Severity severity, List<String> columns) {
        super(name, severity, columns);
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        requireColumns(data, columns);
        String totalColumn = columns.get(0);
        List<String> parts = columns.subList(1, columns.size());
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            try {
                Double total = toDouble(row.get(totalColumn));
                if (total == null) {
                    continue;
                }
                double sum = 0;
                for (String p : parts) {
                    Double v = toDouble(row.get(p));
                    sum += v == null ? 0 : v;
                }
                if (Math.abs(total - sum) > TOLERANCE) {
                    rejected.add(new RejectedRow(i, "sum_mismatch:" + total + "!=" + sum));
                }
            } catch (NumberFormatException e) {
                rejected.add(new RejectedRow(i, "not_numeric"));
            }
        }
        return outcome(rejected, rejected.size(),
                rejected.size() + " row(s) where " + totalColumn + " != sum" + parts);
    }
}
