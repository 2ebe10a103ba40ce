package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.DqCheckException;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Non-null values exist in the named reference set. A partition evaluated without that set
 * cannot be checked. Metric: rejected row count.
 */
public class ForeignKeyCheck extends AbstractDqCheck {

    private final String reference;

    public ForeignKeyCheck(String name, Severity severity, List<String> columns, String reference) {
        super(name, severity, columns);
        this.reference = reference;
    }

    @Override
    public CheckOutcome evaluate(PartitionData data) {
        Set<String> allowed = data.references().get(reference);
        if (allowed == null) {
            throw new DqCheckException("Check '" + name + "' on " + data.key()
                    + ": reference set '" + reference + "' not provided");
        }
        requireColumns(data, columns);
        List<RejectedRow> rejected = new ArrayList<>();
        List<Map<String, Object>> rows = data.rows();
        for (int i = 0; i < rows.size(); i++) {
            for (String c : columns) {
                Object v = rows.get(i).get(c);
                if (!isNull(v) && !allowed.contains(v.toString().trim())) {
                    rejected.add(new RejectedRow(i, "fk_missing:" + c + "=" + v));
                    break;
                }
            }
        }
        return outcome(rejected, rejected.size(),
                rejected.size() + " row(s) with " + columns + " not in '" + reference + "'");
    }
}
