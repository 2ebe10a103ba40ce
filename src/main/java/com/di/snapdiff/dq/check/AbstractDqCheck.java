package com.di.snapdiff.dq.check;

import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.DqCheck;
import com.di.snapdiff.dq.DqCheckException;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.dq.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared plumbing for column-based checks: column presence, null and numeric handling, and
 * building outcomes with rejected rows.
 */
public abstract class AbstractDqCheck implements DqCheck {

    protected final String name;
    protected final Severity severity;
    protected final List<String> columns;

    protected AbstractDqCheck(String name, Severity severity, List<String> columns) {
        this.name = name;
        this.severity = severity;
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Severity severity() {
        return severity;
    }

    /** Union of keys across all rows. */
    protected static Set<String> presentColumns(PartitionData data) {
        Set<String> present = new LinkedHashSet<>();
        for (Map<String, Object> row : data.rows()) {
            present.addAll(row.keySet());
        }
        return present;
    }

    /**
     * Row-level checks cannot run against a column no row carries. An empty partition has
     * nothing to check and passes.
     */
    protected void requireColumns(PartitionData data, List<String> required) {
        if (data.rows().isEmpty()) {
            return;
        }
        Set<String> present = presentColumns(data);
        List<String> missing = new ArrayList<>();
        for (String c : required) {
            if (!present.contains(c)) {
                missing.add(c);
            }
        }
        if (!missing.isEmpty()) {
            throw new DqCheckException("Check '" + name + "' on " + data.key() + ": missing column(s) " + missing);
        }
    }

    protected static boolean isNull(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof Double d) return d.isNaN();
        if (value instanceof Float f) return f.isNaN();
        return false;
    }

    /**
     * @return the numeric value, or null for a null-like value
     * @throws NumberFormatException for a non-numeric string
     */
    protected static Double toDouble(Object value) {
        if (isNull(value)) return null;
        if (value instanceof Number n) return n.doubleValue();
        return Double.parseDouble(value.toString().trim());
    }

    protected CheckOutcome outcome(List<RejectedRow> rejected, double metric, String failDetail) {
        if (rejected.isEmpty()) {
            return CheckOutcome.pass(name, severity, metric);
        }
        return CheckOutcome.builder()
                .checkName(name)
                .severity(severity)
                .passed(false)
                .metricValue(metric)
                .detail(failDetail)
                .rejectedRows(rejected)
                .build();
    }
}
