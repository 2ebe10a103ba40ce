package com.di.snapdiff.dq;

import com.di.snapdiff.discovery.SnapshotSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks applied to every raw file's summary at discovery. Any failure is CRITICAL; bronze
 * records the outcome but never blocks.
 *
 * <p>Checks whose inputs the summary does not carry (no cutoff years, unknown record count)
 * are not emitted.
 */
public final class BronzeDqPolicy {

    public static final String CUTOFF_VALID = "cutoff_valid";
    public static final String RECORDS_PRESENT = "records_present";
    public static final String BYTES_PRESENT = "bytes_present";
    public static final String HASH_PRESENT = "hash_present";
    public static final String SIDECAR_DQ = "sidecar_dq";

    private BronzeDqPolicy() {
    }

    public static List<CheckOutcome> evaluate(SnapshotSummary s) {
        List<CheckOutcome> out = new ArrayList<>();
        if (s.getCutoffYear() != null && s.getStartYear() != null) {
            out.add(check(CUTOFF_VALID, s.getStartYear() <= s.getCutoffYear(),
                    s.getCutoffYear().doubleValue(), "cutoff_invalid"));
        }
        if (s.getRecords() != null) {
            out.add(check(RECORDS_PRESENT, s.getRecords() > 0, s.getRecords().doubleValue(), "zero_records"));
        }
        long bytes = s.getBytes() == null ? 0L : s.getBytes();
        out.add(check(BYTES_PRESENT, bytes > 0, (double) bytes, "zero_bytes"));
        out.add(check(HASH_PRESENT, s.getHash() != null && !s.getHash().isBlank(), null, "empty_hash"));

        if (Boolean.FALSE.equals(s.getDqPassed())) {
            Severity level = Severity.parseLenient(s.getDqLevel());
            out.add(CheckOutcome.fail(SIDECAR_DQ, level == null ? Severity.CRITICAL : level, null,
                    "writer reported dq_passed=false" + (s.getError() != null ? ": " + s.getError() : "")));
        }
        return out;
    }

    private static CheckOutcome check(String name, boolean ok, Double metric, String reason) {
        return ok ? CheckOutcome.pass(name, Severity.CRITICAL, metric)
                : CheckOutcome.fail(name, Severity.CRITICAL, metric, reason);
    }
}
