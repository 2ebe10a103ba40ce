package com.di.snapdiff.dq;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a single {@link DqCheck} found, before it is stamped with key, layer and time.
 */
@Value
@Builder(toBuilder = true)
public class CheckOutcome {
    String checkName;
    Severity severity;
    boolean passed;
    Double metricValue;
    String detail;
    @Singular
    List<RejectedRow> rejectedRows;

    public static CheckOutcome pass(String checkName, Severity severity, Double metricValue) {
        return CheckOutcome.builder().checkName(checkName).severity(severity).passed(true)
                .metricValue(metricValue).detail("ok").build();
    }

    public static CheckOutcome fail(String checkName, Severity severity, Double metricValue, String detail) {
        return CheckOutcome.builder().checkName(checkName).severity(severity).passed(false)
                .metricValue(metricValue).detail(detail).build();
    }
}
