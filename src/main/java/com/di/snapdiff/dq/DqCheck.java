package com.di.snapdiff.dq;

/**
 * One configured data quality check.
 */
public interface DqCheck {

    String name();

    Severity severity();

    /**
     * @throws DqCheckException when the check cannot run against this partition
     */
    CheckOutcome evaluate(PartitionData data);
}
