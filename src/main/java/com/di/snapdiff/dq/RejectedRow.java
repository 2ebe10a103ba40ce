package com.di.snapdiff.dq;

/**
 * A row that failed a row-level check.
 *
 * @param rowIndex position in the evaluated partition
 */
public record RejectedRow(int rowIndex, String reason) {
}
