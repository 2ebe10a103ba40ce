package com.di.snapdiff.dq.check;

import com.di.snapdiff.routing.Grain;

import java.math.BigDecimal;

/**
 * Normalizes partition column values for comparison with partition ids.
 */
final class PartitionValues {

    private PartitionValues() {
    }

    /**
     * Year grain: the integral year ({@code 2021}, {@code 2021.0}, {@code "2021"}).
     * Month grain: the leading {@code YYYY-MM} of the value's text form, so dates and
     * timestamps compare by month.
     */
    static String normalize(Object value, Grain grain) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (grain == Grain.MONTH) {
            return text.length() >= 7 ? text.substring(0, 7) : text;
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
        }
        try {
            return new BigDecimal(text).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            return text.length() >= 4 ? text.substring(0, 4) : text;
        }
    }
}
