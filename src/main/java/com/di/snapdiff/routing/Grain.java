package com.di.snapdiff.routing;

import com.di.snapdiff.exception.ConfigurationException;

import java.util.Locale;

/**
 * Partition granularity of a raw file or a canonical entity.
 */
public enum Grain {
    YEAR("year"),
    MONTH("month");

    private final String label;

    Grain(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Grain of a canonical partition id such as {@code 2021} or {@code 2021-03}.
     *
     * @throws ConfigurationException for an id that is not a year or a month
     */
    public static Grain ofPartitionId(String partitionId) {
        return RawPartitionId.parse(partitionId).grain();
    }

    public static Grain parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (Grain g : values()) {
                if (g.label.equals(v)) {
                    return g;
                }
            }
        }
        throw new ConfigurationException("Unknown grain '" + value + "' (expected year or month)");
    }
}
