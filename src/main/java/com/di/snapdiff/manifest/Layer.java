package com.di.snapdiff.manifest;

/**
 * Pipeline layers a partition moves through. Bronze holds raw snapshots as they arrived;
 * silver and gold hold conformed and mart outputs.
 */
public enum Layer {
    BRONZE,
    SILVER,
    GOLD;

    public static Layer parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Layer must not be blank");
        }
        return Layer.valueOf(value.trim().toUpperCase());
    }
}
