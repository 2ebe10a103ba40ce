package com.di.snapdiff.promotion;

/**
 * Per (partition, layer) lifecycle for one snapshot version.
 */
public enum PromotionState {
    PENDING,
    EVALUATED,
    PROMOTED,
    REJECTED;

    public boolean isTerminal() {
        return this == PROMOTED || this == REJECTED;
    }
}
