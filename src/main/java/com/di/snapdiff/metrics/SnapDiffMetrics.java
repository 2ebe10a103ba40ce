package com.di.snapdiff.metrics;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.promotion.PromotionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for discovery, manifest writes and promotion.
 */
@Slf4j
@Component
public class SnapDiffMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer discoveryTimer;
    private final DistributionSummary dirtySetSize;
    private final Counter manifestConflicts;
    private final Counter manifestRetries;
    private final Counter hashMismatches;
    private final Counter dqCheckErrors;
    private final Counter quarantinedRows;

    public SnapDiffMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.discoveryTimer = Timer.builder("snapdiff.discovery.duration")
                .description("Time taken by one discovery run")
                .register(meterRegistry);

        this.dirtySetSize = DistributionSummary.builder("snapdiff.discovery.dirty.size")
                .description("Number of dirty partitions produced per run")
                .baseUnit("partitions")
                .register(meterRegistry);

        this.manifestConflicts = Counter.builder("snapdiff.manifest.conflicts")
                .description("Upserts rejected after exhausting retries")
                .register(meterRegistry);

        this.manifestRetries = Counter.builder("snapdiff.manifest.retries")
                .description("Upserts retried after a stale version")
                .register(meterRegistry);

        this.hashMismatches = Counter.builder("snapdiff.discovery.hash.mismatches")
                .description("Partitions whose declared hash disagreed with the recomputed one")
                .register(meterRegistry);

        this.dqCheckErrors = Counter.builder("snapdiff.dq.check.errors")
                .description("DQ checks that could not execute")
                .register(meterRegistry);

        this.quarantinedRows = Counter.builder("snapdiff.dq.quarantined.rows")
                .description("Rows isolated into quarantine")
                .baseUnit("rows")
                .register(meterRegistry);
    }

    public void recordDiscovery(long durationMs, int dirtyCount) {
        discoveryTimer.record(durationMs, TimeUnit.MILLISECONDS);
        dirtySetSize.record(dirtyCount);
        log.debug("Recorded discovery: durationMs={}, dirty={}", durationMs, dirtyCount);
    }

    public void recordDiffOutcome(ManifestStatus status) {
        Counter.builder("snapdiff.discovery.partitions")
                .description("Canonical partitions by diff outcome")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordConflict() {
        manifestConflicts.increment();
    }

    public void recordRetry() {
        manifestRetries.increment();
    }

    public void recordHashMismatch() {
        hashMismatches.increment();
    }

    public void recordDqCheckError() {
        dqCheckErrors.increment();
    }

    public void recordQuarantined(int rows) {
        if (rows > 0) {
            quarantinedRows.increment(rows);
        }
    }

    public void recordPromotion(Layer layer, PromotionState state) {
        Counter.builder("snapdiff.promotion.decisions")
                .description("Promotion decisions by layer and outcome")
                .tag("layer", layer.name())
                .tag("state", state.name())
                .register(meterRegistry)
                .increment();
    }
}
