package com.di.snapdiff.dq;

import com.di.snapdiff.metrics.SnapDiffMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs every configured check for a partition's entity and layer and aggregates the verdict.
 * A check that cannot execute becomes a failed CRITICAL result; nothing thrown by a check
 * leaves the gate.
 */
@Slf4j
@Component
public class DqGate {

    private final DqRuleSet ruleSet;
    private final SnapDiffMetrics metrics;
    private final Clock clock;

    public DqGate(DqRuleSet ruleSet, SnapDiffMetrics metrics, Clock clock) {
        this.ruleSet = ruleSet;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GateVerdict evaluate(PartitionData data, String snapshotVersion) {
        List<DqCheck> checks = ruleSet.checksFor(data.key().getEntity(), data.layer());
        if (checks.isEmpty()) {
            log.warn("[DQ] no checks configured for entity={} layer={}", data.key().getEntity(), data.layer());
        }
        List<CheckOutcome> outcomes = new ArrayList<>(checks.size());
        for (DqCheck check : checks) {
            outcomes.add(run(check, data));
        }
        GateVerdict verdict = toVerdict(data, snapshotVersion, outcomes);
        log.info("[DQ] {} [{}] checks={} failed={} dq_level={} dq_passed={}",
                data.key(), data.layer(), outcomes.size(), verdict.failedCount(),
                verdict.getDqLevel(), verdict.isDqPassed());
        return verdict;
    }

    /** Stamps outcomes computed elsewhere (e.g. the bronze policy) into a verdict. */
    public GateVerdict toVerdict(PartitionData data, String snapshotVersion, List<CheckOutcome> outcomes) {
        Instant now = clock.instant();
        List<DQResult> results = new ArrayList<>(outcomes.size());
        Map<String, List<RejectedRow>> rejected = new LinkedHashMap<>();
        for (CheckOutcome o : outcomes) {
            results.add(DQResult.builder()
                    .resultId(UUID.randomUUID().toString())
                    .key(data.key())
                    .layer(data.layer())
                    .snapshotVersion(snapshotVersion)
                    .checkName(o.getCheckName())
                    .severity(o.getSeverity())
                    .passed(o.isPassed())
                    .metricValue(o.getMetricValue())
                    .detail(o.getDetail())
                    .createdAt(now)
                    .build());
            if (!o.getRejectedRows().isEmpty()) {
                rejected.put(o.getCheckName(), o.getRejectedRows());
            }
        }
        return GateVerdict.of(data.key(), data.layer(), snapshotVersion, results, rejected, data.rows().size());
    }

    private CheckOutcome run(DqCheck check, PartitionData data) {
        try {
            return check.evaluate(data);
        } catch (DqCheckException e) {
            metrics.recordDqCheckError();
            log.warn("[DQ] check '{}' could not execute on {}: {}", check.name(), data.key(), e.getMessage());
            return CheckOutcome.fail(check.name(), Severity.CRITICAL, null, "check_error: " + e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordDqCheckError();
            log.error("[DQ] check '{}' failed unexpectedly on {}", check.name(), data.key(), e);
            return CheckOutcome.fail(check.name(), Severity.CRITICAL, null,
                    "check_error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
