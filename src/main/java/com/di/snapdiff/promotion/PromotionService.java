package com.di.snapdiff.promotion;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.dq.DqGate;
import com.di.snapdiff.dq.DqResultStore;
import com.di.snapdiff.dq.DqSummaryWriter;
import com.di.snapdiff.dq.GateVerdict;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.QuarantineRecord;
import com.di.snapdiff.dq.QuarantineStore;
import com.di.snapdiff.dq.RejectedRow;
import com.di.snapdiff.hashing.ContentHasher;
import com.di.snapdiff.lineage.LineageEvent;
import com.di.snapdiff.lineage.LineageInput;
import com.di.snapdiff.lineage.LineageService;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.manifest.PartitionLink;
import com.di.snapdiff.manifest.PartitionLinkStore;
import com.di.snapdiff.metrics.SnapDiffMetrics;
import com.di.snapdiff.util.ParallelTasks;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Gates one layer's output partitions and records the outcome: DQ results, quarantine,
 * promotion state, summary artifact and lineage.
 */
@Slf4j
@Service
public class PromotionService {

    private static final ObjectMapper ROW_JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final DqGate gate;
    private final DqResultStore resultStore;
    private final QuarantineStore quarantineStore;
    private final PromotionStateMachine stateMachine;
    private final DqSummaryWriter summaryWriter;
    private final LineageService lineage;
    private final PartitionLinkStore linkStore;
    private final ContentHasher hasher;
    private final SnapDiffMetrics metrics;
    private final int maxWorkers;
    private final Clock clock;

    public PromotionService(DqGate gate, DqResultStore resultStore, QuarantineStore quarantineStore,
                            PromotionStateMachine stateMachine, DqSummaryWriter summaryWriter,
                            LineageService lineage, PartitionLinkStore linkStore, ContentHasher hasher,
                            SnapDiffMetrics metrics, SnapDiffProperties properties, Clock clock) {
        this.gate = gate;
        this.resultStore = resultStore;
        this.quarantineStore = quarantineStore;
        this.stateMachine = stateMachine;
        this.summaryWriter = summaryWriter;
        this.lineage = lineage;
        this.linkStore = linkStore;
        this.hasher = hasher;
        this.metrics = metrics;
        this.maxWorkers = properties.getDiscovery().getMaxWorkers();
        this.clock = clock;
    }

    /**
     * @throws IllegalStateException if the partition is already decided for this snapshot version
     */
    public PromotionOutcome evaluate(Layer layer, String snapshotVersion, PartitionKey key,
                                     List<Map<String, Object>> rows, Map<String, Set<String>> references) {
        stateMachine.begin(key, layer, snapshotVersion);

        PartitionData data = new PartitionData(key, layer, rows, references);
        GateVerdict verdict = gate.evaluate(data, snapshotVersion);
        resultStore.append(verdict.getResults());

        List<QuarantineRecord> quarantined = toQuarantine(verdict, data);
        quarantineStore.save(quarantined);
        metrics.recordQuarantined(quarantined.size());

        Set<Integer> rejected = verdict.rejectedRowIndexes();
        List<Map<String, Object>> accepted = new ArrayList<>(data.rows().size() - rejected.size());
        for (int i = 0; i < data.rows().size(); i++) {
            if (!rejected.contains(i)) {
                accepted.add(data.rows().get(i));
            }
        }
        String outputHash = hasher.hashRowMaps(accepted, null);

        stateMachine.evaluate(key, layer, snapshotVersion, verdict, outputHash, (long) accepted.size());
        ManifestEntry decided = stateMachine.decide(key, layer, snapshotVersion);

        Path summary = summaryWriter.write(verdict, decided.isPromoted(), rejected.size());

        PromotionOutcome outcome = PromotionOutcome.builder()
                .key(key)
                .layer(layer)
                .snapshotVersion(snapshotVersion)
                .state(decided.getPromotionState())
                .promoted(decided.isPromoted())
                .dqLevel(verdict.getDqLevel())
                .dqPassed(verdict.isDqPassed())
                .rowsIn(data.rows().size())
                .rowsOut(decided.isPromoted() ? accepted.size() : 0)
                .quarantined(rejected.size())
                .summaryPath(summary)
                .build();
        lineage.emit(transformRunEvent(outcome, decided.getGrain()));
        return outcome;
    }

    /**
     * Evaluates partitions in parallel. A partition that fails to evaluate is reported and does
     * not stop the others.
     */
    public PromotionReport evaluateBatch(Layer layer, String snapshotVersion, List<PartitionInput> inputs) {
        record Attempt(PartitionKey key, PromotionOutcome outcome, String error) {
        }
        List<Attempt> attempts = ParallelTasks.map("promotion", maxWorkers, inputs, in -> {
            try {
                return new Attempt(in.key(), evaluate(layer, snapshotVersion, in.key(), in.rows(), in.references()), null);
            } catch (RuntimeException e) {
                log.error("[PROMOTION] evaluation failed for {} [{}]: {}", in.key(), layer, e.getMessage());
                return new Attempt(in.key(), null, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        });

        List<PromotionOutcome> outcomes = new ArrayList<>();
        Map<PartitionKey, String> failed = new LinkedHashMap<>();
        for (Attempt a : attempts) {
            if (a.outcome() != null) {
                outcomes.add(a.outcome());
            } else {
                failed.put(a.key(), a.error());
            }
        }
        PromotionReport report = new PromotionReport(layer, snapshotVersion, outcomes, failed);
        log.info("[PROMOTION] layer={} snapshot={} promoted={} rejected={} failed={}", layer, snapshotVersion,
                report.promotedKeys().size(), report.rejectedKeys().size(), failed.size());
        return report;
    }

    private List<QuarantineRecord> toQuarantine(GateVerdict verdict, PartitionData data) {
        Instant now = clock.instant();
        List<QuarantineRecord> out = new ArrayList<>();
        for (Map.Entry<String, List<RejectedRow>> e : verdict.getRejectedByCheck().entrySet()) {
            for (RejectedRow r : e.getValue()) {
                out.add(QuarantineRecord.builder()
                        .quarantineId(UUID.randomUUID().toString())
                        .key(data.key())
                        .layer(data.layer())
                        .snapshotVersion(verdict.getSnapshotVersion())
                        .checkName(e.getKey())
                        .reason(r.reason())
                        .payload(rowJson(data.rows().get(r.rowIndex())))
                        .createdAt(now)
                        .build());
            }
        }
        return out;
    }

    private static String rowJson(Map<String, Object> row) {
        try {
            return ROW_JSON.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            return String.valueOf(row);
        }
    }

    private LineageEvent transformRunEvent(PromotionOutcome o, String grain) {
        List<LineageInput> inputs = new ArrayList<>();
        List<PartitionLink> links = linkStore.findByPartition(o.getKey());
        String latest = links.isEmpty() ? null : links.get(0).getSnapshotVersion();
        for (PartitionLink l : links) {
            if (l.getSnapshotVersion().equals(latest)) {
                inputs.add(new LineageInput(Layer.BRONZE.name(), o.getKey().getEntity(), o.getKey().getPartitionId(),
                        l.getFilePath(), l.getContentHash(), l.getRouteId()));
            }
        }
        String runId = MDC.get("runId");
        return LineageEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventTime(clock.instant())
                .eventType(LineageEvent.TRANSFORM_RUN)
                .layer(o.getLayer().name())
                .entity(o.getKey().getEntity())
                .grain(grain)
                .partitionKey(o.getKey().getPartitionId())
                .runId(runId != null ? runId : UUID.randomUUID().toString())
                .snapshotVersion(o.getSnapshotVersion())
                .inputs(inputs)
                .metric("rows_in", o.getRowsIn())
                .metric("rows_out", o.getRowsOut())
                .metric("quarantined", o.getQuarantined())
                .dqStatus(o.isPromoted() ? (o.isDqPassed() ? "PASSED" : "PASSED_UNGATED") : "REJECTED")
                .build();
    }
}
