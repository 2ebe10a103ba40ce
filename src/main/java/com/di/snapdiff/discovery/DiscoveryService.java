package com.di.snapdiff.discovery;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.dq.BronzeDqPolicy;
import com.di.snapdiff.dq.CheckOutcome;
import com.di.snapdiff.dq.DqGate;
import com.di.snapdiff.dq.DqResultStore;
import com.di.snapdiff.dq.DqSummaryWriter;
import com.di.snapdiff.dq.GateVerdict;
import com.di.snapdiff.dq.PartitionData;
import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.lineage.LineageEvent;
import com.di.snapdiff.lineage.LineageInput;
import com.di.snapdiff.lineage.LineageService;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestConflictException;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.ManifestRegistry;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.ManifestWriteTemplate;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.manifest.PartitionLink;
import com.di.snapdiff.manifest.PartitionLinkStore;
import com.di.snapdiff.metrics.SnapDiffMetrics;
import com.di.snapdiff.promotion.PromotionStateMachine;
import com.di.snapdiff.routing.RoutedPartition;
import com.di.snapdiff.routing.Router;
import com.di.snapdiff.util.ParallelTasks;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Diffs one raw snapshot against the manifest and returns the partitions that changed.
 *
 * <p>Run order:
 * <ol>
 *   <li>scan and hash every raw file (parallel)</li>
 *   <li>route every raw partition; a routing error aborts here, before any write</li>
 *   <li>group contributions per canonical key; fan-in from two raw sources is a conflict for
 *       that key, a hash mismatch withholds it</li>
 *   <li>diff and upsert each key (parallel, conflict-checked), link its raw files</li>
 *   <li>mark keys absent from this snapshot DELETED</li>
 *   <li>record bronze DQ and promote dirty keys (bronze never blocks)</li>
 * </ol>
 * Re-running on an unchanged snapshot touches only {@code last_seen_at} and returns an empty set.
 */
@Slf4j
@Service
public class DiscoveryService {

    static final String HASH_INTEGRITY = "hash_integrity";

    private final SnapshotScanner scanner;
    private final Router router;
    private final ManifestRegistry registry;
    private final ManifestWriteTemplate writer;
    private final PartitionLinkStore linkStore;
    private final DqGate gate;
    private final DqResultStore resultStore;
    private final DqSummaryWriter summaryWriter;
    private final PromotionStateMachine stateMachine;
    private final LineageService lineage;
    private final SnapDiffMetrics metrics;
    private final Layer layer;
    private final int maxWorkers;
    private final Clock clock;

    public DiscoveryService(SnapshotScanner scanner, Router router, ManifestRegistry registry,
                            ManifestWriteTemplate writer, PartitionLinkStore linkStore, DqGate gate,
                            DqResultStore resultStore, DqSummaryWriter summaryWriter,
                            PromotionStateMachine stateMachine, LineageService lineage,
                            SnapDiffMetrics metrics, SnapDiffProperties properties, Clock clock) {
        this.scanner = scanner;
        this.router = router;
        this.registry = registry;
        this.writer = writer;
        this.linkStore = linkStore;
        this.gate = gate;
        this.resultStore = resultStore;
        this.summaryWriter = summaryWriter;
        this.stateMachine = stateMachine;
        this.lineage = lineage;
        this.metrics = metrics;
        this.layer = properties.getDiscovery().getDiscoveryLayer();
        this.maxWorkers = properties.getDiscovery().getMaxWorkers();
        this.clock = clock;
    }

    private record Contribution(RoutedPartition routed, RawPartition raw) {
    }

    private record KeyWrite(PartitionKey key, ManifestStatus status, String contentHash, String grain, String conflict) {
    }

    public DirtySet discover(String snapshotVersion) {
        return run(snapshotVersion).getDirtySet();
    }

    /**
     * @throws ConfigurationException for unroutable or unparseable raw partitions, before any write
     */
    public DiscoveryReport run(String snapshotVersion) {
        if (snapshotVersion == null || snapshotVersion.isBlank()) {
            throw new IllegalArgumentException("snapshot version is required");
        }
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        MDC.put("snapshotVersion", snapshotVersion);
        long start = System.currentTimeMillis();
        try {
            // ---- 1. scan ----
            List<RawPartition> raws = scanner.scan(snapshotVersion);
            if (raws.isEmpty()) {
                throw new ConfigurationException("No raw partitions found for snapshot version " + snapshotVersion);
            }

            // ---- 2. route everything before the first write ----
            Map<PartitionKey, List<Contribution>> byKey = new TreeMap<>();
            for (RawPartition raw : raws) {
                for (RoutedPartition rp : router.route(raw.getRawSourceId(), raw.getId(), raw.getContentHash())) {
                    byKey.computeIfAbsent(rp.key(), k -> new ArrayList<>()).add(new Contribution(rp, raw));
                }
            }

            // ---- 3. fan-in collisions and integrity ----
            Map<PartitionKey, String> conflicts = new ConcurrentHashMap<>();
            Set<PartitionKey> integrityFlagged = new TreeSet<>();
            List<PartitionKey> writable = new ArrayList<>();
            for (Map.Entry<PartitionKey, List<Contribution>> e : byKey.entrySet()) {
                Set<String> sources = e.getValue().stream()
                        .map(c -> c.raw().getRawSourceId())
                        .collect(Collectors.toCollection(TreeSet::new));
                if (sources.size() > 1) {
                    conflicts.put(e.getKey(), "fan-in from raw sources " + sources);
                    metrics.recordConflict();
                    log.warn("[DISCOVERY] {} receives contributions from raw sources {}; not written", e.getKey(), sources);
                } else if (e.getValue().stream().anyMatch(c -> c.raw().hasHashMismatch())) {
                    integrityFlagged.add(e.getKey());
                } else {
                    writable.add(e.getKey());
                }
            }

            // ---- 4. diff + upsert ----
            Set<PartitionKey> visited = ConcurrentHashMap.newKeySet();
            List<KeyWrite> writes = ParallelTasks.map("manifest", maxWorkers, writable,
                    key -> persist(key, byKey.get(key), snapshotVersion, visited));
            writes.stream().filter(w -> w.conflict() != null).forEach(w -> conflicts.put(w.key(), w.conflict()));

            // ---- 5. deletions ----
            List<PartitionKey> deleted = markDeleted(byKey.keySet(), conflicts);

            // ---- 6. integrity results, bronze DQ and promotion ----
            List<String> mismatchedFiles = recordIntegrityFailures(integrityFlagged, byKey, raws, snapshotVersion);

            List<KeyWrite> dirty = writes.stream()
                    .filter(w -> w.conflict() == null && w.status().isDirty())
                    .toList();
            ParallelTasks.map("bronze-dq", maxWorkers, dirty, w -> {
                try {
                    promoteBronze(w.key(), byKey.get(w.key()), snapshotVersion);
                } catch (ManifestConflictException e) {
                    conflicts.put(w.key(), e.getMessage());
                }
                return w.key();
            });

            List<DirtyPartition> dirtyPartitions = dirty.stream()
                    .filter(w -> !conflicts.containsKey(w.key()))
                    .map(w -> new DirtyPartition(w.key(), w.status(), w.contentHash(), w.grain()))
                    .sorted((a, b) -> a.key().compareTo(b.key()))
                    .toList();
            DirtySet dirtySet = new DirtySet(snapshotVersion, runId, dirtyPartitions);

            emitLineage(byKey, writes, runId, snapshotVersion);

            long durationMs = System.currentTimeMillis() - start;
            int newCount = count(writes, ManifestStatus.NEW);
            int dirtyCount = count(writes, ManifestStatus.DIRTY);
            int cleanCount = count(writes, ManifestStatus.CLEAN);
            metrics.recordDiscovery(durationMs, dirtySet.size());

            log.info("[DISCOVERY] snapshot={} keys={} new={} dirty={} clean={} deleted={} conflicts={} integrity={} in {} ms",
                    snapshotVersion, byKey.size(), newCount, dirtyCount, cleanCount, deleted.size(),
                    conflicts.size(), integrityFlagged.size(), durationMs);

            return DiscoveryReport.builder()
                    .runId(runId)
                    .snapshotVersion(snapshotVersion)
                    .dirtySet(dirtySet)
                    .newCount(newCount)
                    .dirtyCount(dirtyCount)
                    .cleanCount(cleanCount)
                    .deleted(deleted)
                    .conflicts(Collections.unmodifiableMap(new TreeMap<>(conflicts)))
                    .hashMismatches(mismatchedFiles)
                    .integrityFlagged(Collections.unmodifiableSet(integrityFlagged))
                    .durationMs(durationMs)
                    .build();
        } finally {
            MDC.remove("runId");
            MDC.remove("snapshotVersion");
        }
    }

    private KeyWrite persist(PartitionKey key, List<Contribution> contributions, String snapshotVersion,
                             Set<PartitionKey> visited) {
        if (!visited.add(key)) {
            throw new IllegalStateException(key + " written twice in one run");
        }
        List<RoutedPartition> routed = contributions.stream().map(Contribution::routed).toList();
        String hash = Router.collapseHash(routed);
        String grain = routed.get(0).grain().label();
        Long records = sumIfUnsliced(contributions, true);
        Long bytes = sumIfUnsliced(contributions, false);

        AtomicReference<ManifestStatus> outcome = new AtomicReference<>();
        try {
            writer.write(key, layer, current -> {
                ManifestEntry next = diff(current, hash, grain, records, bytes, snapshotVersion);
                outcome.set(next.getStatus());
                return next;
            });
        } catch (ManifestConflictException e) {
            return new KeyWrite(key, null, hash, grain, e.getMessage());
        }
        metrics.recordDiffOutcome(outcome.get());

        Instant now = clock.instant();
        for (Contribution c : contributions) {
            for (RawFile f : c.raw().getFiles()) {
                linkStore.link(PartitionLink.builder()
                        .key(key)
                        .rawSourceId(c.raw().getRawSourceId())
                        .rawPartitionId(c.raw().getId().token())
                        .filePath(f.getPath().toString())
                        .contentHash(f.getHash())
                        .routeId(c.routed().routeId())
                        .snapshotVersion(snapshotVersion)
                        .linkedAt(now)
                        .build());
            }
        }
        return new KeyWrite(key, outcome.get(), hash, grain, null);
    }

    /**
     * NEW when absent or previously deleted, DIRTY on a hash change, CLEAN when unchanged and
     * already decided. An unchanged key whose promotion never finished keeps its dirty status
     * so an interrupted run is picked up again.
     */
    static ManifestEntry diff(Optional<ManifestEntry> current, String hash, String grain, Long records,
                              Long bytes, String snapshotVersion) {
        if (current.isEmpty() || current.get().getStatus() == ManifestStatus.DELETED) {
            return ManifestEntry.builder()
                    .grain(grain)
                    .contentHash(hash)
                    .recordCount(records)
                    .byteSize(bytes)
                    .snapshotVersion(snapshotVersion)
                    .status(ManifestStatus.NEW)
                    .build();
        }
        ManifestEntry cur = current.get();
        if (!hash.equals(cur.getContentHash())) {
            return cur.toBuilder()
                    .grain(grain)
                    .contentHash(hash)
                    .recordCount(records)
                    .byteSize(bytes)
                    .snapshotVersion(snapshotVersion)
                    .status(ManifestStatus.DIRTY)
                    .promotionState(null)
                    .promoted(false)
                    .dqLevel(null)
                    .dqPassed(null)
                    .build();
        }
        if (cur.getPromotionState() != null && cur.getPromotionState().isTerminal()) {
            return cur.toBuilder().status(ManifestStatus.CLEAN).build();
        }
        return cur.toBuilder()
                .status(cur.getStatus() != null && cur.getStatus().isDirty() ? cur.getStatus() : ManifestStatus.DIRTY)
                .build();
    }

    /** Record or byte totals are only meaningful when no contributor was sliced. */
    private static Long sumIfUnsliced(List<Contribution> contributions, boolean records) {
        long total = 0;
        for (Contribution c : contributions) {
            if (c.raw().getId().expand(c.routed().grain()).size() > 1) {
                return null;
            }
            Long v = records ? c.raw().getRecordCount() : Long.valueOf(c.raw().getByteSize());
            if (v == null) {
                return null;
            }
            total += v;
        }
        return total;
    }

    private List<PartitionKey> markDeleted(Set<PartitionKey> present, Map<PartitionKey, String> conflicts) {
        List<PartitionKey> deleted = new ArrayList<>();
        for (ManifestEntry e : registry.listByLayer(layer)) {
            if (e.getStatus() == ManifestStatus.DELETED || present.contains(e.getKey())) {
                continue;
            }
            try {
                writer.write(e.getKey(), layer, current -> current.isEmpty()
                        || current.get().getStatus() == ManifestStatus.DELETED
                        ? null
                        : current.get().toBuilder().status(ManifestStatus.DELETED).build());
                deleted.add(e.getKey());
                metrics.recordDiffOutcome(ManifestStatus.DELETED);
                log.info("[DISCOVERY] {} no longer in snapshot; marked DELETED", e.getKey());
            } catch (ManifestConflictException ex) {
                conflicts.put(e.getKey(), ex.getMessage());
            }
        }
        return deleted;
    }

    private List<String> recordIntegrityFailures(Set<PartitionKey> flagged, Map<PartitionKey, List<Contribution>> byKey,
                                                 List<RawPartition> raws, String snapshotVersion) {
        List<String> files = new ArrayList<>();
        for (RawPartition raw : raws) {
            for (RawFile f : raw.getFiles()) {
                if (f.getMismatch() != null) {
                    files.add(f.getPath().toString());
                    metrics.recordHashMismatch();
                }
            }
        }
        for (PartitionKey key : flagged) {
            List<CheckOutcome> outcomes = new ArrayList<>();
            for (Contribution c : byKey.get(key)) {
                for (RawFile f : c.raw().getFiles()) {
                    if (f.getMismatch() != null) {
                        outcomes.add(CheckOutcome.fail(HASH_INTEGRITY, Severity.CRITICAL, null,
                                f.getMismatch().getMessage()));
                    }
                }
            }
            GateVerdict verdict = gate.toVerdict(new PartitionData(key, layer, List.of(), Map.of()),
                    snapshotVersion, outcomes);
            resultStore.append(verdict.getResults());
            log.error("[DISCOVERY] {} withheld: declared hash disagrees with content", key);
        }
        return files;
    }

    private void promoteBronze(PartitionKey key, List<Contribution> contributions, String snapshotVersion) {
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (Contribution c : contributions) {
            for (RawFile f : c.raw().getFiles()) {
                for (CheckOutcome o : BronzeDqPolicy.evaluate(f.getSummary())) {
                    outcomes.add(o.toBuilder().detail(f.fileName() + ": " + o.getDetail()).build());
                }
            }
        }
        GateVerdict verdict = gate.toVerdict(new PartitionData(key, layer, List.of(), Map.of()),
                snapshotVersion, outcomes);
        resultStore.append(verdict.getResults());
        if (!verdict.isDqPassed()) {
            log.warn("[DQ] {} [{}] dq_passed=false dq_level={}; written regardless", key, layer, verdict.getDqLevel());
        }
        ManifestEntry decided = stateMachine.advance(key, layer, snapshotVersion, verdict, null, null);
        summaryWriter.write(verdict, decided.isPromoted(), 0);
    }

    private void emitLineage(Map<PartitionKey, List<Contribution>> byKey, List<KeyWrite> writes,
                             String runId, String snapshotVersion) {
        Map<String, List<KeyWrite>> byEntity = new TreeMap<>();
        writes.forEach(w -> byEntity.computeIfAbsent(w.key().getEntity(), k -> new ArrayList<>()).add(w));
        for (Map.Entry<String, List<KeyWrite>> e : byEntity.entrySet()) {
            LineageEvent.LineageEventBuilder event = LineageEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .eventTime(clock.instant())
                    .eventType(LineageEvent.DISCOVER)
                    .layer(layer.name())
                    .entity(e.getKey())
                    .grain(e.getValue().get(0).grain())
                    .runId(runId)
                    .snapshotVersion(snapshotVersion)
                    .metric("partitions", e.getValue().size())
                    .metric("dirty", e.getValue().stream().filter(w -> w.status() != null && w.status().isDirty()).count());
            // a fanned-out file feeds many keys but is one input
            Set<LineageInput> inputs = new LinkedHashSet<>();
            for (KeyWrite w : e.getValue()) {
                for (Contribution c : byKey.get(w.key())) {
                    for (RawFile f : c.raw().getFiles()) {
                        inputs.add(new LineageInput("RAW", c.raw().getRawSourceId(), c.raw().getId().token(),
                                f.getPath().toString(), f.getHash(), c.routed().routeId()));
                    }
                }
            }
            lineage.emit(event.inputs(inputs).build());
        }
    }

    private static int count(List<KeyWrite> writes, ManifestStatus status) {
        return (int) writes.stream().filter(w -> w.status() == status).count();
    }
}
