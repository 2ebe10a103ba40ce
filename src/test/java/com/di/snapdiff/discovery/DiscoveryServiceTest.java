package com.di.snapdiff.discovery;

import com.di.snapdiff.EngineFixture;
import com.di.snapdiff.dq.BronzeDqPolicy;
import com.di.snapdiff.dq.DQResult;
import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.lineage.LineageEvent;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.manifest.PartitionLink;
import com.di.snapdiff.promotion.PromotionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiscoveryService Tests")
class DiscoveryServiceTest {

    private static final PartitionKey R2020 = PartitionKey.of("unhcr", "refugees", "2020");
    private static final PartitionKey R2021 = PartitionKey.of("unhcr", "refugees", "2021");
    private static final PartitionKey R2022 = PartitionKey.of("unhcr", "refugees", "2022");

    @TempDir
    Path tempDir;

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(tempDir);
    }

    private ManifestEntry bronze(PartitionKey key) {
        return engine.registry.lookup(key, Layer.BRONZE).orElseThrow();
    }

    private Map<PartitionKey, ManifestEntry> bronzeByKey() {
        return engine.registry.listByLayer(Layer.BRONZE).stream()
                .collect(Collectors.toMap(ManifestEntry::getKey, Function.identity()));
    }

    // ============================================================================
    // Diff and idempotence
    // ============================================================================

    @Test
    @DisplayName("Should report every partition NEW on first discovery and promote bronze")
    void testFirstDiscovery() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v1", "2021.csv", "SYR,DEU,2021,12\n");

        DiscoveryReport report = engine.discovery.run("v1");

        assertEquals(List.of(R2020, R2021), report.getDirtySet().keys());
        assertEquals(2, report.getNewCount());
        assertFalse(report.hasConflicts());

        ManifestEntry e = bronze(R2020);
        assertEquals(ManifestStatus.NEW, e.getStatus());
        assertEquals("year", e.getGrain());
        assertEquals("v1", e.getSnapshotVersion());
        assertEquals(PromotionState.PROMOTED, e.getPromotionState());
        assertTrue(e.isPromoted());
        assertEquals(Boolean.TRUE, e.getDqPassed());
        assertEquals(16L, e.getByteSize());
        assertNull(e.getRecordCount());
    }

    @Test
    @DisplayName("Should be idempotent: second run all CLEAN and empty, third run touches only last_seen_at")
    void testIdempotence() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v1", "2021.csv", "SYR,DEU,2021,12\n");
        engine.discovery.run("v1");

        engine.clock.advance(Duration.ofMinutes(5));
        DirtySet second = engine.discovery.discover("v1");
        assertTrue(second.isEmpty());
        Map<PartitionKey, ManifestEntry> afterSecond = bronzeByKey();
        afterSecond.values().forEach(e -> assertEquals(ManifestStatus.CLEAN, e.getStatus()));

        engine.clock.advance(Duration.ofMinutes(5));
        DiscoveryReport third = engine.discovery.run("v1");
        assertTrue(third.getDirtySet().isEmpty());
        assertEquals(2, third.getCleanCount());

        Map<PartitionKey, ManifestEntry> afterThird = bronzeByKey();
        for (PartitionKey key : List.of(R2020, R2021)) {
            ManifestEntry before = afterSecond.get(key);
            ManifestEntry after = afterThird.get(key);
            assertTrue(after.sameContentAs(before));
            assertEquals(before.getVersion(), after.getVersion());
            assertEquals(engine.clock.instant(), after.getLastSeenAt());
        }
    }

    @Test
    @DisplayName("Should mark added and changed years dirty and leave the unchanged year CLEAN")
    void testDiffAddAndChange() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v1", "2021.csv", "SYR,DEU,2021,12\n");
        engine.discovery.run("v1");

        engine.writeRaw("unhcr", "v2", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v2", "2021.csv", "SYR,DEU,2021,99\n");
        engine.writeRaw("unhcr", "v2", "2022.csv", "SYR,DEU,2022,7\n");
        DiscoveryReport report = engine.discovery.run("v2");

        assertEquals(List.of(R2021, R2022), report.getDirtySet().keys());
        assertEquals(ManifestStatus.CLEAN, bronze(R2020).getStatus());
        assertEquals(ManifestStatus.DIRTY, bronze(R2021).getStatus());
        assertEquals(ManifestStatus.NEW, bronze(R2022).getStatus());
        assertEquals("v2", bronze(R2021).getSnapshotVersion());
        assertEquals(PromotionState.PROMOTED, bronze(R2021).getPromotionState());

        Map<PartitionKey, ManifestStatus> statuses = report.getDirtySet().getPartitions().stream()
                .collect(Collectors.toMap(DirtyPartition::key, DirtyPartition::status));
        assertEquals(ManifestStatus.DIRTY, statuses.get(R2021));
        assertEquals(ManifestStatus.NEW, statuses.get(R2022));
    }

    @Test
    @DisplayName("Should mark vanished partitions DELETED and revive them as NEW")
    void testDeletion() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v1", "2021.csv", "SYR,DEU,2021,12\n");
        engine.discovery.run("v1");

        engine.writeRaw("unhcr", "v2", "2021.csv", "SYR,DEU,2021,12\n");
        DiscoveryReport report = engine.discovery.run("v2");
        assertEquals(List.of(R2020), report.getDeleted());
        assertEquals(ManifestStatus.DELETED, bronze(R2020).getStatus());
        assertEquals(List.of(R2020), engine.registry.listByStatus(Layer.BRONZE, ManifestStatus.DELETED));

        DiscoveryReport again = engine.discovery.run("v2");
        assertTrue(again.getDeleted().isEmpty());

        engine.writeRaw("unhcr", "v3", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v3", "2021.csv", "SYR,DEU,2021,12\n");
        DiscoveryReport revived = engine.discovery.run("v3");
        assertEquals(List.of(R2020), revived.getDirtySet().keys());
        assertEquals(ManifestStatus.NEW, bronze(R2020).getStatus());
    }

    @Test
    @DisplayName("Should resume a partition whose promotion never finished")
    void testResumesInterruptedPromotion() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.discovery.run("v1");
        // simulate a crash between begin and decide
        engine.writer.write(R2020, Layer.BRONZE, current -> current.orElseThrow().toBuilder()
                .promotionState(PromotionState.EVALUATED)
                .promoted(false)
                .build());

        DirtySet rerun = engine.discovery.discover("v1");
        assertEquals(List.of(R2020), rerun.keys());
        assertEquals(PromotionState.PROMOTED, bronze(R2020).getPromotionState());

        assertTrue(engine.discovery.discover("v1").isEmpty());
    }

    // ============================================================================
    // Routing shapes
    // ============================================================================

    @Test
    @DisplayName("Should fan a yearly file out to twelve monthly partitions")
    void testFanOut() {
        engine.writeRaw("acled", "v1", "2020.csv", "e1,2020-01-05,3\ne2,2020-07-09,0\n");
        DiscoveryReport report = engine.discovery.run("v1");

        assertEquals(12, report.getDirtySet().size());
        assertEquals(PartitionKey.of("acled", "events", "2020-01"), report.getDirtySet().keys().get(0));
        ManifestEntry march = bronze(PartitionKey.of("acled", "events", "2020-03"));
        assertEquals("month", march.getGrain());
        assertNull(march.getRecordCount());
        assertNull(march.getByteSize());
        assertNotEquals(march.getContentHash(), bronze(PartitionKey.of("acled", "events", "2020-04")).getContentHash());

        engine.writeRaw("acled", "v2", "2020.csv", "e1,2020-01-05,4\ne2,2020-07-09,0\n");
        assertEquals(12, engine.discovery.discover("v2").size());
    }

    @Test
    @DisplayName("Should collapse monthly files into one yearly key that turns DIRTY when any month changes")
    void testCollapse() {
        PartitionKey wdi2020 = PartitionKey.of("wdi", "indicators", "2020");
        engine.writeRaw("wdi_monthly", "v1", "2020-01.csv", "a,1\n");
        engine.writeRaw("wdi_monthly", "v1", "2020-02.csv", "b,2\n");
        DiscoveryReport first = engine.discovery.run("v1");
        assertEquals(List.of(wdi2020), first.getDirtySet().keys());
        assertEquals(8L, bronze(wdi2020).getByteSize());
        assertEquals(2, engine.linkStore.findByPartition(wdi2020).size());

        engine.writeRaw("wdi_monthly", "v2", "2020-01.csv", "a,1\n");
        engine.writeRaw("wdi_monthly", "v2", "2020-02.csv", "b,3\n");
        DiscoveryReport second = engine.discovery.run("v2");
        assertEquals(List.of(wdi2020), second.getDirtySet().keys());
        assertEquals(ManifestStatus.DIRTY, bronze(wdi2020).getStatus());
    }

    @Test
    @DisplayName("Should combine multi-part files of one coverage into one raw partition")
    void testMultiPartFiles() {
        engine.writeRaw("unhcr", "v1", "2020-part-000.csv", "SYR,DEU,2020,10\n");
        engine.writeRaw("unhcr", "v1", "2020-part-001.csv", "AFG,PAK,2020,20\n");
        DiscoveryReport report = engine.discovery.run("v1");
        assertEquals(List.of(R2020), report.getDirtySet().keys());
        assertEquals(2, engine.linkStore.findByPartition(R2020).size());
    }

    // ============================================================================
    // Failure handling
    // ============================================================================

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationErrors {

        @Test
        @DisplayName("Should fail before any write when a raw source has no rule")
        void testUnroutableSourceWritesNothing() {
            engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
            engine.writeRaw("mystery", "v1", "2020.csv", "x\n");

            assertThrows(ConfigurationException.class, () -> engine.discovery.run("v1"));
            assertTrue(engine.registry.listByLayer(Layer.BRONZE).isEmpty());
            assertTrue(engine.linkStore.findByPartition(R2020).isEmpty());
        }

        @Test
        @DisplayName("Should fail before any write for an unparseable file name")
        void testBadFileName() {
            engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
            engine.writeRaw("unhcr", "v1", "latest.csv", "SYR,DEU,2021,12\n");

            assertThrows(ConfigurationException.class, () -> engine.discovery.run("v1"));
            assertTrue(engine.registry.listByLayer(Layer.BRONZE).isEmpty());
        }

        @Test
        @DisplayName("Should fail for a snapshot version with no raw data")
        void testEmptySnapshot() {
            engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
            assertThrows(ConfigurationException.class, () -> engine.discovery.run("v9"));
            assertThrows(IllegalArgumentException.class, () -> engine.discovery.run(" "));
        }
    }

    @Test
    @DisplayName("Should treat two raw sources feeding one key as a conflict on that key only")
    void testFanInConflict() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.discovery.run("v1");

        engine.writeRaw("unhcr_a", "v2", "2020.csv", "SYR,DEU,2020,11\n");
        engine.writeRaw("unhcr_b", "v2", "2020.csv", "SYR,DEU,2020,12\n");
        engine.writeRaw("unhcr_a", "v2", "2021.csv", "SYR,DEU,2021,12\n");
        DiscoveryReport report = engine.discovery.run("v2");

        assertTrue(report.hasConflicts());
        assertTrue(report.getConflicts().containsKey(R2020));
        assertEquals(List.of(R2021), report.getDirtySet().keys());
        assertTrue(report.getDeleted().isEmpty());

        ManifestEntry untouched = bronze(R2020);
        assertEquals("v1", untouched.getSnapshotVersion());
        assertEquals(ManifestStatus.NEW, untouched.getStatus());
    }

    @Nested
    @DisplayName("Declared hashes")
    class DeclaredHashes {

        @Test
        @DisplayName("Should trust the sidecar hash when verification is off")
        void testTrustedDeclaredHash() {
            engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
            engine.writeSidecar("unhcr", "v1",
                    "{\"file\": \"2020.csv\", \"records\": 1, \"hash\": \"abc123\", \"snapshot_version\": \"v1\"}");

            engine.discovery.run("v1");
            ManifestEntry e = bronze(R2020);
            assertEquals("abc123", e.getContentHash());
            assertEquals(1L, e.getRecordCount());
        }

        @Test
        @DisplayName("Should withhold a key whose declared hash disagrees with its content")
        void testHashMismatchWithheld(@TempDir Path otherDir) {
            EngineFixture verifying = new EngineFixture(otherDir, true);
            verifying.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
            verifying.writeRaw("unhcr", "v1", "2021.csv", "SYR,DEU,2021,12\n");
            verifying.writeSidecar("unhcr", "v1",
                    "[{\"file\": \"2021.csv\", \"records\": 1, \"hash\": \"deadbeef\"}]");

            DiscoveryReport report = verifying.discovery.run("v1");

            assertEquals(List.of(R2020), report.getDirtySet().keys());
            assertTrue(report.getIntegrityFlagged().contains(R2021));
            assertEquals(1, report.getHashMismatches().size());
            assertTrue(verifying.registry.lookup(R2021, Layer.BRONZE).isEmpty());

            List<DQResult> results = verifying.resultStore.findByPartition(R2021, Layer.BRONZE);
            assertEquals(1, results.size());
            assertEquals(DiscoveryService.HASH_INTEGRITY, results.get(0).getCheckName());
            assertEquals(Severity.CRITICAL, results.get(0).getSeverity());
            assertFalse(results.get(0).isPassed());
            assertEquals(1.0, verifying.meterRegistry.counter("snapdiff.discovery.hash.mismatches").count());
        }
    }

    // ============================================================================
    // Bronze DQ, provenance and lineage
    // ============================================================================

    @Test
    @DisplayName("Should record bronze DQ failures without blocking promotion")
    void testBronzeDqNeverBlocks() throws Exception {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.writeSidecar("unhcr", "v1", "{\"file\": \"2020.csv\", \"records\": 0}");

        engine.discovery.run("v1");

        ManifestEntry e = bronze(R2020);
        assertTrue(e.isPromoted());
        assertEquals(Boolean.FALSE, e.getDqPassed());
        assertEquals(Severity.CRITICAL, e.getDqLevel());

        Optional<DQResult> records = engine.resultStore.findByPartition(R2020, Layer.BRONZE).stream()
                .filter(r -> r.getCheckName().equals(BronzeDqPolicy.RECORDS_PRESENT))
                .findFirst();
        assertTrue(records.isPresent());
        assertFalse(records.get().isPassed());
        assertTrue(records.get().getDetail().startsWith("2020.csv: "));

        Path summary = engine.dqDir.resolve("bronze").resolve("unhcr").resolve("refugees").resolve("2020.json");
        assertTrue(Files.exists(summary));
        assertTrue(Files.readString(summary).contains("\"promoted\" : true"));
    }

    @Test
    @DisplayName("Should link each canonical key to the raw files that fed it")
    void testLinks() {
        Path file = engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.discovery.run("v1");

        List<PartitionLink> links = engine.linkStore.findByPartition(R2020);
        assertEquals(1, links.size());
        assertEquals(file.toString(), links.get(0).getFilePath());
        assertEquals("unhcr_refugees", links.get(0).getRouteId());
        assertEquals("v1", links.get(0).getSnapshotVersion());
        assertEquals(bronze(R2020).getContentHash(), links.get(0).getContentHash());
    }

    @Test
    @DisplayName("Should emit one discover event per entity with each raw file once")
    void testDiscoverLineage() {
        engine.writeRaw("acled", "v1", "2020.csv", "e1,2020-01-05,3\n");
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        DiscoveryReport report = engine.discovery.run("v1");

        List<LineageEvent> discover = engine.lineageEvents.stream()
                .filter(ev -> LineageEvent.DISCOVER.equals(ev.getEventType()))
                .toList();
        assertEquals(2, discover.size());

        LineageEvent events = discover.stream().filter(ev -> "events".equals(ev.getEntity())).findFirst().orElseThrow();
        assertEquals(1, events.getInputs().size());
        assertEquals(12, ((Number) events.getMetrics().get("partitions")).intValue());
        assertEquals("month", events.getGrain());
        assertEquals(report.getRunId(), events.getRunId());
        assertEquals("BRONZE", events.getLayer());
    }

    @Test
    @DisplayName("Should count diff outcomes in metrics")
    void testMetrics() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        engine.discovery.run("v1");
        engine.discovery.run("v1");

        assertEquals(1.0, engine.meterRegistry.get("snapdiff.discovery.partitions").tag("status", "NEW").counter().count());
        assertEquals(1.0, engine.meterRegistry.get("snapdiff.discovery.partitions").tag("status", "CLEAN").counter().count());
        assertEquals(2L, engine.meterRegistry.get("snapdiff.discovery.duration").timer().count());
    }

    @Test
    @DisplayName("Should hand the dirty set over once")
    void testDirtySetConsumedOnce() {
        engine.writeRaw("unhcr", "v1", "2020.csv", "SYR,DEU,2020,10\n");
        DirtySet dirty = engine.discovery.discover("v1");
        assertEquals(1, dirty.consume().size());
        assertThrows(IllegalStateException.class, dirty::consume);
        assertEquals(1, dirty.getPartitions().size());
    }
}
