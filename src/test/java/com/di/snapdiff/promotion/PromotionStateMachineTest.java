package com.di.snapdiff.promotion;

import com.di.snapdiff.EngineFixture;
import com.di.snapdiff.dq.DQResult;
import com.di.snapdiff.dq.GateVerdict;
import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.ManifestEntry;
import com.di.snapdiff.manifest.ManifestStatus;
import com.di.snapdiff.manifest.PartitionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PromotionStateMachine Tests")
class PromotionStateMachineTest {

    private static final PartitionKey KEY = PartitionKey.of("unhcr", "refugees", "2021");

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private PromotionStateMachine machine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(tempDir);
        machine = engine.stateMachine;
    }

    /** Eight passing checks plus one failed check of the given severity. */
    private static GateVerdict verdict(Layer layer, Severity failedSeverity) {
        List<DQResult> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(DQResult.builder().checkName("check_" + i).severity(Severity.CRITICAL).passed(true).build());
        }
        results.add(DQResult.builder().checkName("failing").severity(failedSeverity).passed(false).build());
        return GateVerdict.of(KEY, layer, "v1", results, Map.of(), 10);
    }

    @Test
    @DisplayName("Should reject on a gated layer when one CRITICAL check fails among passes")
    void testCriticalRejectsSilver() {
        ManifestEntry decided = machine.advance(KEY, Layer.SILVER, "v1", verdict(Layer.SILVER, Severity.CRITICAL),
                "out-hash", 9L);
        assertEquals(PromotionState.REJECTED, decided.getPromotionState());
        assertFalse(decided.isPromoted());
        assertEquals(Boolean.FALSE, decided.getDqPassed());
        assertEquals(Severity.CRITICAL, decided.getDqLevel());
        assertEquals("out-hash", decided.getContentHash());
        assertEquals(9L, decided.getRecordCount());
        assertEquals(ManifestStatus.NEW, decided.getStatus());
        assertEquals(1.0, engine.meterRegistry.counter("snapdiff.promotion.decisions",
                "layer", "SILVER", "state", "REJECTED").count());
    }

    @Test
    @DisplayName("Should record the grain of a new entry from its partition id")
    void testBeginRecordsGrain() {
        PartitionKey march = PartitionKey.of("acled", "events", "2020-03");
        assertEquals("month", machine.begin(march, Layer.SILVER, "v1").getGrain());
        assertEquals("year", machine.begin(KEY, Layer.SILVER, "v1").getGrain());
    }

    @ParameterizedTest
    @EnumSource(value = Severity.class, names = {"WARNING", "INFO"})
    @DisplayName("Should promote when only non-critical checks fail")
    void testNonCriticalPromotes(Severity severity) {
        ManifestEntry decided = machine.advance(KEY, Layer.GOLD, "v1", verdict(Layer.GOLD, severity), null, null);
        assertTrue(decided.isPromoted());
        assertEquals(PromotionState.PROMOTED, decided.getPromotionState());
        assertEquals(severity, decided.getDqLevel());
        assertEquals(Boolean.TRUE, decided.getDqPassed());
    }

    @Test
    @DisplayName("Should never block bronze but still record the failed DQ outcome")
    void testBronzeNotGated() {
        assertFalse(machine.isGated(Layer.BRONZE));
        ManifestEntry decided = machine.advance(KEY, Layer.BRONZE, "v1", verdict(Layer.BRONZE, Severity.CRITICAL),
                null, null);
        assertTrue(decided.isPromoted());
        assertEquals(Boolean.FALSE, decided.getDqPassed());
        assertEquals(Severity.CRITICAL, decided.getDqLevel());
    }

    @Test
    @DisplayName("Should refuse to restart a decided partition for the same snapshot version")
    void testTerminalForVersion() {
        machine.advance(KEY, Layer.SILVER, "v1", verdict(Layer.SILVER, Severity.INFO), null, null);
        assertThrows(IllegalStateException.class, () -> machine.begin(KEY, Layer.SILVER, "v1"));

        ManifestEntry restarted = machine.begin(KEY, Layer.SILVER, "v2");
        assertEquals(PromotionState.PENDING, restarted.getPromotionState());
        assertEquals(ManifestStatus.DIRTY, restarted.getStatus());
        assertEquals("v2", restarted.getSnapshotVersion());
        assertFalse(restarted.isPromoted());
        assertNull(restarted.getDqPassed());
        assertNull(restarted.getDqLevel());
    }

    @Test
    @DisplayName("Should leave a PENDING partition untouched when begun again")
    void testPendingIsIdempotent() {
        ManifestEntry first = machine.begin(KEY, Layer.SILVER, "v1");
        ManifestEntry again = machine.begin(KEY, Layer.SILVER, "v1");
        assertEquals(first.getVersion(), again.getVersion());
        assertEquals(PromotionState.PENDING, again.getPromotionState());
    }

    @Test
    @DisplayName("Should reset an interrupted EVALUATED partition to PENDING")
    void testEvaluatedResets() {
        machine.begin(KEY, Layer.SILVER, "v1");
        machine.evaluate(KEY, Layer.SILVER, "v1", verdict(Layer.SILVER, Severity.INFO), null, null);
        ManifestEntry reset = machine.begin(KEY, Layer.SILVER, "v1");
        assertEquals(PromotionState.PENDING, reset.getPromotionState());
        assertEquals(ManifestStatus.NEW, reset.getStatus());
    }

    @Test
    @DisplayName("Should reject transitions out of order")
    void testOutOfOrder() {
        GateVerdict v = verdict(Layer.SILVER, Severity.INFO);
        assertThrows(IllegalStateException.class, () -> machine.evaluate(KEY, Layer.SILVER, "v1", v, null, null));

        machine.begin(KEY, Layer.SILVER, "v1");
        assertThrows(IllegalStateException.class, () -> machine.decide(KEY, Layer.SILVER, "v1"));
        assertThrows(IllegalStateException.class, () -> machine.evaluate(KEY, Layer.SILVER, "v0", v, null, null));

        machine.evaluate(KEY, Layer.SILVER, "v1", v, null, null);
        assertThrows(IllegalStateException.class, () -> machine.evaluate(KEY, Layer.SILVER, "v1", v, null, null));
    }

    @Test
    @DisplayName("Should honour a configured empty gate list")
    void testNoGatedLayers() {
        engine.properties.getPromotion().setGatedLayers(List.of());
        PromotionStateMachine ungated = new PromotionStateMachine(engine.writer, engine.properties, engine.metrics);
        ManifestEntry decided = ungated.advance(KEY, Layer.GOLD, "v1", verdict(Layer.GOLD, Severity.CRITICAL),
                null, null);
        assertTrue(decided.isPromoted());
    }
}
