package com.di.snapdiff.dq;

import com.di.snapdiff.discovery.SnapshotSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BronzeDqPolicy Tests")
class BronzeDqPolicyTest {

    private static Map<String, CheckOutcome> byName(List<CheckOutcome> outcomes) {
        return outcomes.stream().collect(Collectors.toMap(CheckOutcome::getCheckName, Function.identity()));
    }

    @Test
    @DisplayName("Should pass a complete summary")
    void testHealthySummary() {
        SnapshotSummary s = SnapshotSummary.builder()
                .file("2021.csv").startYear(2015).cutoffYear(2021).records(120L).bytes(4096L).hash("abc").build();
        Map<String, CheckOutcome> out = byName(BronzeDqPolicy.evaluate(s));
        assertEquals(4, out.size());
        assertTrue(out.values().stream().allMatch(CheckOutcome::isPassed));
        assertEquals(120.0, out.get(BronzeDqPolicy.RECORDS_PRESENT).getMetricValue());
    }

    @Test
    @DisplayName("Should fail CRITICAL on an inverted cutoff, zero records, zero bytes and no hash")
    void testBrokenSummary() {
        SnapshotSummary s = SnapshotSummary.builder()
                .startYear(2022).cutoffYear(2021).records(0L).bytes(0L).hash(" ").build();
        Map<String, CheckOutcome> out = byName(BronzeDqPolicy.evaluate(s));
        assertEquals("cutoff_invalid", out.get(BronzeDqPolicy.CUTOFF_VALID).getDetail());
        assertEquals("zero_records", out.get(BronzeDqPolicy.RECORDS_PRESENT).getDetail());
        assertEquals("zero_bytes", out.get(BronzeDqPolicy.BYTES_PRESENT).getDetail());
        assertEquals("empty_hash", out.get(BronzeDqPolicy.HASH_PRESENT).getDetail());
        assertTrue(out.values().stream().allMatch(o -> !o.isPassed() && o.getSeverity() == Severity.CRITICAL));
    }

    @Test
    @DisplayName("Should skip checks whose inputs the summary lacks")
    void testSparseSummary() {
        SnapshotSummary s = SnapshotSummary.builder().bytes(10L).hash("abc").build();
        Map<String, CheckOutcome> out = byName(BronzeDqPolicy.evaluate(s));
        assertEquals(2, out.size());
        assertFalse(out.containsKey(BronzeDqPolicy.RECORDS_PRESENT));
        assertFalse(out.containsKey(BronzeDqPolicy.CUTOFF_VALID));
    }

    @ParameterizedTest
    @CsvSource({"MINOR, INFO", "MAJOR, WARNING", "WARNING, WARNING", "CRITICAL, CRITICAL", "odd, CRITICAL"})
    @DisplayName("Should carry the writer's own verdict, mapping legacy levels")
    void testSidecarVerdict(String level, Severity expected) {
        SnapshotSummary s = SnapshotSummary.builder().bytes(10L).hash("abc").dqPassed(false).dqLevel(level)
                .error("late file").build();
        CheckOutcome sidecar = byName(BronzeDqPolicy.evaluate(s)).get(BronzeDqPolicy.SIDECAR_DQ);
        assertFalse(sidecar.isPassed());
        assertEquals(expected, sidecar.getSeverity());
        assertTrue(sidecar.getDetail().endsWith("late file"));
    }
}
