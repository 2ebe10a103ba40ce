package com.di.snapdiff.dq;

import com.di.snapdiff.JdbcSupport;
import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JDBC DQ store Tests")
class JdbcDqStoresTest {

    private static final PartitionKey KEY = PartitionKey.of("unhcr", "refugees", "2021");
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        database = JdbcSupport.newDatabase();
        jdbc = new JdbcTemplate(database);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static DQResult result(String check, boolean passed, Double metric) {
        return DQResult.builder()
                .key(KEY).layer(Layer.SILVER).snapshotVersion("v1")
                .checkName(check).severity(Severity.WARNING).passed(passed)
                .metricValue(metric).detail(passed ? "ok" : "x".repeat(2500))
                .createdAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Should append results and read them back per partition and layer")
    void testDqResults() {
        JdbcDqResultStore store = new JdbcDqResultStore(jdbc, JdbcSupport.sqlQueries());
        store.append(List.of(result("b_check", true, null), result("a_check", false, 2.0)));
        store.append(List.of(result("a_check", true, 0.0)));
        store.append(List.of());

        List<DQResult> found = store.findByPartition(KEY, Layer.SILVER);
        assertEquals(3, found.size());
        assertEquals("a_check", found.get(0).getCheckName());
        assertNotNull(found.get(0).getResultId());
        assertEquals("b_check", found.get(2).getCheckName());
        assertNull(found.get(2).getMetricValue());
        assertTrue(found.stream().anyMatch(r -> !r.isPassed() && r.getDetail().length() == 2000));
        assertEquals(Severity.WARNING, found.get(0).getSeverity());
        assertEquals(NOW, found.get(0).getCreatedAt());
        assertTrue(store.findByPartition(KEY, Layer.GOLD).isEmpty());
    }

    @Test
    @DisplayName("Should save quarantined rows with their payload")
    void testQuarantine() {
        JdbcQuarantineStore store = new JdbcQuarantineStore(jdbc, JdbcSupport.sqlQueries());
        store.save(List.of(QuarantineRecord.builder()
                .key(KEY).layer(Layer.SILVER).snapshotVersion("v1")
                .checkName("refugees_non_negative").reason("negative:refugees")
                .payload("{\"refugees\":-5}").createdAt(NOW)
                .build()));

        List<QuarantineRecord> found = store.findByPartition(KEY, Layer.SILVER);
        assertEquals(1, found.size());
        QuarantineRecord q = found.get(0);
        assertEquals(KEY, q.getKey());
        assertEquals("negative:refugees", q.getReason());
        assertEquals("{\"refugees\":-5}", q.getPayload());
        assertNotNull(q.getQuarantineId());
    }
}
