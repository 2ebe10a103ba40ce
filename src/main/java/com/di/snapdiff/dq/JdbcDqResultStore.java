package com.di.snapdiff.dq;

import com.di.snapdiff.manifest.Layer;
import com.di.snapdiff.manifest.PartitionKey;
import com.di.snapdiff.sql.SqlQueriesProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JDBC DqResultStore over {@code dq_results}.
 */
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcDqResultStore implements DqResultStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcDqResultStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<DQResult> ROW_MAPPER = (rs, n) -> {
        double mv = rs.getDouble("metric_value");
        Double metric = rs.wasNull() ? null : mv;
        Timestamp ts = rs.getTimestamp("created_at");
        return DQResult.builder()
                .resultId(rs.getString("result_id"))
                .key(PartitionKey.of(rs.getString("source_id"), rs.getString("entity"), rs.getString("partition_id")))
                .layer(Layer.valueOf(rs.getString("layer")))
                .snapshotVersion(rs.getString("snapshot_version"))
                .checkName(rs.getString("check_name"))
                .severity(Severity.valueOf(rs.getString("severity")))
                .passed(rs.getBoolean("passed"))
                .metricValue(metric)
                .detail(rs.getString("detail"))
                .createdAt(ts == null ? null : ts.toInstant())
                .build();
    };

    @Override
    public void append(List<DQResult> results) {
        if (results.isEmpty()) return;
        List<Object[]> args = new ArrayList<>(results.size());
        for (DQResult r : results) {
            PartitionKey k = r.getKey();
            args.add(new Object[]{
                    r.getResultId() != null ? r.getResultId() : UUID.randomUUID().toString(),
                    k.getSourceId(), k.getEntity(), k.getPartitionId(), r.getLayer().name(),
                    r.getSnapshotVersion(), r.getCheckName(), r.getSeverity().name(), r.isPassed(),
                    r.getMetricValue(), truncate(r.getDetail(), 2000), Timestamp.from(r.getCreatedAt())});
        }
        jdbc.batchUpdate(sql.getDq().getInsertResult(), args);
    }

    @Override
    public List<DQResult> findByPartition(PartitionKey key, Layer layer) {
        return jdbc.query(sql.getDq().getFindResultsByPartition(), ROW_MAPPER,
                key.getSourceId(), key.getEntity(), key.getPartitionId(), layer.name());
    }

    static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
