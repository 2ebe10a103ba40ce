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
 * JDBC QuarantineStore over {@code quarantine_rows}.
 */
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcQuarantineStore implements QuarantineStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcQuarantineStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<QuarantineRecord> ROW_MAPPER = (rs, n) -> {
        Timestamp ts = rs.getTimestamp("created_at");
        return QuarantineRecord.builder()
                .quarantineId(rs.getString("quarantine_id"))
                .key(PartitionKey.of(rs.getString("source_id"), rs.getString("entity"), rs.getString("partition_id")))
                .layer(Layer.valueOf(rs.getString("layer")))
                .snapshotVersion(rs.getString("snapshot_version"))
                .checkName(rs.getString("check_name"))
                .reason(rs.getString("reason"))
                .payload(rs.getString("payload"))
                .createdAt(ts == null ? null : ts.toInstant())
                .build();
    };

    @Override
    public void save(List<QuarantineRecord> records) {
        if (records.isEmpty()) return;
        List<Object[]> args = new ArrayList<>(records.size());
        for (QuarantineRecord r : records) {
            PartitionKey k = r.getKey();
            args.add(new Object[]{
                    r.getQuarantineId() != null ? r.getQuarantineId() : UUID.randomUUID().toString(),
                    k.getSourceId(), k.getEntity(), k.getPartitionId(), r.getLayer().name(),
                    r.getSnapshotVersion(), r.getCheckName(), JdbcDqResultStore.truncate(r.getReason(), 2000),
                    r.getPayload(), Timestamp.from(r.getCreatedAt())});
        }
        jdbc.batchUpdate(sql.getQuarantine().getInsert(), args);
    }

    @Override
    public List<QuarantineRecord> findByPartition(PartitionKey key, Layer layer) {
        return jdbc.query(sql.getQuarantine().getFindByPartition(), ROW_MAPPER,
                key.getSourceId(), key.getEntity(), key.getPartitionId(), layer.name());
    }
}
