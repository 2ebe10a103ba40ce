package com.di.snapdiff.manifest;

import com.di.snapdiff.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * JDBC PartitionLinkStore over the {@code partition_links} table.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcPartitionLinkStore implements PartitionLinkStore {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcPartitionLinkStore(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<PartitionLink> ROW_MAPPER = (rs, n) -> {
        Timestamp la = rs.getTimestamp("linked_at");
        return PartitionLink.builder()
                .key(PartitionKey.of(rs.getString("source_id"), rs.getString("entity"), rs.getString("partition_id")))
                .rawSourceId(rs.getString("raw_source_id"))
                .rawPartitionId(rs.getString("raw_partition_id"))
                .filePath(rs.getString("file_path"))
                .contentHash(rs.getString("content_hash"))
                .routeId(rs.getString("route_id"))
                .snapshotVersion(rs.getString("snapshot_version"))
                .linkedAt(la == null ? null : la.toInstant())
                .build();
    };

    @Override
    public void link(PartitionLink link) {
        PartitionKey k = link.getKey();
        Instant at = link.getLinkedAt() != null ? link.getLinkedAt() : Instant.now();
        try {
            jdbc.update(sql.getLinks().getInsert(),
                    k.getSourceId(), k.getEntity(), k.getPartitionId(),
                    link.getRawSourceId(), link.getRawPartitionId(), link.getFilePath(),
                    link.getContentHash(), link.getRouteId(), link.getSnapshotVersion(), Timestamp.from(at));
        } catch (DuplicateKeyException e) {
            log.debug("[MANIFEST] link already recorded: {} <- {}", k, link.getFilePath());
        }
    }

    @Override
    public List<PartitionLink> findByPartition(PartitionKey key) {
        return jdbc.query(sql.getLinks().getFindByPartition(), ROW_MAPPER,
                key.getSourceId(), key.getEntity(), key.getPartitionId());
    }
}
