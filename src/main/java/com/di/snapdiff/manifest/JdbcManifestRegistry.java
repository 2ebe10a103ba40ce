package com.di.snapdiff.manifest;

import com.di.snapdiff.dq.Severity;
import com.di.snapdiff.promotion.PromotionState;
import com.di.snapdiff.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC ManifestRegistry over the {@code manifest_entries} table. Same-key writers are serialized
 * by the row itself: inserts rely on the primary key, updates on {@code WHERE version = ?}.
 * Active unless snapdiff.manifest.store=memory.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcManifestRegistry implements ManifestRegistry {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final Clock clock;

    public JdbcManifestRegistry(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.clock = clock;
    }

    private static final RowMapper<ManifestEntry> ROW_MAPPER = (rs, n) -> {
        ManifestEntry e = new ManifestEntry();
        e.setKey(PartitionKey.of(rs.getString("source_id"), rs.getString("entity"), rs.getString("partition_id")));
        e.setLayer(Layer.valueOf(rs.getString("layer")));
        e.setGrain(rs.getString("grain"));
        e.setContentHash(rs.getString("content_hash"));
        long rc = rs.getLong("record_count");
        e.setRecordCount(rs.wasNull() ? null : rc);
        long bs = rs.getLong("byte_size");
        e.setByteSize(rs.wasNull() ? null : bs);
        e.setSnapshotVersion(rs.getString("snapshot_version"));
        e.setStatus(ManifestStatus.valueOf(rs.getString("status")));
        String ps = rs.getString("promotion_state");
        e.setPromotionState(ps == null ? null : PromotionState.valueOf(ps));
        e.setPromoted(rs.getBoolean("promoted"));
        String lvl = rs.getString("dq_level");
        e.setDqLevel(lvl == null ? null : Severity.valueOf(lvl));
        boolean dp = rs.getBoolean("dq_passed");
        e.setDqPassed(rs.wasNull() ? null : dp);
        e.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        e.setLastSeenAt(toInstant(rs.getTimestamp("last_seen_at")));
        e.setVersion(rs.getLong("version"));
        return e;
    };

    private static final RowMapper<PartitionKey> KEY_MAPPER = (rs, n) ->
            PartitionKey.of(rs.getString("source_id"), rs.getString("entity"), rs.getString("partition_id"));

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    private static String nameOf(Enum<?> e) {
        return e == null ? null : e.name();
    }

    @Override
    public Optional<ManifestEntry> lookup(PartitionKey key, Layer layer) {
        List<ManifestEntry> rows = jdbc.query(sql.getManifest().getFindByKey(), ROW_MAPPER,
                key.getSourceId(), key.getEntity(), key.getPartitionId(), layer.name());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public ManifestEntry upsert(ManifestEntry entry) {
        if (entry == null || entry.getKey() == null || entry.getLayer() == null) {
            throw new IllegalArgumentException("Manifest entry requires key and layer");
        }
        PartitionKey key = entry.getKey();
        Instant now = clock.instant();
        Optional<ManifestEntry> current = lookup(key, entry.getLayer());

        // ---- idempotent replay: only freshness moves ----
        if (current.isPresent() && current.get().sameContentAs(entry)) {
            jdbc.update(sql.getManifest().getTouch(), toTimestamp(now),
                    key.getSourceId(), key.getEntity(), key.getPartitionId(), entry.getLayer().name());
            return current.get().toBuilder().lastSeenAt(now).build();
        }

        long currentVersion = current.map(ManifestEntry::getVersion).orElse(0L);
        if (entry.getVersion() != currentVersion) {
            throw new ManifestConflictException(key, entry.getLayer(), entry.getVersion(), currentVersion);
        }

        ManifestEntry next = entry.toBuilder()
                .createdAt(current.map(ManifestEntry::getCreatedAt).orElse(now))
                .lastSeenAt(now)
                .version(currentVersion + 1)
                .build();

        if (current.isEmpty()) {
            try {
                jdbc.update(sql.getManifest().getInsert(),
                        key.getSourceId(), key.getEntity(), key.getPartitionId(), next.getLayer().name(),
                        next.getGrain(), next.getContentHash(), next.getRecordCount(), next.getByteSize(),
                        next.getSnapshotVersion(), nameOf(next.getStatus()), nameOf(next.getPromotionState()),
                        next.isPromoted(), nameOf(next.getDqLevel()), next.getDqPassed(),
                        toTimestamp(next.getCreatedAt()), toTimestamp(next.getLastSeenAt()), next.getVersion());
            } catch (DuplicateKeyException e) {
                // another writer inserted first
                throw new ManifestConflictException(key, entry.getLayer(), 0L, -1L);
            }
            return next;
        }

        int updated = jdbc.update(sql.getManifest().getUpdateVersioned(),
                next.getGrain(), next.getContentHash(), next.getRecordCount(), next.getByteSize(),
                next.getSnapshotVersion(), nameOf(next.getStatus()), nameOf(next.getPromotionState()),
                next.isPromoted(), nameOf(next.getDqLevel()), next.getDqPassed(),
                toTimestamp(next.getLastSeenAt()), next.getVersion(),
                key.getSourceId(), key.getEntity(), key.getPartitionId(), next.getLayer().name(),
                currentVersion);
        if (updated == 0) {
            throw new ManifestConflictException(key, entry.getLayer(), currentVersion, -1L);
        }
        log.debug("[MANIFEST] {} [{}] -> v{} status={}", key, next.getLayer(), next.getVersion(), next.getStatus());
        return next;
    }

    @Override
    public List<PartitionKey> listByStatus(Layer layer, ManifestStatus status) {
        return jdbc.query(sql.getManifest().getFindKeysByStatus(), KEY_MAPPER, layer.name(), status.name());
    }

    @Override
    public List<PartitionKey> listByPromotionState(Layer layer, PromotionState state) {
        return jdbc.query(sql.getManifest().getFindKeysByPromotionState(), KEY_MAPPER, layer.name(), state.name());
    }

    @Override
    public List<ManifestEntry> listByLayer(Layer layer) {
        return jdbc.query(sql.getManifest().getFindByLayer(), ROW_MAPPER, layer.name());
    }
}
