package com.di.snapdiff.lineage;

import com.di.snapdiff.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists events to {@code lineage_events} and {@code lineage_event_inputs}. Active with the
 * JDBC store unless snapdiff.lineage.jdbc-enabled=false.
 */
@Slf4j
@Component
@ConditionalOnExpression("${snapdiff.lineage.jdbc-enabled:true} and '${snapdiff.manifest.store:jdbc}' == 'jdbc'")
public class JdbcLineageEmitter implements LineageEmitter {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcLineageEmitter(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    private static final RowMapper<LineageEvent> ROW_MAPPER = (rs, n) -> {
        try {
            return LineageJson.MAPPER.readValue(rs.getString("payload_json"), LineageEvent.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable lineage payload for event " + rs.getString("event_id"), e);
        }
    };

    @Override
    public void emit(LineageEvent e) {
        jdbc.update(sql.getLineage().getInsertEvent(),
                e.getEventId(), Timestamp.from(e.getEventTime()), e.getEventType(), e.getLayer(), e.getEntity(),
                e.getGrain(), e.getPartitionKey(), e.getRunId(), e.getSnapshotVersion(),
                asLong(e.getMetrics().get("rows_in")), asLong(e.getMetrics().get("rows_out")),
                e.getDqStatus(), LineageJson.toJson(e));
        if (!e.getInputs().isEmpty()) {
            List<Object[]> args = new ArrayList<>(e.getInputs().size());
            int idx = 0;
            for (LineageInput in : e.getInputs()) {
                args.add(new Object[]{e.getEventId(), idx++, in.layer(), in.entity(), in.partitionKey(),
                        in.filePath(), in.contentHash(), in.routeId()});
            }
            jdbc.batchUpdate(sql.getLineage().getInsertInput(), args);
        }
        log.debug("[LINEAGE] stored {} event {} with {} input(s)", e.getEventType(), e.getEventId(), e.getInputs().size());
    }

    public List<LineageEvent> findByRunId(String runId) {
        return jdbc.query(sql.getLineage().getFindEventsByRunId(), ROW_MAPPER, runId);
    }

    private static Long asLong(Object v) {
        return v instanceof Number n ? n.longValue() : null;
    }
}
