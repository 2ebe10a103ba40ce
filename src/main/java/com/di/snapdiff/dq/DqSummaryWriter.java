package com.di.snapdiff.dq;

import com.di.snapdiff.config.SnapDiffProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serialises a partition's gate verdict to JSON at
 * {@code {dq-summary-dir}/{layer}/{source}/{entity}/{partition}.json}.
 */
@Slf4j
@Component
public class DqSummaryWriter {

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    public DqSummaryWriter(SnapDiffProperties properties) {
        String dir = properties.getDqSummaryDir();
        this.baseDir = dir == null || dir.isBlank() ? null : Paths.get(dir);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the written file, or null when no summary directory is configured
     */
    public Path write(GateVerdict verdict, boolean promoted, int quarantinedRows) {
        if (baseDir == null) {
            return null;
        }
        Path target = baseDir
                .resolve(verdict.getLayer().name().toLowerCase(Locale.ROOT))
                .resolve(verdict.getKey().getSourceId())
                .resolve(verdict.getKey().getEntity())
                .resolve(verdict.getKey().getPartitionId() + ".json");

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("source_id", verdict.getKey().getSourceId());
        doc.put("entity", verdict.getKey().getEntity());
        doc.put("partition_id", verdict.getKey().getPartitionId());
        doc.put("layer", verdict.getLayer().name());
        doc.put("snapshot_version", verdict.getSnapshotVersion());
        doc.put("dq_level", verdict.getDqLevel().name());
        doc.put("dq_passed", verdict.isDqPassed());
        doc.put("promoted", promoted);
        doc.put("rows", verdict.getRowCount());
        doc.put("quarantined_rows", quarantinedRows);
        doc.put("results", toMaps(verdict.getResults()));

        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            // unique per writer; concurrent writes of one target only race on the final move
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), doc);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("[DQ] summary written {} -> {}", verdict.getKey(), target);
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write DQ summary " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[DQ] could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    private static List<Map<String, Object>> toMaps(List<DQResult> results) {
        return results.stream().map(r -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("check_name", r.getCheckName());
            m.put("severity", r.getSeverity().name());
            m.put("passed", r.isPassed());
            m.put("metric_value", r.getMetricValue());
            m.put("detail", r.getDetail());
            m.put("created_at", r.getCreatedAt());
            return m;
        }).toList();
    }
}
