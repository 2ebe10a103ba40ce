package com.di.snapdiff.discovery;

import com.di.snapdiff.config.SnapDiffProperties;
import com.di.snapdiff.exception.ConfigurationException;
import com.di.snapdiff.hashing.ContentHasher;
import com.di.snapdiff.routing.RawPartitionId;
import com.di.snapdiff.util.ParallelTasks;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Enumerates the raw partitions of one snapshot version:
 * {@code {raw-root}/{raw_source_id}/date={version}/{coverage}-part-NNN.ext}, with the optional
 * {@code _dq_summary.json} sidecar alongside.
 *
 * <p>Coverage tokens are parsed before any hashing, so a bad file name fails the scan early.
 * Files starting with {@code _} or {@code .} are not data.
 */
@Slf4j
@Component
public class SnapshotScanner {

    public static final String SIDECAR = "_dq_summary.json";

    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ContentHasher hasher;
    private final SnapDiffProperties properties;

    public SnapshotScanner(ContentHasher hasher, SnapDiffProperties properties) {
        this.hasher = hasher;
        this.properties = properties;
    }

    private record Candidate(Path path, String rawSourceId, RawPartitionId id, SnapshotSummary sidecar) {
    }

    /**
     * @return raw partitions ordered by raw source id, then coverage token
     */
    public List<RawPartition> scan(String snapshotVersion) {
        Path root = Paths.get(properties.getRawRoot());
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Raw root is not a directory: " + root.toAbsolutePath());
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Path sourceDir : listSorted(root)) {
            Path snapshotDir = sourceDir.resolve("date=" + snapshotVersion);
            if (!Files.isDirectory(sourceDir) || !Files.isDirectory(snapshotDir)) {
                continue;
            }
            String rawSourceId = sourceDir.getFileName().toString();
            Map<String, SnapshotSummary> sidecar = readSidecar(snapshotDir.resolve(SIDECAR));
            for (Path file : listSorted(snapshotDir)) {
                String name = file.getFileName().toString();
                if (!Files.isRegularFile(file) || name.startsWith("_") || name.startsWith(".")) {
                    continue;
                }
                candidates.add(new Candidate(file, rawSourceId, RawPartitionId.fromFileName(name), sidecar.get(name)));
            }
        }
        log.info("[DISCOVERY] snapshot {}: {} raw file(s) under {}", snapshotVersion, candidates.size(), root);

        List<RawFile> files = ParallelTasks.map("hash", properties.getDiscovery().getMaxWorkers(), candidates,
                c -> resolve(c, snapshotVersion));

        Map<String, List<RawFile>> grouped = new TreeMap<>();
        for (RawFile f : files) {
            grouped.computeIfAbsent(f.getRawSourceId() + "\u0000" + f.getPartitionId().token(), k -> new ArrayList<>()).add(f);
        }
        List<RawPartition> partitions = new ArrayList<>(grouped.size());
        for (List<RawFile> group : grouped.values()) {
            RawFile first = group.get(0);
            partitions.add(RawPartition.of(first.getRawSourceId(), first.getPartitionId(), group));
        }
        return partitions;
    }

    private RawFile resolve(Candidate c, String snapshotVersion) {
        long size;
        try {
            size = Files.size(c.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + c.path(), e);
        }
        SnapshotSummary declared = c.sidecar();
        String declaredHash = declared != null && declared.getHash() != null && !declared.getHash().isBlank()
                ? declared.getHash().trim() : null;

        String hash;
        HashMismatchException mismatch = null;
        if (declaredHash != null && !properties.getDiscovery().isVerifyDeclaredHashes()) {
            hash = declaredHash;
        } else {
            hash = hasher.hashFile(c.path());
            if (declaredHash != null && !declaredHash.equalsIgnoreCase(hash)) {
                mismatch = new HashMismatchException(c.path().toString(), declaredHash, hash);
                log.error("[DISCOVERY] {}", mismatch.getMessage());
            }
        }

        SnapshotSummary effective = declared != null
                ? declared.toBuilder()
                        .bytes(declared.getBytes() != null ? declared.getBytes() : size)
                        .hash(hash)
                        .build()
                : SnapshotSummary.builder()
                        .source(c.rawSourceId())
                        .snapshotVersion(snapshotVersion)
                        .file(c.path().getFileName().toString())
                        .bytes(size)
                        .hash(hash)
                        .build();

        return RawFile.builder()
                .path(c.path())
                .rawSourceId(c.rawSourceId())
                .partitionId(c.id())
                .hash(hash)
                .bytes(size)
                .summary(effective)
                .sidecarPresent(declared != null)
                .mismatch(mismatch)
                .build();
    }

    /**
     * Sidecar records by file basename. The sidecar may hold one object or an array.
     */
    Map<String, SnapshotSummary> readSidecar(Path sidecar) {
        Map<String, SnapshotSummary> byFile = new HashMap<>();
        if (!Files.isRegularFile(sidecar)) {
            return byFile;
        }
        try {
            JsonNode node = JSON.readTree(sidecar.toFile());
            List<JsonNode> records = new ArrayList<>();
            if (node != null && node.isArray()) {
                node.forEach(records::add);
            } else if (node != null && node.isObject()) {
                records.add(node);
            }
            for (JsonNode n : records) {
                SnapshotSummary s = JSON.treeToValue(n, SnapshotSummary.class);
                if (s.getFile() == null || s.getFile().isBlank()) {
                    log.warn("[DISCOVERY] sidecar record without 'file' in {} ignored", sidecar);
                    continue;
                }
                byFile.put(Paths.get(s.getFile()).getFileName().toString(), s);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable sidecar " + sidecar, e);
        }
        return byFile;
    }

    private static List<Path> listSorted(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
