package com.di.snapdiff.hashing;

import com.di.snapdiff.config.SnapDiffProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * SHA-256 fingerprints of partition content. Pure functions of their input.
 *
 * <p>Row sets hash independently of row order: each row is normalized and hashed, the row
 * hashes are sorted, and the sorted list is hashed again. Line-delimited files whose extension
 * is listed in {@code snapdiff.hashing.row-order-insensitive-extensions} get the same treatment
 * line by line; all other files are hashed byte for byte.
 */
@Component
public class ContentHasher {

    private static final int CHUNK = 1 << 20;

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Set<String> unorderedExtensions;

    public ContentHasher(SnapDiffProperties properties) {
        this.unorderedExtensions = properties.getHashing().getRowOrderInsensitiveExtensions().stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    // ---- files ----

    public String hashFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return unorderedExtensions.contains(ext) ? hashLinesUnordered(file) : hashBytes(file);
    }

    public String hashBytes(Path file) {
        MessageDigest md = newDigest();
        byte[] buf = new byte[CHUNK];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) > 0) {
                md.update(buf, 0, n);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /** Blank lines are ignored; a trailing carriage return is stripped. */
    public String hashLinesUnordered(Path file) {
        List<String> lineHashes = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.endsWith("\r")) {
                    line = line.substring(0, line.length() - 1);
                }
                if (!line.isBlank()) {
                    lineHashes.add(sha256Hex(line));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
        return combine(lineHashes);
    }

    // ---- rows ----

    /**
     * Hash of one row: the normalized values serialized as a JSON array, so separators inside a
     * value cannot shift column boundaries and null stays distinct from the empty string.
     */
    public String rowHash(List<?> values) {
        List<String> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalize(value));
        }
        try {
            return sha256Hex(CANONICAL_JSON.writeValueAsString(normalized));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode row for hashing: " + values, e);
        }
    }

    /** Order-independent hash of a row set. */
    public String hashRows(Collection<? extends List<?>> rows) {
        List<String> hashes = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            hashes.add(rowHash(row));
        }
        return combine(hashes);
    }

    /**
     * Order-independent hash of map rows, reading values in {@code columns} order. With no
     * columns given, the sorted union of all row keys is used.
     */
    public String hashRowMaps(List<Map<String, Object>> rows, List<String> columns) {
        List<String> cols = columns;
        if (cols == null || cols.isEmpty()) {
            Set<String> all = new TreeSet<>();
            rows.forEach(r -> all.addAll(r.keySet()));
            cols = new ArrayList<>(all);
        }
        List<List<?>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            List<Object> values = new ArrayList<>(cols.size());
            for (String c : cols) {
                values.add(row.get(c));
            }
            projected.add(values);
        }
        return hashRows(projected);
    }

    // ---- combinators ----

    /** Hash-of-hashes over a sorted copy of {@code hashes}, so input order never matters. */
    public static String combine(Collection<String> hashes) {
        List<String> sorted = new ArrayList<>(hashes);
        Collections.sort(sorted);
        return sha256Hex(String.join("|", sorted));
    }

    /** Hash of one slice of a parent partition, e.g. one month of a yearly file. */
    public static String slice(String parentHash, String sliceId) {
        return sha256Hex(parentHash + "|" + sliceId);
    }

    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(newDigest().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    /** Text form of a value; null and NaN both map to null. */
    static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN()) {
            return null;
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Map || value instanceof Collection) {
            try {
                return CANONICAL_JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot normalize value for hashing: " + value, e);
            }
        }
        return value.toString();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
