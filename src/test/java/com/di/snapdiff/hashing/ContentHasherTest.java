package com.di.snapdiff.hashing;

import com.di.snapdiff.config.SnapDiffProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentHasher Tests")
class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher(new SnapDiffProperties());

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should produce a 64-character hex SHA-256")
    void testSha256HexLength() {
        String h = ContentHasher.sha256Hex("abc");
        assertEquals(64, h.length());
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", h);
    }

    @Test
    @DisplayName("Should ignore row order in CSV files")
    void testCsvRowOrderInsensitive() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.csv"), "SYR,DEU,2021,10\nAFG,PAK,2021,20\n");
        Path b = Files.writeString(tempDir.resolve("b.csv"), "AFG,PAK,2021,20\r\nSYR,DEU,2021,10\r\n\r\n");
        assertEquals(hasher.hashFile(a), hasher.hashFile(b));
    }

    @Test
    @DisplayName("Should change when a CSV value changes")
    void testCsvValueChange() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.csv"), "SYR,DEU,2021,10\n");
        Path b = Files.writeString(tempDir.resolve("b.csv"), "SYR,DEU,2021,11\n");
        assertNotEquals(hasher.hashFile(a), hasher.hashFile(b));
    }

    @Test
    @DisplayName("Should hash other formats byte for byte")
    void testBinaryFormatsOrderSensitive() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.parquet"), "row1\nrow2\n");
        Path b = Files.writeString(tempDir.resolve("b.parquet"), "row2\nrow1\n");
        assertNotEquals(hasher.hashFile(a), hasher.hashFile(b));
        assertEquals(hasher.hashBytes(a), hasher.hashFile(a));
    }

    @Test
    @DisplayName("Should hash row maps independently of row and key order")
    void testRowMapsOrderInsensitive() {
        Map<String, Object> r1 = new LinkedHashMap<>();
        r1.put("origin", "SYR");
        r1.put("year", 2021);
        Map<String, Object> r1Reordered = new LinkedHashMap<>();
        r1Reordered.put("year", 2021);
        r1Reordered.put("origin", "SYR");
        Map<String, Object> r2 = Map.of("origin", "AFG", "year", 2021);

        String h1 = hasher.hashRowMaps(List.of(r1, r2), null);
        String h2 = hasher.hashRowMaps(List.of(r2, r1Reordered), null);
        assertEquals(h1, h2);
    }

    @Test
    @DisplayName("Should treat null and NaN alike")
    void testNullAndNaNNormalizeTogether() {
        assertEquals(hasher.rowHash(Arrays.asList("a", null)), hasher.rowHash(List.of("a", Double.NaN)));
        assertEquals("2021-03-01", ContentHasher.normalize(LocalDate.of(2021, 3, 1)));
    }

    @Test
    @DisplayName("Should keep column boundaries when values contain separators")
    void testSeparatorInsideValue() {
        assertNotEquals(hasher.hashRows(List.of(List.of("a|b", "c"))),
                hasher.hashRows(List.of(List.of("a", "b|c"))));
        assertNotEquals(hasher.rowHash(List.of("a\",\"b")), hasher.rowHash(List.of("a", "b")));
    }

    @Test
    @DisplayName("Should tell null apart from the empty string")
    void testNullDistinctFromEmpty() {
        assertNotEquals(hasher.hashRows(List.of(Arrays.asList("x", null))),
                hasher.hashRows(List.of(List.of("x", ""))));
        assertNotEquals(hasher.rowHash(Arrays.asList("x", null)), hasher.rowHash(List.of("x", "null")));
        assertNull(ContentHasher.normalize(null));
    }

    @Test
    @DisplayName("Should detect an added row")
    void testAddedRowChangesHash() {
        List<List<?>> rows = new ArrayList<>();
        rows.add(List.of("SYR", 2021));
        String before = hasher.hashRows(rows);
        rows.add(List.of("AFG", 2021));
        assertNotEquals(before, hasher.hashRows(rows));
    }

    @Test
    @DisplayName("Should combine hashes independently of order and scope slices by id")
    void testCombineAndSlice() {
        assertEquals(ContentHasher.combine(List.of("a", "b")), ContentHasher.combine(List.of("b", "a")));
        assertNotEquals(ContentHasher.slice("h", "2020-01"), ContentHasher.slice("h", "2020-02"));
        assertEquals(ContentHasher.slice("h", "2020-01"), ContentHasher.slice("h", "2020-01"));
    }
}
