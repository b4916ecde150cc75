package org.netpreserve.sampler.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.sampler.SnapshotContent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChunkedWriterTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private static SnapshotContent content(String domain, int day, String text) {
        return new SnapshotContent("https://" + domain + "/", domain, LocalDate.of(2024, 1, day), text);
    }

    private Map<String, Map<String, String>> read(Path chunk) throws IOException {
        return mapper.readValue(chunk.toFile(), new TypeReference<>() {
        });
    }

    @Test
    public void testWritesSingleChunkOnClose(@TempDir Path tempDir) throws IOException {
        Path base = tempDir.resolve("wayback_data.json");
        var writer = new ChunkedWriter(base, 1024 * 1024, mapper);
        writer.add(content("example.com", 1, "one"));
        writer.add(content("example.com", 2, "two"));
        writer.add(content("example.org", 1, "three"));
        assertTrue(writer.chunks().isEmpty());
        writer.close();

        assertEquals(List.of(tempDir.resolve("wayback_data_1.json")), writer.chunks());
        assertEquals(Map.of(
                "example.com", Map.of("2024-01-01", "one", "2024-01-02", "two"),
                "example.org", Map.of("2024-01-01", "three")), read(writer.chunks().get(0)));
        assertEquals(3, writer.totalEntries());
        assertFalse(Files.exists(base));
    }

    @Test
    public void testSplitsAtThresholdWithoutLosingEntries(@TempDir Path tempDir) throws IOException {
        var writer = new ChunkedWriter(tempDir.resolve("data.json"), 200, mapper);
        for (int day = 1; day <= 28; day++) {
            writer.add(content(day % 2 == 0 ? "example.com" : "example.org", day, "content of day " + day + " ".repeat(20)));
        }
        writer.close();

        assertTrue(writer.chunks().size() > 1);
        var union = new HashMap<String, Map<String, String>>();
        for (Path chunk : writer.chunks()) {
            assertTrue(Files.size(chunk) < 400, chunk + " is " + Files.size(chunk) + " bytes");
            read(chunk).forEach((domain, dates) -> dates.forEach((date, text) ->
                    assertNull(union.computeIfAbsent(domain, k -> new HashMap<>()).put(date, text))));
        }
        assertEquals(14, union.get("example.com").size());
        assertEquals(14, union.get("example.org").size());
        assertEquals("content of day 7" + " ".repeat(20), union.get("example.org").get("2024-01-07"));
    }

    @Test
    public void testEstimateMatchesSerializedSize(@TempDir Path tempDir) throws IOException {
        var writer = new ChunkedWriter(tempDir.resolve("data.json"), Long.MAX_VALUE, mapper);
        writer.add(content("example.com", 1, "plain"));
        writer.add(content("example.com", 2, "quote \" and \\ and ünïcödé and 日本"));
        writer.add(content("example.net", 3, "tab\tnewline\n"));
        long estimate = writer.estimatedSize();
        Path chunk = writer.flush();
        assertNotNull(chunk);
        long actual = Files.size(chunk);
        // separators are counted per entry so the estimate may run a few bytes over
        assertTrue(estimate >= actual && estimate - actual <= 8, "estimated " + estimate + " for " + actual);
        assertNull(writer.flush());
    }

    @Test
    public void testNumberingContinuesAfterExistingChunks(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("data_1.json"), "{}");
        Files.writeString(tempDir.resolve("data_7.json"), "{}");
        Files.writeString(tempDir.resolve("other_9.json"), "{}");
        try (var writer = new ChunkedWriter(tempDir.resolve("data.json"), 1024, mapper)) {
            writer.add(content("example.com", 1, "x"));
            assertEquals(tempDir.resolve("data_8.json"), writer.flush());
        }
    }

    @Test
    public void testFailedFlushKeepsEntries(@TempDir Path tempDir) throws IOException {
        Path dir = tempDir.resolve("out");
        var writer = new ChunkedWriter(dir.resolve("data.json"), 1024 * 1024, mapper);
        writer.add(content("example.com", 1, "kept"));
        Files.delete(dir);
        Files.writeString(dir, "not a directory");
        assertThrows(WriteException.class, writer::flush);

        Files.delete(dir);
        Files.createDirectories(dir);
        Path chunk = writer.flush();
        assertEquals(Map.of("example.com", Map.of("2024-01-01", "kept")), read(chunk));
    }

    @Test
    public void testSameDomainAndDateIsWrittenOnce(@TempDir Path tempDir) throws IOException {
        var writer = new ChunkedWriter(tempDir.resolve("data.json"), 1024 * 1024, mapper);
        assertTrue(writer.add(new SnapshotContent("https://example.com/terms", "example.com",
                LocalDate.of(2024, 1, 1), "terms")));
        assertFalse(writer.add(new SnapshotContent("https://example.com/privacy", "example.com",
                LocalDate.of(2024, 1, 1), "privacy")));
        Path first = writer.flush();

        assertFalse(writer.add(new SnapshotContent("https://example.com/legal", "example.com",
                LocalDate.of(2024, 1, 1), "legal")));
        assertTrue(writer.add(content("example.com", 2, "next day")));
        Path second = writer.flush();

        assertEquals(Map.of("example.com", Map.of("2024-01-01", "terms")), read(first));
        assertEquals(Map.of("example.com", Map.of("2024-01-02", "next day")), read(second));
        assertEquals(2, writer.totalEntries());
    }
}
