package org.netpreserve.sampler.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.jwarc.WarcReader;
import org.netpreserve.jwarc.WarcResponse;
import org.netpreserve.sampler.archive.FetchedBody;
import org.netpreserve.sampler.util.FileNames;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCacheTest {
    private static final String URL = "https://example.com/robots.txt";

    @Test
    public void testSaveAndRead(@TempDir Path tempDir) throws IOException {
        var cache = new SnapshotCache(tempDir.resolve("snapshots"));
        assertFalse(cache.contains(URL, "20240110120000"));
        assertTrue(cache.read(URL, "20240110120000").isEmpty());

        byte[] body = "User-agent: *\nDisallow: /\n".getBytes(StandardCharsets.UTF_8);
        cache.save(URL, "20240110120000", new FetchedBody(body, "text/plain; charset=utf-8"));

        assertTrue(cache.contains(URL, "20240110120000"));
        assertEquals(tempDir.resolve("snapshots").resolve(FileNames.safeName(URL)).resolve("20240110120000.warc.gz"),
                cache.pathFor(URL, "20240110120000"));
        var cached = cache.read(URL, "20240110120000").orElseThrow();
        assertEquals(URL, cached.url());
        assertEquals("20240110120000", cached.timestamp());
        assertArrayEquals(body, cached.body().body());
        assertEquals("text/plain; charset=utf-8", cached.body().contentType());
    }

    @Test
    public void testRecordIsAValidWarcResponse(@TempDir Path tempDir) throws IOException {
        var cache = new SnapshotCache(tempDir);
        cache.save(URL, "20240110120000", new FetchedBody(new byte[]{1, 2, 3}, null));
        try (var reader = new WarcReader(cache.pathFor(URL, "20240110120000"))) {
            var record = reader.next().orElseThrow();
            assertInstanceOf(WarcResponse.class, record);
            var response = (WarcResponse) record;
            assertEquals(URL, response.target());
            assertEquals(Instant.parse("2024-01-10T12:00:00Z"), response.date());
            assertEquals(200, response.http().status());
            assertTrue(response.payloadDigest().isPresent());
        }
    }

    @Test
    public void testListAndCorruptFiles(@TempDir Path tempDir) throws IOException {
        var cache = new SnapshotCache(tempDir);
        var body = new FetchedBody("x".getBytes(StandardCharsets.UTF_8), "text/plain");
        cache.save("https://example.org/", "20240301000000", body);
        cache.save(URL, "20240201000000", body);
        cache.save(URL, "20240101000000", body);
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        assertEquals(List.of(
                cache.pathFor(URL, "20240101000000"),
                cache.pathFor(URL, "20240201000000"),
                cache.pathFor("https://example.org/", "20240301000000")), cache.list());

        Files.writeString(cache.pathFor(URL, "20240101000000"), "garbage");
        assertThrows(IOException.class, () -> cache.read(URL, "20240101000000"));
    }

    @Test
    public void testSimilarUrlsAreCachedSeparately(@TempDir Path tempDir) throws IOException {
        var cache = new SnapshotCache(tempDir);
        cache.save("https://example.com/legal/terms", "20240110120000",
                new FetchedBody("terms".getBytes(StandardCharsets.UTF_8), "text/plain"));

        assertTrue(cache.contains("https://example.com/legal/terms", "20240110120000"));
        assertFalse(cache.contains("https://example.com/legal?terms", "20240110120000"));
    }
}
