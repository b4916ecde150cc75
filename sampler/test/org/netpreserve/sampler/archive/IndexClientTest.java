package org.netpreserve.sampler.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import org.netpreserve.sampler.FakeArchive;
import org.netpreserve.sampler.FakeArchive.Capture;
import org.netpreserve.sampler.SnapshotRef;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class IndexClientTest {
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate END = LocalDate.of(2024, 3, 31);
    private final ObjectMapper mapper = new ObjectMapper();

    private IndexClient client(URI cdxUrl, int pageSize) {
        var http = new ArchiveHttpClient(HttpClient.newHttpClient(), RateLimiter.unlimited(),
                new RetryPolicy(1, Duration.ZERO, Duration.ZERO), "sampler-test", Duration.ofSeconds(10));
        return new IndexClient(http, cdxUrl, pageSize, mapper);
    }

    @Test
    public void testBuildQuery() {
        URI uri = client(URI.create("https://web.archive.org/cdx/search/cdx"), 0)
                .buildQuery("https://example.com/robots.txt", START, END, null);
        String query = uri.getRawQuery();
        assertTrue(uri.toString().startsWith("https://web.archive.org/cdx/search/cdx?"));
        assertTrue(query.contains("url=https%3A%2F%2Fexample.com%2Frobots.txt"), query);
        assertTrue(query.contains("output=json"), query);
        assertTrue(query.contains("from=20240101"), query);
        assertTrue(query.contains("to=20240331"), query);
        assertTrue(query.contains("fl=timestamp,original,mimetype,statuscode,digest"), query);
        assertTrue(query.contains("filter=%21statuscode%3A404"), query);
        assertTrue(query.contains("filter=%21mimetype%3Awarc%2Frevisit"), query);
        assertFalse(query.contains("limit="), query);

        URI paged = client(URI.create("https://web.archive.org/cdx/search/cdx"), 500)
                .buildQuery("example.com", START, END, "com,example)/ 20240101");
        assertTrue(paged.getRawQuery().contains("limit=500&showResumeKey=true&resumeKey=com%2Cexample%29%2F+20240101"),
                paged.getRawQuery());
    }

    @Test
    public void testParsePageSkipsMalformedRowsAndOutOfRange() throws IndexException {
        String json = """
                [["timestamp","original","mimetype","statuscode","digest"],
                 ["20240320120000","https://example.com/","text/html","200","C"],
                 ["20240110120000","https://example.com/","text/html","200","A"],
                 ["2024011012","https://example.com/","text/html","200","X"],
                 ["20240231120000","https://example.com/","text/html","200","X"],
                 ["20240111120000","https://example.com/","text/html","200","-"],
                 ["20240112120000","https://example.com/"],
                 ["20231231120000","https://example.com/","text/html","200","Z"],
                 ["20240215120000","https://example.com/","text/html","200","B"]]
                """;
        var refs = new ArrayList<SnapshotRef>();
        String resumeKey = client(URI.create("http://localhost/cdx"), 0)
                .parsePage("https://example.com/", json.getBytes(StandardCharsets.UTF_8), START, END, refs);
        assertNull(resumeKey);
        assertEquals(List.of(
                new SnapshotRef("20240320120000", "C"),
                new SnapshotRef("20240110120000", "A"),
                new SnapshotRef("20240215120000", "B")), refs);
    }

    @Test
    public void testParsePageEdgeCases() throws IndexException {
        var client = client(URI.create("http://localhost/cdx"), 0);
        var refs = new ArrayList<SnapshotRef>();
        assertNull(client.parsePage("u", new byte[0], START, END, refs));
        assertNull(client.parsePage("u", "[]".getBytes(StandardCharsets.UTF_8), START, END, refs));
        assertTrue(refs.isEmpty());
        assertThrows(IndexException.class,
                () -> client.parsePage("u", "<html>".getBytes(StandardCharsets.UTF_8), START, END, refs));
        assertThrows(IndexException.class,
                () -> client.parsePage("u", "{\"a\":1}".getBytes(StandardCharsets.UTF_8), START, END, refs));
        assertThrows(IndexException.class,
                () -> client.parsePage("u", "[[\"original\"]]".getBytes(StandardCharsets.UTF_8), START, END, refs));
    }

    @Test
    public void testQueryAgainstArchive() throws Exception {
        try (var archive = new FakeArchive()
                .add("https://example.com/", Capture.text("20240320120000", "C", "c"))
                .add("https://example.com/", Capture.text("20240110120000", "A", "a"))
                .add("https://example.com/", Capture.text("20250101000000", "Z", "z"))) {
            var refs = client(archive.cdxUrl(), 0).query("https://example.com/", START, END);
            assertEquals(List.of(new SnapshotRef("20240110120000", "A"), new SnapshotRef("20240320120000", "C")), refs);

            assertTrue(client(archive.cdxUrl(), 0).query("https://example.net/", START, END).isEmpty());
        }
    }

    @Test
    public void testFollowsResumeKey() throws Exception {
        List<String> queries = new CopyOnWriteArrayList<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/cdx", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            queries.add(query);
            String body = query.contains("resumeKey=")
                    ? "[[\"timestamp\",\"digest\"],[\"20240301000000\",\"C\"]]"
                    : "[[\"timestamp\",\"digest\"],[\"20240201000000\",\"B\"],[\"20240101000000\",\"A\"],[],[\"next-page\"]]";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        try {
            URI cdxUrl = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/cdx");
            var refs = client(cdxUrl, 2).query("example.com", START, END);
            assertEquals(List.of("20240101000000", "20240201000000", "20240301000000"),
                    refs.stream().map(SnapshotRef::timestamp).toList());
            assertEquals(2, queries.size());
            assertTrue(queries.get(1).contains("resumeKey=next-page"), queries.get(1));
        } finally {
            server.stop(0);
        }
    }

    @Test
    public void testStopsWhenResumeKeyRepeats() throws Exception {
        List<String> queries = new CopyOnWriteArrayList<>();
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/cdx", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            queries.add(query);
            String body = query.contains("resumeKey=")
                    ? "[[\"timestamp\",\"digest\"],[\"20240201000000\",\"B\"],[],[\"same-key\"]]"
                    : "[[\"timestamp\",\"digest\"],[\"20240101000000\",\"A\"],[],[\"same-key\"]]";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        try {
            URI cdxUrl = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/cdx");
            var refs = client(cdxUrl, 1).query("example.com", START, END);
            assertEquals(List.of("20240101000000", "20240201000000"),
                    refs.stream().map(SnapshotRef::timestamp).toList());
            assertEquals(2, queries.size());
        } finally {
            server.stop(0);
        }
    }

    @Test
    public void testFailures() throws IOException {
        var client = client(URI.create("http://localhost/cdx"), 0);
        assertThrows(IndexException.class, () -> client.query("not a url", START, END));
        assertThrows(IndexException.class, () -> client.query("ftp://example.com/", START, END));
        assertThrows(IllegalArgumentException.class, () -> client.query("example.com", END, START));

        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/cdx", exchange -> {
            exchange.sendResponseHeaders(403, -1);
            exchange.close();
        });
        server.start();
        try {
            URI cdxUrl = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/cdx");
            var e = assertThrows(IndexException.class, () -> client(cdxUrl, 0).query("example.com", START, END));
            assertEquals("example.com", e.url());
            assertInstanceOf(RequestFailedException.class, e.getCause());
        } finally {
            server.stop(0);
        }
    }

    @Test
    public void testIsWellFormed() {
        assertTrue(IndexClient.isWellFormed("https://example.com/robots.txt"));
        assertTrue(IndexClient.isWellFormed("example.com"));
        assertTrue(IndexClient.isWellFormed("example.com/robots.txt"));
        assertFalse(IndexClient.isWellFormed(""));
        assertFalse(IndexClient.isWellFormed("https://"));
        assertFalse(IndexClient.isWellFormed("exa mple.com"));
    }
}
