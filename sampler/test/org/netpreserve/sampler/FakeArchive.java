package org.netpreserve.sampler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A local stand-in for the archive's CDX and replay endpoints.
 */
public class FakeArchive implements AutoCloseable {
    private final HttpServer server;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, List<Capture>> captures = new ConcurrentHashMap<>();
    private final List<String> replayRequests = new CopyOnWriteArrayList<>();
    private final AtomicInteger indexRequests = new AtomicInteger();

    public record Capture(String timestamp, String digest, int status, String contentType, byte[] body) {
        public static Capture text(String timestamp, String digest, String text) {
            return new Capture(timestamp, digest, 200, "text/plain; charset=utf-8",
                    text.getBytes(StandardCharsets.UTF_8));
        }

        public Capture withStatus(int status) {
            return new Capture(timestamp, digest, status, contentType, body);
        }
    }

    public FakeArchive() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/cdx", this::handleIndex);
        server.createContext("/web/", this::handleReplay);
        server.start();
    }

    public FakeArchive add(String url, Capture capture) {
        captures.computeIfAbsent(url, k -> new CopyOnWriteArrayList<>()).add(capture);
        return this;
    }

    public URI cdxUrl() {
        return URI.create("http://" + address() + "/cdx");
    }

    public URI replayUrl() {
        return URI.create("http://" + address() + "/web");
    }

    private String address() {
        String host = server.getAddress().getAddress().getHostAddress();
        if (host.contains(":")) host = "[" + host + "]";
        return host + ":" + server.getAddress().getPort();
    }

    public int indexRequests() {
        return indexRequests.get();
    }

    /**
     * Replay requests received so far as "timestamp url".
     */
    public List<String> replayRequests() {
        return replayRequests;
    }

    private void handleIndex(HttpExchange exchange) throws IOException {
        indexRequests.incrementAndGet();
        String url = queryParam(exchange.getRequestURI().getRawQuery(), "url");
        var rows = new ArrayList<List<String>>();
        rows.add(List.of("timestamp", "original", "mimetype", "statuscode", "digest"));
        List<Capture> list = new ArrayList<>(captures.getOrDefault(url, List.of()));
        list.sort(Comparator.comparing(Capture::timestamp));
        for (Capture capture : list) {
            rows.add(List.of(capture.timestamp(), url, "text/plain", String.valueOf(capture.status()),
                    capture.digest()));
        }
        respond(exchange, 200, "application/json", mapper.writeValueAsBytes(rows));
    }

    private void handleReplay(HttpExchange exchange) throws IOException {
        String target = exchange.getRequestURI().toString().substring("/web/".length());
        int marker = target.indexOf("id_/");
        if (marker < 0) {
            respond(exchange, 400, "text/plain", new byte[0]);
            return;
        }
        String timestamp = target.substring(0, marker);
        String url = target.substring(marker + "id_/".length());
        replayRequests.add(timestamp + " " + url);
        for (Capture capture : captures.getOrDefault(url, List.of())) {
            if (capture.timestamp().equals(timestamp)) {
                respond(exchange, capture.status(), capture.contentType(), capture.body());
                return;
            }
        }
        respond(exchange, 404, "text/plain", "not archived".getBytes(StandardCharsets.UTF_8));
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null) return null;
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
