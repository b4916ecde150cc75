package org.netpreserve.sampler.output;

import org.netpreserve.jwarc.HttpResponse;
import org.netpreserve.jwarc.WarcCompression;
import org.netpreserve.jwarc.WarcDigest;
import org.netpreserve.jwarc.WarcReader;
import org.netpreserve.jwarc.WarcRecord;
import org.netpreserve.jwarc.WarcResponse;
import org.netpreserve.jwarc.WarcWriter;
import org.netpreserve.sampler.archive.FetchedBody;
import org.netpreserve.sampler.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.SequenceInputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.netpreserve.jwarc.MediaType.HTTP_RESPONSE;

/**
 * On-disk cache of raw snapshot bodies so re-runs can skip captures that were already fetched.
 * <p>
 * Each capture is stored as a single gzipped WARC response record at
 * {@code <directory>/<safe url name>/<timestamp>.warc.gz}, dated with the original capture time.
 */
public class SnapshotCache {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss");
    private static final String SUFFIX = ".warc.gz";
    private final Path directory;

    public SnapshotCache(Path directory) throws IOException {
        this.directory = directory;
        Files.createDirectories(directory);
    }

    public Path pathFor(String url, String timestamp) {
        return directory.resolve(FileNames.safeName(url)).resolve(timestamp + SUFFIX);
    }

    public boolean contains(String url, String timestamp) {
        return Files.isRegularFile(pathFor(url, timestamp));
    }

    public Optional<CachedSnapshot> read(String url, String timestamp) throws IOException {
        Path file = pathFor(url, timestamp);
        if (!Files.isRegularFile(file)) return Optional.empty();
        return Optional.of(read(file));
    }

    static CachedSnapshot read(Path file) throws IOException {
        String filename = file.getFileName().toString();
        String timestamp = filename.substring(0, filename.length() - SUFFIX.length());
        try (var reader = new WarcReader(file)) {
            WarcRecord record = reader.next().orElseThrow(() -> new IOException("Empty cache file " + file));
            if (!(record instanceof WarcResponse response)) {
                throw new IOException("Expected a response record in " + file + " but found " + record.type());
            }
            HttpResponse http = response.http();
            byte[] payload = http.body().stream().readAllBytes();
            String contentType = http.headers().first("Content-Type").orElse(null);
            return new CachedSnapshot(response.target(), timestamp, new FetchedBody(payload, contentType));
        }
    }

    public void save(String url, String timestamp, FetchedBody body) throws IOException {
        Path file = pathFor(url, timestamp);
        Files.createDirectories(file.getParent());

        var headers = new LinkedHashMap<String, List<String>>();
        if (body.contentType() != null) headers.put("Content-Type", List.of(body.contentType()));
        headers.put("Content-Length", List.of(String.valueOf(body.body().length)));
        byte[] httpHeader = new HttpResponse.Builder(200, "OK")
                .addHeaders(headers)
                .build()
                .serializeHeader();

        Instant captureTime = LocalDateTime.parse(timestamp, TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC);
        var headerPlusBody = new SequenceInputStream(new ByteArrayInputStream(httpHeader),
                new ByteArrayInputStream(body.body()));
        WarcResponse record = new WarcResponse.Builder(url)
                .date(captureTime)
                .body(HTTP_RESPONSE, Channels.newChannel(headerPlusBody), httpHeader.length + body.body().length)
                .payloadDigest(sha1(body.body()))
                .build();

        Path temp = Files.createTempFile(file.getParent(), "." + timestamp, ".tmp");
        try {
            try (var warcWriter = new WarcWriter(FileChannel.open(temp, WRITE, CREATE, TRUNCATE_EXISTING),
                    WarcCompression.GZIP)) {
                warcWriter.write(record);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Cached snapshot of {} at {} as {}", url, timestamp, file);
    }

    /**
     * Lists every cached capture file, grouped by URL directory and ordered by timestamp within each.
     */
    public List<Path> list() throws IOException {
        var files = new ArrayList<Path>();
        try (Stream<Path> dirs = Files.list(directory)) {
            for (Path dir : dirs.filter(Files::isDirectory).sorted().toList()) {
                try (Stream<Path> entries = Files.list(dir)) {
                    entries.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                            .sorted()
                            .forEach(files::add);
                }
            }
        }
        return files;
    }

    private static WarcDigest sha1(byte[] data) {
        try {
            var digest = MessageDigest.getInstance("SHA-1");
            digest.update(data);
            return new WarcDigest(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * A capture read back from the cache.
     *
     * @param url       URL the capture was stored under
     * @param timestamp 14 digit capture timestamp
     * @param body      the original bytes and content type
     */
    public record CachedSnapshot(String url, String timestamp, FetchedBody body) {
    }

    public Path directory() {
        return directory;
    }
}
