package org.netpreserve.sampler.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.sampler.SnapshotContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Accumulates snapshot text as {@code {domain: {date: content}}} and writes it out in numbered chunk files once the
 * estimated serialized size reaches a threshold.
 * <p>
 * Given the base path {@code out/wayback_data.json} chunks are named {@code out/wayback_data_1.json},
 * {@code out/wayback_data_2.json} and so on. Numbering continues after the highest chunk already present so earlier
 * runs are never overwritten. Each chunk is a complete JSON document; the dataset is the union of all chunks.
 */
public class ChunkedWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ChunkedWriter.class);
    private static final int EMPTY_OBJECT_SIZE = 2;
    private final Path directory;
    private final String stem;
    private final Pattern chunkPattern;
    private final long threshold;
    private final ObjectMapper mapper;
    private final List<Path> chunks = new ArrayList<>();
    private final Set<String> writtenKeys = new HashSet<>();
    private Map<String, Map<String, String>> dataset = new LinkedHashMap<>();
    private long estimatedSize = EMPTY_OBJECT_SIZE;
    private int pendingEntries;
    private long totalEntries;
    private int nextChunk;

    public ChunkedWriter(Path basePath, long threshold, ObjectMapper mapper) throws IOException {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive");
        Path absolute = basePath.toAbsolutePath();
        this.directory = absolute.getParent();
        String filename = absolute.getFileName().toString();
        this.stem = filename.endsWith(".json") ? filename.substring(0, filename.length() - 5) : filename;
        this.chunkPattern = Pattern.compile(Pattern.quote(stem) + "_(\\d+)\\.json");
        this.threshold = threshold;
        this.mapper = mapper;
        Files.createDirectories(directory);
        this.nextChunk = highestExistingChunk() + 1;
    }

    private int highestExistingChunk() throws IOException {
        int highest = 0;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher matcher = chunkPattern.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    try {
                        highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring chunk with unusable number: {}", file);
                    }
                }
            }
        }
        return highest;
    }

    /**
     * Adds one entry, flushing a chunk if the threshold is reached. Each domain and date is written at most once per
     * run: an entry whose key was already added, in this chunk or an earlier one, is dropped.
     *
     * @return false if the entry was dropped as a duplicate
     * @throws WriteException if a chunk had to be flushed and could not be written. The accumulated entries are kept.
     */
    public synchronized boolean add(SnapshotContent content) throws WriteException {
        String date = content.dateString();
        if (!writtenKeys.add(content.domain() + " " + date)) {
            log.atDebug().addKeyValue("domain", content.domain())
                    .addKeyValue("date", date)
                    .addKeyValue("url", content.url())
                    .log("Dropping duplicate output entry");
            return false;
        }
        Map<String, String> dates = dataset.get(content.domain());
        if (dates == null) {
            dates = new LinkedHashMap<>();
            dataset.put(content.domain(), dates);
            estimatedSize += jsonStringSize(content.domain()) + 4;
        }
        dates.put(date, content.content());
        estimatedSize += jsonStringSize(date) + 2 + jsonStringSize(content.content());
        pendingEntries++;
        totalEntries++;
        if (estimatedSize >= threshold) {
            flush();
        }
        return true;
    }

    /**
     * Writes the accumulated entries to the next chunk file and starts a fresh dataset. Does nothing when empty.
     *
     * @return the chunk written, or null if there was nothing to write
     */
    public synchronized Path flush() throws WriteException {
        if (dataset.isEmpty()) return null;
        Path target = directory.resolve(stem + "_" + nextChunk + ".json");
        while (Files.exists(target)) {
            nextChunk++;
            target = directory.resolve(stem + "_" + nextChunk + ".json");
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "." + stem + "_", ".json.tmp");
            mapper.writeValue(temp.toFile(), dataset);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new WriteException("Failed to write output chunk " + target, e);
        }
        log.atInfo().addKeyValue("file", target)
                .addKeyValue("domains", dataset.size())
                .addKeyValue("entries", pendingEntries)
                .log("Wrote output chunk");
        chunks.add(target);
        nextChunk++;
        dataset = new LinkedHashMap<>();
        estimatedSize = EMPTY_OBJECT_SIZE;
        pendingEntries = 0;
        return target;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file {}", temp, e);
        }
    }

    /**
     * Flushes any remaining entries.
     */
    @Override
    public synchronized void close() throws WriteException {
        flush();
    }

    public synchronized List<Path> chunks() {
        return new ArrayList<>(chunks);
    }

    public synchronized long totalEntries() {
        return totalEntries;
    }

    public synchronized long estimatedSize() {
        return estimatedSize;
    }

    /**
     * Approximate size of a string once encoded as a quoted UTF-8 JSON string.
     */
    static long jsonStringSize(String s) {
        long size = 2;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') size += 2;
            else if (c == '\n' || c == '\r' || c == '\t' || c == '\b' || c == '\f') size += 2;
            else if (c < 0x20) size += 6;
            else if (c < 0x80) size += 1;
            else if (c < 0x800) size += 2;
            else if (Character.isHighSurrogate(c)) {
                size += 4;
                i++;
            } else size += 3;
        }
        return size;
    }
}
