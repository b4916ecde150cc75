package org.netpreserve.sampler.output;

import org.netpreserve.sampler.FailedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends failed requests to a plain text log, one per line. The log is only created once something fails and is
 * appended to across runs. Safe for concurrent use.
 */
public class FailureSink implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(FailureSink.class);
    private final Path path;
    private BufferedWriter writer;
    private int count;

    public FailureSink(Path path) {
        this.path = path;
    }

    public synchronized void record(FailedRequest failure) {
        count++;
        log.atWarn().addKeyValue("url", failure.url())
                .addKeyValue("timestamp", failure.timestamp())
                .log("Request failed: {}", failure.reason());
        try {
            if (writer == null) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            writer.write(failure.toLogLine());
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.error("Could not append to failure log {}: {}", path, failure.toLogLine(), e);
        }
    }

    /**
     * Number of failures recorded by this instance.
     */
    public synchronized int count() {
        return count;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
