package org.netpreserve.sampler.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.sampler.ChangeRecord;
import org.netpreserve.sampler.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores one change-rate record per URL as {@code <directory>/<safe url name>.json}.
 */
public class StatsStore {
    private static final Logger log = LoggerFactory.getLogger(StatsStore.class);
    private final Path directory;
    private final ObjectMapper mapper;

    public StatsStore(Path directory, ObjectMapper mapper) throws IOException {
        this.directory = directory;
        this.mapper = mapper;
        Files.createDirectories(directory);
    }

    public Path pathFor(String url) {
        return directory.resolve(FileNames.safeName(url) + ".json");
    }

    /**
     * Whether a record for this URL was already written, possibly by an earlier run.
     */
    public boolean exists(String url) {
        return Files.isRegularFile(pathFor(url));
    }

    public void save(ChangeRecord record) throws IOException {
        Path file = pathFor(record.url());
        Path temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Stats saved as {}", file);
    }

    public ChangeRecord load(String url) throws IOException {
        return mapper.readValue(pathFor(url).toFile(), ChangeRecord.class);
    }
}
