package org.netpreserve.sampler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sampler.util.ByteSizeDeserializer;

import java.nio.file.Path;

/**
 * Where results are written.
 *
 * @param jsonPath      base path of the JSON dataset; chunks are numbered after its stem
 * @param chunkSize     approximate number of bytes held in memory before a chunk is flushed
 * @param snapshotsPath directory of the raw snapshot cache
 * @param statsPath     directory for change-rate records
 * @param failureLog    append-only log of failed requests
 */
public record OutputConfig(
        Path jsonPath,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        long chunkSize,
        Path snapshotsPath,
        Path statsPath,
        Path failureLog
) {
    public OutputConfig {
        if (jsonPath == null) throw new IllegalArgumentException("output.jsonPath is required");
        if (chunkSize <= 0) throw new IllegalArgumentException("output.chunkSize must be positive");
        if (snapshotsPath == null) throw new IllegalArgumentException("output.snapshotsPath is required");
        if (statsPath == null) throw new IllegalArgumentException("output.statsPath is required");
        if (failureLog == null) throw new IllegalArgumentException("output.failureLog is required");
    }
}
