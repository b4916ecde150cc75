package org.netpreserve.sampler;

import java.nio.file.Path;
import java.util.List;

/**
 * What a finished run produced.
 */
public record RunSummary(Progress progress, int failures, Path failureLog, List<Path> chunks, long entries) {
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Processed ").append(progress.urlsDone()).append(" of ").append(progress.urls()).append(" URLs");
        sb.append(" in ").append(progress.runtime() / 1000).append("s\n");
        sb.append("Snapshots fetched: ").append(progress.snapshotsFetched())
                .append(", from cache: ").append(progress.snapshotsCached()).append('\n');
        sb.append("Wrote ").append(entries).append(" entries to ").append(chunks.size()).append(" chunk(s)");
        for (Path chunk : chunks) {
            sb.append("\n  ").append(chunk);
        }
        if (failures > 0) {
            sb.append("\n").append(failures).append(" failed request(s) logged to ").append(failureLog);
        }
        return sb.toString();
    }
}
