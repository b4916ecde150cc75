package org.netpreserve.sampler.output;

import org.netpreserve.sampler.FailedRequest;
import org.netpreserve.sampler.SnapshotContent;
import org.netpreserve.sampler.SnapshotRef;
import org.netpreserve.sampler.UrlTask;
import org.netpreserve.sampler.archive.ContentFetcher;
import org.netpreserve.sampler.archive.DecodeException;
import org.netpreserve.sampler.config.SiteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Rebuilds the JSON dataset from the snapshot cache alone, without contacting the archive.
 */
public class CacheExporter {
    private static final Logger log = LoggerFactory.getLogger(CacheExporter.class);
    private final SnapshotCache cache;
    private final ChunkedWriter writer;
    private final FailureSink failureSink;

    public CacheExporter(SnapshotCache cache, ChunkedWriter writer, FailureSink failureSink) {
        this.cache = cache;
        this.writer = writer;
        this.failureSink = failureSink;
    }

    /**
     * Writes every cached capture dated within {@code [startDate, endDate]} to the dataset.
     *
     * @return the number of captures written
     */
    public int export(LocalDate startDate, LocalDate endDate) throws IOException {
        int exported = 0;
        for (Path file : cache.list()) {
            SnapshotCache.CachedSnapshot snapshot;
            try {
                snapshot = SnapshotCache.read(file);
            } catch (IOException e) {
                failureSink.record(new FailedRequest(file.toString(), null, "unreadable cache file: " + e.getMessage()));
                continue;
            }
            if (!SnapshotRef.isValidTimestamp(snapshot.timestamp())) {
                log.warn("Skipping cache file with unexpected name {}", file);
                continue;
            }
            LocalDate date = new SnapshotRef(snapshot.timestamp(), "-").date();
            if (date.isBefore(startDate) || date.isAfter(endDate)) continue;
            String content;
            try {
                content = ContentFetcher.decode(snapshot.url(), snapshot.timestamp(), snapshot.body());
            } catch (DecodeException e) {
                failureSink.record(FailedRequest.of(snapshot.url(), snapshot.timestamp(), e));
                continue;
            }
            String domain = UrlTask.of(snapshot.url(), SiteType.MAIN).domain();
            writer.add(new SnapshotContent(snapshot.url(), domain, date, content));
            exported++;
        }
        log.info("Exported {} cached snapshots from {}", exported, cache.directory());
        return exported;
    }
}
