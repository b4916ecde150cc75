package org.netpreserve.sampler;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sampler.archive.ContentFetcher;
import org.netpreserve.sampler.archive.FetchException;
import org.netpreserve.sampler.archive.FetchedBody;
import org.netpreserve.sampler.archive.IndexClient;
import org.netpreserve.sampler.archive.IndexException;
import org.netpreserve.sampler.config.SamplerConfig;
import org.netpreserve.sampler.output.ChunkedWriter;
import org.netpreserve.sampler.output.FailureSink;
import org.netpreserve.sampler.output.SnapshotCache;
import org.netpreserve.sampler.output.StatsStore;
import org.netpreserve.sampler.output.WriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Processes one URL end to end: index query, bucket selection, then fetching the selected captures and/or counting
 * content changes. Failures of individual snapshots are recorded and the remaining snapshots are still processed.
 */
public class UrlProcessor {
    private static final Logger log = LoggerFactory.getLogger(UrlProcessor.class);
    private final SamplerConfig config;
    private final IndexClient indexClient;
    private final ContentFetcher contentFetcher;
    private final FailureSink failureSink;
    private final ProgressTracker progress;
    private final @Nullable ChunkedWriter writer;
    private final @Nullable SnapshotCache cache;
    private final @Nullable StatsStore stats;

    public UrlProcessor(SamplerConfig config, IndexClient indexClient, ContentFetcher contentFetcher,
                        FailureSink failureSink, ProgressTracker progress, @Nullable ChunkedWriter writer,
                        @Nullable SnapshotCache cache, @Nullable StatsStore stats) {
        this.config = config;
        this.indexClient = indexClient;
        this.contentFetcher = contentFetcher;
        this.failureSink = failureSink;
        this.progress = progress;
        this.writer = writer;
        this.cache = cache;
        this.stats = stats;
    }

    public void process(UrlTask task) throws InterruptedException, WriteException {
        String url = task.resolvedUrl();
        boolean countChanges = stats != null && config.countChanges() && !stats.exists(url);
        if (stats != null && config.countChanges() && !countChanges) {
            log.info("Skipping change count for {} as stats already exist", url);
        }
        if (!countChanges && !config.fetchSnapshots()) {
            progress.urlDone();
            return;
        }

        log.atInfo().addKeyValue("url", url).log("Querying index");
        List<SnapshotRef> refs;
        try {
            refs = indexClient.query(url, config.startDate(), config.endDate());
        } catch (IndexException e) {
            failureSink.record(FailedRequest.of(url, e));
            progress.urlFailed();
            return;
        }

        if (countChanges) {
            ChangeRecord record = ChangeCounter.countChanges(url, refs, config.frequency());
            try {
                stats.save(record);
            } catch (IOException e) {
                failureSink.record(new FailedRequest(url, null, "stats write failed: " + e.getMessage()));
            }
            log.atInfo().addKeyValue("url", url).addKeyValue("changes", record.changeCount()).log("Counted changes");
        }

        if (config.fetchSnapshots()) {
            List<SelectedSnapshot> selected = SnapshotSelector.select(refs, config.startDate(), config.endDate(),
                    config.frequency());
            if (selected.isEmpty()) {
                log.info("No snapshots available for {} between {} and {}", url, config.startDate(),
                        config.endDate());
            }
            int written = 0;
            for (SelectedSnapshot snapshot : selected) {
                if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
                if (processSnapshot(task, snapshot)) written++;
            }
            log.atInfo().addKeyValue("url", url)
                    .addKeyValue("selected", selected.size())
                    .addKeyValue("written", written)
                    .log("Processed snapshots");
        }
        progress.urlDone();
    }

    private boolean processSnapshot(UrlTask task, SelectedSnapshot snapshot) throws InterruptedException, WriteException {
        String url = task.resolvedUrl();
        String content;
        try {
            FetchedBody body = retrieve(url, snapshot.timestamp());
            if (writer == null) return true;
            content = ContentFetcher.decode(url, snapshot.timestamp(), body);
        } catch (FetchException e) {
            failureSink.record(FailedRequest.of(url, snapshot.timestamp(), e));
            progress.snapshotFailed();
            return false;
        }
        writer.add(new SnapshotContent(url, task.domain(), snapshot.date(), content));
        return true;
    }

    /**
     * Returns the capture's body from the cache if present, otherwise fetches it (and caches it when enabled).
     */
    private FetchedBody retrieve(String url, String timestamp) throws FetchException, InterruptedException {
        if (cache != null && cache.contains(url, timestamp)) {
            try {
                Optional<SnapshotCache.CachedSnapshot> cached = cache.read(url, timestamp);
                if (cached.isPresent()) {
                    progress.snapshotCached();
                    return cached.get().body();
                }
            } catch (IOException e) {
                log.warn("Unreadable cached snapshot of {} at {}, fetching again", url, timestamp, e);
            }
        }
        FetchedBody body = contentFetcher.fetchRaw(url, timestamp);
        progress.snapshotFetched();
        if (cache != null) {
            try {
                cache.save(url, timestamp, body);
            } catch (IOException e) {
                failureSink.record(new FailedRequest(url, timestamp, "cache write failed: " + e.getMessage()));
            }
        }
        return body;
    }
}
