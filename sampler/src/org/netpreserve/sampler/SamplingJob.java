package org.netpreserve.sampler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sampler.archive.ArchiveHttpClient;
import org.netpreserve.sampler.archive.ContentFetcher;
import org.netpreserve.sampler.archive.IndexClient;
import org.netpreserve.sampler.archive.RateLimiter;
import org.netpreserve.sampler.archive.RetryPolicy;
import org.netpreserve.sampler.archive.SlidingWindowRateLimiter;
import org.netpreserve.sampler.config.ArchiveConfig;
import org.netpreserve.sampler.config.SamplerConfig;
import org.netpreserve.sampler.output.CacheExporter;
import org.netpreserve.sampler.output.ChunkedWriter;
import org.netpreserve.sampler.output.FailureSink;
import org.netpreserve.sampler.output.SnapshotCache;
import org.netpreserve.sampler.output.StatsStore;
import org.netpreserve.sampler.output.WriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single sampling run: owns the shared rate limiter, archive clients and outputs for the lifetime of the run.
 */
public class SamplingJob implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SamplingJob.class);
    private final SamplerConfig config;
    private final FailureSink failureSink;
    private final ProgressTracker progressTracker;
    private final WorkerPool workerPool;
    private final UrlProcessor urlProcessor;
    private final @Nullable ChunkedWriter writer;
    private final @Nullable SnapshotCache cache;
    private final Lock closeLock = new ReentrantLock();
    private boolean closed;

    public SamplingJob(SamplerConfig config) throws IOException {
        this(config, Duration.ofSeconds(30));
    }

    SamplingJob(SamplerConfig config, Duration progressInterval) throws IOException {
        this.config = config;
        var mapper = new ObjectMapper().findAndRegisterModules();
        ArchiveConfig archive = config.archive();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(archive.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        RateLimiter rateLimiter = new SlidingWindowRateLimiter(archive.rateLimit().calls(),
                archive.rateLimit().period());
        var http = new ArchiveHttpClient(httpClient, rateLimiter, RetryPolicy.of(archive.retry()),
                archive.userAgent(), archive.timeout());
        var indexClient = new IndexClient(http, archive.cdxUrl(), archive.pageSize(), mapper);
        var contentFetcher = new ContentFetcher(http, archive.replayUrl());

        this.failureSink = new FailureSink(config.output().failureLog());
        this.writer = config.processToJson()
                ? new ChunkedWriter(config.output().jsonPath(), config.output().chunkSize(), mapper) : null;
        this.cache = config.saveSnapshots() ? new SnapshotCache(config.output().snapshotsPath()) : null;
        StatsStore stats = config.countChanges() ? new StatsStore(config.output().statsPath(), mapper) : null;
        this.progressTracker = new ProgressTracker(progressInterval);
        this.workerPool = new WorkerPool(config.workers(), failureSink, progressTracker);
        this.urlProcessor = new UrlProcessor(config, indexClient, contentFetcher, failureSink, progressTracker,
                writer, cache, stats);
    }

    /**
     * Processes every URL and flushes the remaining output.
     *
     * @throws WriteException if the dataset could not be written
     */
    public RunSummary run(List<UrlTask> tasks) throws WriteException, InterruptedException {
        log.atInfo().addKeyValue("urls", tasks.size())
                .addKeyValue("from", config.startDate())
                .addKeyValue("to", config.endDate())
                .addKeyValue("frequency", config.frequency().value())
                .log("Starting sampling run");
        progressTracker.start(tasks.size());
        workerPool.run(tasks, urlProcessor::process);
        if (writer != null) writer.flush();
        return summary();
    }

    /**
     * Rebuilds the JSON dataset from previously saved snapshots without contacting the archive.
     */
    public RunSummary exportCache() throws IOException {
        if (writer == null) throw new IllegalStateException("JSON output is not enabled");
        SnapshotCache source = cache != null ? cache : new SnapshotCache(config.output().snapshotsPath());
        progressTracker.start(0);
        new CacheExporter(source, writer, failureSink).export(config.startDate(), config.endDate());
        writer.flush();
        return summary();
    }

    public RunSummary summary() {
        return new RunSummary(progressTracker.current(), failureSink.count(), failureSink.path(),
                writer == null ? List.of() : writer.chunks(),
                writer == null ? 0 : writer.totalEntries());
    }

    public SamplerConfig config() {
        return config;
    }

    /**
     * Stops the workers and flushes whatever has been collected so far. Safe to call more than once.
     */
    @Override
    public void close() {
        closeLock.lock();
        try {
            if (closed) return;
            closed = true;
            workerPool.close();
            progressTracker.close();
            if (writer != null) {
                try {
                    writer.close();
                } catch (WriteException e) {
                    log.error("Failed to flush remaining output", e);
                }
            }
            try {
                failureSink.close();
            } catch (IOException e) {
                log.error("Failed to close failure log", e);
            }
        } finally {
            closeLock.unlock();
        }
    }
}
