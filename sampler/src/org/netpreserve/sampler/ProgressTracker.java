package org.netpreserve.sampler;

import org.netpreserve.sampler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts progress of a run and periodically logs it.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("sampler-progress"));
    private final Duration interval;
    private final AtomicInteger urlsDone = new AtomicInteger();
    private final AtomicInteger urlsFailed = new AtomicInteger();
    private final AtomicInteger snapshotsFetched = new AtomicInteger();
    private final AtomicInteger snapshotsCached = new AtomicInteger();
    private final AtomicInteger snapshotsFailed = new AtomicInteger();
    private volatile int urls;
    private volatile Instant startTime;
    private ScheduledFuture<?> reportTask;

    public ProgressTracker(Duration interval) {
        this.interval = interval;
    }

    public synchronized void start(int urls) {
        this.urls = urls;
        this.startTime = Instant.now();
        if (reportTask == null) {
            reportTask = scheduler.scheduleAtFixedRate(this::report, interval.toMillis(), interval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    public void urlDone() {
        urlsDone.incrementAndGet();
    }

    public void urlFailed() {
        urlsFailed.incrementAndGet();
    }

    public void snapshotFetched() {
        snapshotsFetched.incrementAndGet();
    }

    public void snapshotCached() {
        snapshotsCached.incrementAndGet();
    }

    public void snapshotFailed() {
        snapshotsFailed.incrementAndGet();
    }

    private void report() {
        Progress progress = current();
        log.info("Processed {}/{} URLs ({} failed), {} snapshots fetched, {} from cache, {} failed",
                progress.urlsDone(), progress.urls(), progress.urlsFailed(), progress.snapshotsFetched(),
                progress.snapshotsCached(), progress.snapshotsFailed());
    }

    public Progress current() {
        Instant start = startTime;
        long runtime = start == null ? 0 : Duration.between(start, Instant.now()).toMillis();
        return new Progress(runtime, urls, urlsDone.get(), urlsFailed.get(), snapshotsFetched.get(),
                snapshotsCached.get(), snapshotsFailed.get());
    }

    @Override
    public synchronized void close() {
        if (reportTask != null) {
            reportTask.cancel(false);
            reportTask = null;
        }
        scheduler.shutdownNow();
    }
}
