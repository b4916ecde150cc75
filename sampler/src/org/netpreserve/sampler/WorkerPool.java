package org.netpreserve.sampler;

import org.netpreserve.sampler.output.FailureSink;
import org.netpreserve.sampler.output.WriteException;
import org.netpreserve.sampler.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one task per URL on a fixed number of named worker threads.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private final ExecutorService executor;
    private final int workers;
    private final FailureSink failureSink;
    private final ProgressTracker progress;

    public WorkerPool(int workers, FailureSink failureSink, ProgressTracker progress) {
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive");
        this.workers = workers;
        this.executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("sampler-worker"));
        this.failureSink = failureSink;
        this.progress = progress;
    }

    @FunctionalInterface
    public interface Task {
        void process(UrlTask task) throws Exception;
    }

    /**
     * Runs the handler for every task and waits for all of them to finish. Exceptions escaping a task are recorded
     * as failures of that URL, except for write failures which abort the whole run.
     *
     * @throws WriteException if the dataset could not be written; remaining tasks are cancelled
     */
    public void run(List<UrlTask> tasks, Task handler) throws WriteException, InterruptedException {
        log.info("Processing {} URLs with {} workers", tasks.size(), workers);
        CompletionService<UrlTask> completionService = new ExecutorCompletionService<>(executor);
        for (UrlTask task : tasks) {
            completionService.submit(() -> {
                try {
                    handler.process(task);
                } catch (WriteException | InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    log.error("Unexpected error processing {}", task.resolvedUrl(), e);
                    failureSink.record(FailedRequest.of(task.resolvedUrl(), e));
                    progress.urlFailed();
                }
                return task;
            });
        }
        for (int i = 0; i < tasks.size(); i++) {
            try {
                completionService.take().get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof WriteException writeException) {
                    log.error("Aborting run, failed to write output", writeException);
                    executor.shutdownNow();
                    throw writeException;
                }
                log.debug("Task interrupted", e.getCause());
            }
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not terminate within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
