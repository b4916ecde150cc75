package org.netpreserve.sampler.archive;

/**
 * Gate in front of every outbound call to the archive. A single instance is shared by all workers.
 */
public interface RateLimiter {
    /**
     * Blocks until the caller may issue one call.
     */
    void acquire() throws InterruptedException;

    /**
     * A limiter that never blocks.
     */
    static RateLimiter unlimited() {
        return () -> {
        };
    }
}
