package org.netpreserve.sampler.archive;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sampler.config.RetryConfig;

import java.time.Duration;

/**
 * Decides whether a failed archive request is retried and how long to wait first.
 *
 * @param attempts      total attempts including the first one
 * @param backoff       delay before the second attempt; doubled for each further attempt
 * @param maxRetryAfter upper bound on a server supplied Retry-After delay
 */
public record RetryPolicy(int attempts, Duration backoff, Duration maxRetryAfter) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60));

    public RetryPolicy {
        if (attempts <= 0) throw new IllegalArgumentException("attempts must be positive");
    }

    public static RetryPolicy of(RetryConfig config) {
        return new RetryPolicy(config.attempts(), config.backoff(), config.maxRetryAfter());
    }

    /**
     * 429 and server errors are worth retrying; any other non-success status is not.
     */
    public static boolean isTransientStatus(int status) {
        return status == 429 || status >= 500;
    }

    /**
     * Delay before the given attempt (2 for the first retry). A Retry-After hint, capped at {@link #maxRetryAfter},
     * can lengthen the backoff but never shorten it.
     */
    public Duration delayBefore(int attempt, @Nullable Duration retryAfter) {
        Duration delay = backoff.multipliedBy(1L << Math.min(30, Math.max(0, attempt - 2)));
        if (retryAfter == null) return delay;
        Duration hinted = retryAfter.compareTo(maxRetryAfter) > 0 ? maxRetryAfter : retryAfter;
        return hinted.compareTo(delay) > 0 ? hinted : delay;
    }
}
