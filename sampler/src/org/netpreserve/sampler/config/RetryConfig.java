package org.netpreserve.sampler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sampler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Retry behaviour for archive requests.
 *
 * @param attempts      total attempts including the first one
 * @param backoff       delay before the second attempt, doubled for each further attempt
 * @param maxRetryAfter upper bound on a server supplied Retry-After delay
 */
public record RetryConfig(
        int attempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration backoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxRetryAfter
) {
    public RetryConfig {
        if (attempts <= 0) throw new IllegalArgumentException("retry.attempts must be positive");
        if (backoff == null || backoff.isNegative()) throw new IllegalArgumentException("retry.backoff must not be negative");
        if (maxRetryAfter == null || maxRetryAfter.isNegative()) {
            throw new IllegalArgumentException("retry.maxRetryAfter must not be negative");
        }
    }
}
