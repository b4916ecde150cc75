package org.netpreserve.sampler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sampler.util.DurationDeserializer;

import java.time.Duration;

/**
 * Global limit on calls to the archive.
 *
 * @param calls  maximum number of calls within one period
 * @param period length of the sliding window
 */
public record RateLimitConfig(
        int calls,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration period
) {
    public RateLimitConfig {
        if (calls <= 0) throw new IllegalArgumentException("rateLimit.calls must be positive");
        if (period == null || period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("rateLimit.period must be positive");
        }
    }
}
