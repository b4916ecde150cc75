package org.netpreserve.sampler.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.sampler.util.DurationDeserializer;

import java.net.URI;
import java.time.Duration;

/**
 * Where and how to talk to the web archive.
 *
 * @param cdxUrl    CDX index endpoint, e.g. https://web.archive.org/cdx/search/cdx
 * @param replayUrl replay prefix that a timestamp and URL are appended to, e.g. https://web.archive.org/web
 * @param userAgent User-Agent header sent with every request
 * @param timeout   per-request timeout
 * @param pageSize  captures per index request, 0 to fetch everything in one request
 * @param rateLimit global rate limit shared by all workers
 * @param retry     retry policy for transient failures
 */
public record ArchiveConfig(
        URI cdxUrl,
        URI replayUrl,
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int pageSize,
        RateLimitConfig rateLimit,
        RetryConfig retry
) {
    public ArchiveConfig {
        if (cdxUrl == null) throw new IllegalArgumentException("archive.cdxUrl is required");
        if (replayUrl == null) throw new IllegalArgumentException("archive.replayUrl is required");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("archive.userAgent is required");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("archive.timeout must be positive");
        }
        if (pageSize < 0) throw new IllegalArgumentException("archive.pageSize must not be negative");
        if (rateLimit == null) throw new IllegalArgumentException("archive.rateLimit is required");
        if (retry == null) throw new IllegalArgumentException("archive.retry is required");
    }
}
