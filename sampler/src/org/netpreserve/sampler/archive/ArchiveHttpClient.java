package org.netpreserve.sampler.archive;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Issues GET requests to the archive. Every attempt passes through the shared {@link RateLimiter} and transient
 * failures are retried according to the {@link RetryPolicy}.
 */
public class ArchiveHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ArchiveHttpClient.class);
    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final String userAgent;
    private final Duration timeout;

    public ArchiveHttpClient(HttpClient httpClient, RateLimiter rateLimiter, RetryPolicy retryPolicy,
                             String userAgent, Duration timeout) {
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    /**
     * Fetches the URI, returning the first 2xx response.
     *
     * @throws RequestFailedException if a non-transient failure occurs or all attempts fail
     */
    public HttpResponse<byte[]> get(URI uri) throws RequestFailedException, InterruptedException {
        var request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        RequestFailedException failure = null;
        for (int attempt = 1; attempt <= retryPolicy.attempts(); attempt++) {
            if (failure != null) {
                Duration delay = retryPolicy.delayBefore(attempt, failure.retryAfter());
                log.debug("Retrying {} in {} ms (attempt {} of {})", uri, delay.toMillis(), attempt,
                        retryPolicy.attempts());
                Thread.sleep(delay.toMillis());
            }
            rateLimiter.acquire();
            try {
                var response = httpClient.send(request, BodyHandlers.ofByteArray());
                int status = response.statusCode();
                log.trace("GET {} -> {} ({} bytes)", uri, status, response.body().length);
                if (status >= 200 && status < 300) {
                    return response;
                }
                failure = new RequestFailedException(uri, status, parseRetryAfter(
                        response.headers().firstValue("Retry-After").orElse(null)));
            } catch (IOException e) {
                failure = new RequestFailedException(uri, e);
            }
            if (!failure.isTransient()) {
                throw failure;
            }
            log.atWarn().addKeyValue("uri", uri)
                    .addKeyValue("attempt", attempt)
                    .log("Transient archive failure: {}", failure.getMessage());
        }
        throw failure;
    }

    /**
     * Parses a Retry-After header given either as delta-seconds or as an HTTP date.
     */
    static @Nullable Duration parseRetryAfter(@Nullable String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            try {
                var date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delay = Duration.between(ZonedDateTime.now(date.getZone()), date);
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException e2) {
                log.debug("Ignoring unparsable Retry-After header: {}", value);
                return null;
            }
        }
    }
}
