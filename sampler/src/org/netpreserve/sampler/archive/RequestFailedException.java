package org.netpreserve.sampler.archive;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * An archive request that failed, either with a non-success status or without any response.
 */
public class RequestFailedException extends IOException {
    private final URI uri;
    private final int status;
    private final boolean transientFailure;
    private final Duration retryAfter;

    public RequestFailedException(URI uri, int status, @Nullable Duration retryAfter) {
        super("HTTP " + status + " from " + uri);
        this.uri = uri;
        this.status = status;
        this.transientFailure = RetryPolicy.isTransientStatus(status);
        this.retryAfter = retryAfter;
    }

    public RequestFailedException(URI uri, IOException cause) {
        super(cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage())
              + " from " + uri, cause);
        this.uri = uri;
        this.status = -1;
        this.transientFailure = true;
        this.retryAfter = null;
    }

    public URI uri() {
        return uri;
    }

    /**
     * HTTP status code, or -1 if no response was received.
     */
    public int status() {
        return status;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public @Nullable Duration retryAfter() {
        return retryAfter;
    }
}
