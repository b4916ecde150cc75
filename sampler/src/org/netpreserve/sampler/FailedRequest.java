package org.netpreserve.sampler;

import org.jetbrains.annotations.Nullable;

/**
 * A request that could not be completed. Recorded once and never retried automatically.
 *
 * @param url       the URL that failed
 * @param timestamp capture timestamp for a failed snapshot fetch, null when the whole URL failed
 * @param reason    short description of the failure
 */
public record FailedRequest(String url, @Nullable String timestamp, String reason) {
    public static FailedRequest of(String url, Throwable e) {
        return new FailedRequest(url, null, describe(e));
    }

    public static FailedRequest of(String url, String timestamp, Throwable e) {
        return new FailedRequest(url, timestamp, describe(e));
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) return e.getClass().getSimpleName();
        return message.replaceAll("\\s+", " ");
    }

    public String toLogLine() {
        String target = timestamp == null ? url : url + " @" + timestamp;
        return target + " --> error: " + reason;
    }
}
