package org.netpreserve.sampler.archive;

/**
 * A single snapshot could not be fetched.
 */
public class FetchException extends Exception {
    private final String url;
    private final String timestamp;
    private final String reason;

    public FetchException(String url, String timestamp, String reason, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.timestamp = timestamp;
        this.reason = reason;
    }

    public String url() {
        return url;
    }

    public String timestamp() {
        return timestamp;
    }

    /**
     * Short machine friendly category, e.g. "http", "network" or "decode".
     */
    public String reason() {
        return reason;
    }
}
