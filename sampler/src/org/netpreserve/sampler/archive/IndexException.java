package org.netpreserve.sampler.archive;

/**
 * The index could not be queried for a URL.
 */
public class IndexException extends Exception {
    private final String url;

    public IndexException(String url, String message) {
        super(message);
        this.url = url;
    }

    public IndexException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
