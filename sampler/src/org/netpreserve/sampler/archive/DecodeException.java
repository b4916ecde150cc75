package org.netpreserve.sampler.archive;

/**
 * The snapshot was fetched but its bytes could not be read as text.
 */
public class DecodeException extends FetchException {
    public DecodeException(String url, String timestamp, String message, Throwable cause) {
        super(url, timestamp, "decode", message, cause);
    }
}
