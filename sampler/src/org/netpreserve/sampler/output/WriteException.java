package org.netpreserve.sampler.output;

import java.io.IOException;

/**
 * Output could not be persisted. Fatal for the run: continuing would silently lose data.
 */
public class WriteException extends IOException {
    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
