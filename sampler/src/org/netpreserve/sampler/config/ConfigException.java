package org.netpreserve.sampler.config;

/**
 * The run configuration or its inputs are invalid. Always fatal: no URLs are processed.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
