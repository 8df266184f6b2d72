package com.jay.mfses.config;

/**
 * Broken scoring configuration: a weight vector that does not sum to 1.0, an unsorted or
 * non-monotonic breakpoint table, an out-of-range score or an unusable formula constant.
 * Raised while the configuration is being built and treated as fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
