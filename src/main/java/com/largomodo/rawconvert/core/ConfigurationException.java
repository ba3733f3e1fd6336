package com.largomodo.rawconvert.core;

/**
 * Thrown when a run configuration is malformed (non-numeric fields, non-positive sizes,
 * quality out of range, missing directories).
 * <p>
 * Raised synchronously before a run is started; a batch is never launched with an
 * invalid configuration.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
