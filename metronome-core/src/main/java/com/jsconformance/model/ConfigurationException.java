package com.jsconformance.model;

/**
 * An impossible or unsupported configuration. Unrecoverable: the whole run stops.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
