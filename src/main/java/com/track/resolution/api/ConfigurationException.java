package com.track.resolution.api;

/**
 * Thrown when a configuration value is out of range or inconsistent with another.
 * Raised before any track is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
