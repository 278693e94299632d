package com.releasewatch.service.config;

/**
 * Configuration is missing or invalid. Fatal at startup.
 */
public class ConfigException extends IllegalStateException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
