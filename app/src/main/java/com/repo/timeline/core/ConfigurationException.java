package com.repo.timeline.core;

/**
 * Invalid or conflicting settings. Always raised before any repository is
 * scanned and before the output is opened.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
