package org.athos.core;

import java.io.Serial;

/**
 * Thrown when the YAML configuration file cannot be read or lacks a
 * required entry.
 */
public class ConfigurationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
