package com.ensemblesentinel.core.config;

/**
 * Thrown when a detector or the ensemble is built from invalid parameters.
 *
 * <p>
 * Configuration errors are fatal: they surface at startup and are never
 * recovered from.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
