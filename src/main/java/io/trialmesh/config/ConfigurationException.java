package io.trialmesh.config;

/**
 * Raised for invalid simulation configuration. Always thrown before any run row exists.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
