package com.fieldlink.config;

/**
 * Thrown when the link schema cannot be read or violates a structural rule.
 * Raised before any relation is connected; the service never starts with an invalid schema.
 */
public class ConfigException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConfigException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
