package com.fieldlink.relation;

/**
 * Thrown when a relation lookup fails at request time. Fails only the request that issued it.
 */
public class LookupException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public LookupException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
