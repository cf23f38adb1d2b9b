package com.fieldlink.resolver;

/**
 * Thrown when a field id is not routed to any relation. Fails only the current request.
 */
public class UnknownFieldException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public UnknownFieldException(String message) {
        super(message);
    }
}
