package com.fieldlink.relation;

/**
 * Thrown when a relation's data source cannot be reached while the adapters are built.
 * Fatal: the service does not start.
 */
public class RelationConnectionException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public RelationConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
