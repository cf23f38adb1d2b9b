package com.fieldlink.resolver;

/**
 * Thrown when a resolution stops waiting for its lookups (timeout or interruption).
 */
class ResolutionAbortedException extends RuntimeException {
    ResolutionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
