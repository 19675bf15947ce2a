package com.bbthechange.roomsync.exception;

/**
 * Exception thrown when a DynamoDB operation on the chat table fails.
 * Wraps SDK exceptions so callers never depend on SDK types.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
