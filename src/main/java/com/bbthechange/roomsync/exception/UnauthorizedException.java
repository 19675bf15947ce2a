package com.bbthechange.roomsync.exception;

/**
 * Exception thrown when a request carries no usable actor identity.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
