package com.bbthechange.roomsync.exception;

/**
 * Exception thrown when a key component (tenant id, slug, room id) has an invalid shape.
 * Raised by RoomKeyFactory before anything reaches DynamoDB.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
