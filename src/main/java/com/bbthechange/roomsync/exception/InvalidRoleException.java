package com.bbthechange.roomsync.exception;

/**
 * Exception thrown when a role name is not one of owner, admin, moderator, member or guest.
 */
public class InvalidRoleException extends RuntimeException {

    public InvalidRoleException(String message) {
        super(message);
    }
}
