package com.bbthechange.roomsync.exception;

/**
 * Exception thrown by the chat network client.
 * The error type classifies the homeserver response so callers never string-match messages.
 */
public class ChatNetworkException extends RuntimeException {

    private final ErrorType errorType;
    private final int statusCode;
    private final String errcode;

    public enum ErrorType {
        /**
         * Room, alias or user does not exist (M_NOT_FOUND, HTTP 404).
         */
        NOT_FOUND(false),

        /**
         * Alias already mapped to a room (M_ROOM_IN_USE).
         */
        ROOM_IN_USE(false),

        /**
         * Target is not a member of the room (kick of a non-member).
         */
        NOT_MEMBER(false),

        /**
         * Target is already joined or invited.
         */
        ALREADY_MEMBER(false),

        /**
         * Caller lacks the power level for the action (M_FORBIDDEN).
         */
        FORBIDDEN(false),

        /**
         * Request rejected as malformed (HTTP 400 other than the cases above).
         */
        BAD_REQUEST(false),

        /**
         * Rate limited after retries were exhausted (M_LIMIT_EXCEEDED, HTTP 429).
         */
        RATE_LIMITED(true),

        /**
         * Call exceeded its deadline.
         */
        TIMEOUT(true),

        /**
         * Homeserver unreachable or returned a server error.
         */
        UNAVAILABLE(true);

        private final boolean transientFailure;

        ErrorType(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    public ChatNetworkException(ErrorType errorType, int statusCode, String errcode, String message) {
        super(message);
        this.errorType = errorType;
        this.statusCode = statusCode;
        this.errcode = errcode;
    }

    public ChatNetworkException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = 0;
        this.errcode = null;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrcode() {
        return errcode;
    }

    public boolean isTransient() {
        return errorType.isTransient();
    }

    public static ChatNetworkException timeout(String operation, Throwable cause) {
        return new ChatNetworkException(ErrorType.TIMEOUT, operation + " timed out", cause);
    }

    public static ChatNetworkException unavailable(String operation, Throwable cause) {
        return new ChatNetworkException(ErrorType.UNAVAILABLE, "Chat network unavailable during " + operation, cause);
    }
}
