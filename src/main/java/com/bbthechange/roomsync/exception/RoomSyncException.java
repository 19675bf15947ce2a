package com.bbthechange.roomsync.exception;

import com.bbthechange.roomsync.model.FailureKind;
import org.springframework.http.HttpStatus;

/**
 * Classified failure of a chat room operation.
 * Room lifecycle and permission code only ever let this exception type cross their boundary.
 */
public class RoomSyncException extends RuntimeException {

    private final FailureKind failureKind;

    public RoomSyncException(FailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public RoomSyncException(FailureKind failureKind, String message, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public HttpStatus getHttpStatus() {
        return failureKind.getHttpStatus();
    }

    public boolean isRetryable() {
        return failureKind.isRetryable();
    }

    public static RoomSyncException notFound(String message) {
        return new RoomSyncException(FailureKind.NOT_FOUND, message);
    }

    public static RoomSyncException forbidden(String message) {
        return new RoomSyncException(FailureKind.FORBIDDEN, message);
    }

    public static RoomSyncException transientFailure(String message, Throwable cause) {
        return new RoomSyncException(FailureKind.TRANSIENT, message, cause);
    }

    public static RoomSyncException permissionUnavailable(String message) {
        return new RoomSyncException(FailureKind.PERMISSION_UNAVAILABLE, message);
    }

    /**
     * Map a chat network failure into the four-kind taxonomy.
     * Anything not clearly a missing resource or a privilege problem is treated as retryable.
     */
    public static RoomSyncException fromNetwork(String operation, ChatNetworkException e) {
        return switch (e.getErrorType()) {
            case NOT_FOUND -> new RoomSyncException(FailureKind.NOT_FOUND,
                operation + " failed: resource not found on chat network", e);
            case FORBIDDEN -> new RoomSyncException(FailureKind.PERMISSION_UNAVAILABLE,
                operation + " failed: chat network refused the bot", e);
            default -> new RoomSyncException(FailureKind.TRANSIENT,
                operation + " failed: chat network unavailable, try again later", e);
        };
    }
}
