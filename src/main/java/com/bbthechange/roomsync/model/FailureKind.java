package com.bbthechange.roomsync.model;

import org.springframework.http.HttpStatus;

/**
 * Classification every chat room failure is mapped into before it leaves the core.
 */
public enum FailureKind {

    /**
     * Entity or room does not exist. Not retryable.
     */
    NOT_FOUND(HttpStatus.NOT_FOUND, false),

    /**
     * Role hierarchy violation. Not retryable.
     */
    FORBIDDEN(HttpStatus.FORBIDDEN, false),

    /**
     * Chat network unreachable, timed out or rate limited. Retry with backoff.
     */
    TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE, true),

    /**
     * Bot lacks room privileges and could not regain them. Needs operator attention.
     */
    PERMISSION_UNAVAILABLE(HttpStatus.CONFLICT, false);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    FailureKind(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
