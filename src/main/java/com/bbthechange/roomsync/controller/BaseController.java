package com.bbthechange.roomsync.controller;

import com.bbthechange.roomsync.exception.*;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.SyncResult;
import com.bbthechange.roomsync.dto.MembershipSyncResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Base controller with common functionality and error handling.
 * All controllers extend this for consistent error responses and actor extraction.
 */
@RestController
public abstract class BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BaseController.class);

    /**
     * Header carrying the acting user's slug, set by the gateway in front of this service.
     */
    public static final String ACTOR_HEADER = "X-User-Slug";

    protected String extractActorSlug(HttpServletRequest request) {
        String actorSlug = request.getHeader(ACTOR_HEADER);
        if (actorSlug == null || actorSlug.trim().isEmpty()) {
            throw new UnauthorizedException("No acting user");
        }
        return actorSlug.trim();
    }

    protected EntityRef entityRef(String tenantId, String entityType, String slug) {
        EntityType type = EntityType.fromValue(entityType)
            .orElseThrow(() -> new InvalidKeyException("Unknown entity type: " + entityType));
        return new EntityRef(tenantId, type, slug);
    }

    /**
     * Successful syncs answer 200; failures answer with the status of their failure kind.
     */
    protected ResponseEntity<MembershipSyncResponse> toResponse(SyncResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(new MembershipSyncResponse(result));
        }
        return ResponseEntity.status(result.getFailureKind().getHttpStatus())
            .body(new MembershipSyncResponse(result));
    }

    /**
     * Error response DTO for consistent error formatting.
     */
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final long timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = System.currentTimeMillis();
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public long getTimestamp() { return timestamp; }
    }

    // Common exception handlers

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        logger.warn("Unauthorized access attempt: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(new ErrorResponse("UNAUTHORIZED", e.getMessage()));
    }

    @ExceptionHandler(RoomSyncException.class)
    public ResponseEntity<ErrorResponse> handleRoomSync(RoomSyncException e) {
        if (e.isRetryable()) {
            logger.warn("Chat room operation failed transiently: {}", e.getMessage());
        } else {
            logger.info("Chat room operation failed ({}): {}", e.getFailureKind(), e.getMessage());
        }
        return ResponseEntity.status(e.getHttpStatus())
            .body(new ErrorResponse(e.getFailureKind().name(), e.getMessage()));
    }

    @ExceptionHandler(InvalidRoleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRole(InvalidRoleException e) {
        logger.warn("Invalid role: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("INVALID_ROLE", e.getMessage()));
    }

    @ExceptionHandler(RepositoryException.class)
    public ResponseEntity<ErrorResponse> handleRepository(RepositoryException e) {
        logger.error("Repository error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("REPOSITORY_ERROR", "Internal server error"));
    }

    @ExceptionHandler(InvalidKeyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidKey(InvalidKeyException e) {
        logger.warn("Invalid key format: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("INVALID_KEY", e.getMessage()));
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(jakarta.validation.ConstraintViolationException e) {
        logger.warn("Validation constraint violation: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Invalid input parameters"));
    }

    @ExceptionHandler(org.springframework.web.bind.MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(org.springframework.web.bind.MethodArgumentNotValidException e) {
        logger.warn("Method argument validation error: {}", e.getMessage());
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid input");
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
