package com.bbthechange.roomsync.model;

import com.bbthechange.roomsync.exception.RoomSyncException;

/**
 * Typed outcome of a membership synchronization.
 * Success carries the room and the operation performed; failure carries the kind, the step and,
 * for hierarchy denials, the violated rule.
 */
public final class SyncResult {

    private final boolean success;
    private final String roomId;
    private final MembershipOperation operation;
    private final FailureKind failureKind;
    private final SyncStep failedStep;
    private final HierarchyRule violatedRule;
    private final String message;

    private SyncResult(boolean success, String roomId, MembershipOperation operation,
                       FailureKind failureKind, SyncStep failedStep, HierarchyRule violatedRule, String message) {
        this.success = success;
        this.roomId = roomId;
        this.operation = operation;
        this.failureKind = failureKind;
        this.failedStep = failedStep;
        this.violatedRule = violatedRule;
        this.message = message;
    }

    public static SyncResult success(String roomId, MembershipOperation operation) {
        return new SyncResult(true, roomId, operation, null, null, null, null);
    }

    public static SyncResult forbidden(HierarchyDecision decision) {
        return new SyncResult(false, null, null, FailureKind.FORBIDDEN, SyncStep.AUTHORIZE,
            decision.rule(), decision.message());
    }

    public static SyncResult failure(FailureKind kind, SyncStep step, String roomId, String message) {
        return new SyncResult(false, roomId, null, kind, step, null, message);
    }

    public static SyncResult failure(RoomSyncException e, SyncStep step, String roomId) {
        return failure(e.getFailureKind(), step, roomId, e.getMessage());
    }

    public boolean isSuccess() {
        return success;
    }

    public String getRoomId() {
        return roomId;
    }

    public MembershipOperation getOperation() {
        return operation;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public SyncStep getFailedStep() {
        return failedStep;
    }

    public HierarchyRule getViolatedRule() {
        return violatedRule;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (success) {
            return "SyncResult{success, room=" + roomId + ", operation=" + operation + "}";
        }
        return "SyncResult{failure=" + failureKind + ", step=" + failedStep
            + (violatedRule != null ? ", rule=" + violatedRule : "") + ", message=" + message + "}";
    }
}
