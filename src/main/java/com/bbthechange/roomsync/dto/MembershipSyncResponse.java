package com.bbthechange.roomsync.dto;

import com.bbthechange.roomsync.model.SyncResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a membership operation. Failures name the kind, the step that failed and,
 * for hierarchy denials, the rule that denied it.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MembershipSyncResponse {

    private boolean success;
    private String roomId;
    private String operation;
    private String failureKind;
    private String failedStep;
    private String violatedRule;
    private String message;

    public MembershipSyncResponse(SyncResult result) {
        this.success = result.isSuccess();
        this.roomId = result.getRoomId();
        this.operation = result.getOperation() != null ? result.getOperation().name() : null;
        this.failureKind = result.getFailureKind() != null ? result.getFailureKind().name() : null;
        this.failedStep = result.getFailedStep() != null ? result.getFailedStep().name() : null;
        this.violatedRule = result.getViolatedRule() != null ? result.getViolatedRule().name() : null;
        this.message = result.getMessage();
    }
}
