package com.bbthechange.roomsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic view of what the automation actor can do in a room.
 * Never persisted: power levels can change the instant after this is produced.
 */
@Data
@NoArgsConstructor
public class BotPermissionSnapshot {

    private String roomId;
    private String botUserId;
    private Integer currentPowerLevel;
    private Integer finalPowerLevel;
    private boolean canInvite;
    private boolean canKick;
    private boolean canModifyPowerLevels;
    private boolean fixAttempted;
    private boolean fixSucceeded;
    private boolean networkUnavailable;
    private List<String> errors = new ArrayList<>();
    private Instant checkedAt = Instant.now();

    public BotPermissionSnapshot(String roomId, String botUserId) {
        this.roomId = roomId;
        this.botUserId = botUserId;
    }

    public void addError(String error) {
        errors.add(error);
    }

    /**
     * Kick authority is confirmed by the probe, or inferred from a successful elevation
     * (the heal step only re-probes invites).
     */
    @JsonIgnore
    public boolean isKickAuthorityAvailable() {
        return canKick || (fixAttempted && fixSucceeded);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return canInvite && canKick && errors.isEmpty();
    }
}
