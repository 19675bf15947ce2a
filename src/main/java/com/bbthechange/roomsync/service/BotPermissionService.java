package com.bbthechange.roomsync.service;

import com.bbthechange.roomsync.model.BotPermissionSnapshot;

/**
 * Checks what the tenant's bot can actually do in a room and repairs lost privileges.
 */
public interface BotPermissionService {

    /**
     * Probe invite and kick authority, elevate the bot if either is missing, then report.
     * Never throws: every failed step is recorded in the snapshot's errors.
     *
     * @param probeUserId user the invite probe targets; inviting an existing member counts as success
     */
    BotPermissionSnapshot diagnose(String tenantId, String roomId, String probeUserId);

    /**
     * Raise the bot to the admin power level, preserving every other user's level.
     *
     * @return true if the power levels were written
     */
    boolean heal(String tenantId, String roomId);
}
