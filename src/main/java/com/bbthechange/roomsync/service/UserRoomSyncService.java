package com.bbthechange.roomsync.service;

import com.bbthechange.roomsync.model.SyncResult;

import java.util.List;
import java.util.Map;

/**
 * Catches a chat user up with the rooms of every event and group they belong to.
 */
public interface UserRoomSyncService {

    /**
     * React to one event pushed by the homeserver. Only a user's own join triggers a sync;
     * every other event is ignored. Never throws.
     */
    void handleEvent(Map<String, Object> event);

    /**
     * Invite the user into the room of each entity they hold a role in.
     * One result per membership; a failed room does not stop the others.
     */
    List<SyncResult> syncUserRooms(String userId);
}
