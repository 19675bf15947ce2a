package com.bbthechange.roomsync.service;

import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.RoomHandle;
import com.bbthechange.roomsync.model.RoomRecord;

import java.util.Optional;

/**
 * Keeps every event and group paired with exactly one chat room.
 * The chat network decides whether a room exists; the stored record is only a cache.
 * All failures leave as {@link com.bbthechange.roomsync.exception.RoomSyncException}.
 */
public interface RoomLifecycleManager {

    /**
     * Return the room for an entity, creating it when the network has none.
     * Safe to call concurrently for the same entity: all callers converge on one room.
     */
    RoomHandle ensure(String tenantId, EntityType entityType, String entitySlug);

    /**
     * Ensure the room addressed by a federation alias. Aliases outside the tenant namespace
     * or this server are reported as not found.
     */
    RoomHandle ensureByAlias(String alias);

    /**
     * Move an entity's room to a new slug. The room keeps its id and members; the new alias
     * becomes canonical and the old one stays resolvable as an alt alias.
     */
    RoomHandle changeSlug(String tenantId, EntityType entityType, String oldSlug, String newSlug);

    /**
     * Mark the room record retired after the entity was deleted. The room itself is left alone.
     */
    void retire(String tenantId, EntityType entityType, String entitySlug);

    Optional<RoomRecord> findRoom(String tenantId, EntityType entityType, String entitySlug);
}
