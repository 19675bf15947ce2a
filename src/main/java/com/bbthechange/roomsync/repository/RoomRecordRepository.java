package com.bbthechange.roomsync.repository;

import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.RoomRecord;

import java.util.Optional;

/**
 * Persisted mapping from a tenant's event or group to its chat room.
 * At most one record exists per (tenant, entity type, slug); saves overwrite in place.
 */
public interface RoomRecordRepository {

    /**
     * Save or overwrite the record for its entity identity.
     */
    void save(RoomRecord record);

    Optional<RoomRecord> findByEntity(String tenantId, EntityType entityType, String entitySlug);

    /**
     * Reverse lookup by external room id (uses RoomIndex GSI). Retired records are ignored.
     */
    Optional<RoomRecord> findByRoomId(String externalRoomId);

    /**
     * Write the record under its current key and remove the row stored under the previous slug,
     * atomically. Used when an entity's slug changes.
     */
    void move(RoomRecord record, EntityType entityType, String previousSlug);

    void delete(String tenantId, EntityType entityType, String entitySlug);
}
