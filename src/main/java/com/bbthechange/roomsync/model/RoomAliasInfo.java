package com.bbthechange.roomsync.model;

/**
 * Entity identity recovered from a room alias.
 */
public record RoomAliasInfo(EntityType entityType, String entitySlug, String tenantId, String roomAlias) {

    public EntityRef toEntityRef() {
        return new EntityRef(tenantId, entityType, entitySlug);
    }
}
