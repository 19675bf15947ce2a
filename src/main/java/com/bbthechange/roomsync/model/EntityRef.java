package com.bbthechange.roomsync.model;

import java.util.Objects;

/**
 * Tenant-scoped reference to an event or group that owns a chat room.
 * The tenant id is always carried explicitly; nothing looks it up from request context.
 */
public record EntityRef(String tenantId, EntityType entityType, String entitySlug) {

    public EntityRef {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entitySlug, "entitySlug");
    }

    @Override
    public String toString() {
        return entityType.getValue() + "/" + entitySlug + "@" + tenantId;
    }
}
