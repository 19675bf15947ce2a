package com.bbthechange.roomsync.util;

import com.bbthechange.roomsync.exception.InvalidKeyException;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.EntityType;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the tenant-scoped chat table.
 * Also owns the identifier shapes shared with the alias format, so a value that is
 * a valid key component is always a valid alias component and vice versa.
 */
public final class RoomKeyFactory {

    private static final String DELIMITER = "#";

    /** Tenant ids never contain the alias delimiter, which is what makes last-segment parsing safe. */
    public static final Pattern TENANT_ID_PATTERN = Pattern.compile("[a-z0-9]+");

    /** Lowercase slug, may contain hyphens but not at either end. */
    public static final Pattern SLUG_PATTERN = Pattern.compile("[a-z0-9](?:[a-z0-9._-]*[a-z0-9._])?");

    public static final String TENANT_PREFIX = "TENANT";
    public static final String ROOM_PREFIX = "ROOM";
    public static final String CHATROOM_PREFIX = "CHATROOM";
    public static final String EVENT_PREFIX = "EVENT";
    public static final String GROUP_PREFIX = "GROUP";
    public static final String MEMBER_PREFIX = "MEMBER";

    private RoomKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean isValidTenantId(String tenantId) {
        return tenantId != null && TENANT_ID_PATTERN.matcher(tenantId).matches();
    }

    public static boolean isValidSlug(String slug) {
        return slug != null && SLUG_PATTERN.matcher(slug).matches();
    }

    private static void validateTenantId(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidKeyException("Tenant ID cannot be null or empty");
        }
        if (!isValidTenantId(tenantId)) {
            throw new InvalidKeyException("Invalid tenant ID format: " + tenantId);
        }
    }

    private static void validateSlug(String slug, String type) {
        if (slug == null || slug.isBlank()) {
            throw new InvalidKeyException(type + " slug cannot be null or empty");
        }
        if (!isValidSlug(slug)) {
            throw new InvalidKeyException("Invalid " + type + " slug format: " + slug);
        }
    }

    private static void validateEntityType(EntityType entityType) {
        if (entityType == null) {
            throw new InvalidKeyException("Entity type cannot be null");
        }
    }

    public static String getTenantPk(String tenantId) {
        validateTenantId(tenantId);
        return TENANT_PREFIX + DELIMITER + tenantId;
    }

    /**
     * Sort key of the room mapping for an entity: ROOM#{type}#{slug}.
     */
    public static String getRoomSk(EntityType entityType, String entitySlug) {
        validateEntityType(entityType);
        validateSlug(entitySlug, "Entity");
        return ROOM_PREFIX + DELIMITER + entityType.getValue() + DELIMITER + entitySlug;
    }

    public static String getRoomIndexPk(String externalRoomId) {
        if (externalRoomId == null || externalRoomId.isBlank()) {
            throw new InvalidKeyException("External room ID cannot be null or empty");
        }
        return CHATROOM_PREFIX + DELIMITER + externalRoomId;
    }

    /**
     * Sort key of the entity row written by the events/groups subsystem: EVENT#{slug} or GROUP#{slug}.
     */
    public static String getEntitySk(EntityType entityType, String entitySlug) {
        validateEntityType(entityType);
        validateSlug(entitySlug, "Entity");
        return entityPrefix(entityType) + DELIMITER + entitySlug;
    }

    public static String getMemberSk(EntityType entityType, String entitySlug, String userSlug) {
        validateSlug(userSlug, "User");
        return getEntitySk(entityType, entitySlug) + DELIMITER + MEMBER_PREFIX + DELIMITER + userSlug;
    }

    public static boolean isRoomItem(String sk) {
        return sk != null && sk.startsWith(ROOM_PREFIX + DELIMITER);
    }

    /**
     * Owning entity of a membership sort key, empty for any other key.
     */
    public static Optional<EntityRef> parseMemberSk(String tenantId, String sk) {
        if (sk == null) {
            return Optional.empty();
        }
        String[] parts = sk.split(DELIMITER, -1);
        if (parts.length != 4 || !MEMBER_PREFIX.equals(parts[2]) || !isValidSlug(parts[1])) {
            return Optional.empty();
        }
        EntityType entityType;
        if (EVENT_PREFIX.equals(parts[0])) {
            entityType = EntityType.EVENT;
        } else if (GROUP_PREFIX.equals(parts[0])) {
            entityType = EntityType.GROUP;
        } else {
            return Optional.empty();
        }
        return Optional.of(new EntityRef(tenantId, entityType, parts[1]));
    }

    private static String entityPrefix(EntityType entityType) {
        return entityType == EntityType.EVENT ? EVENT_PREFIX : GROUP_PREFIX;
    }
}
