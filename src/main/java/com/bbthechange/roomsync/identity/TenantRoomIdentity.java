package com.bbthechange.roomsync.identity;

import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.InvalidKeyException;
import com.bbthechange.roomsync.model.ChatUserInfo;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.RoomAliasInfo;
import com.bbthechange.roomsync.util.RoomKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps tenant-scoped entities and users to chat network identifiers and back.
 *
 * Room alias:  #{entityType}-{entitySlug}-{tenantId}:{serverName}
 * User id:     @{userSlug}-{tenantId}:{serverName}
 *
 * Parsing is the only tenant boundary for federation callbacks, so it fails closed: any
 * identifier that does not match the exact shape and server name resolves to empty.
 * The tenant id is always the last hyphen-separated segment of the localpart; tenant ids
 * cannot contain hyphens, so a slug can never smuggle in another tenant's id.
 */
@Component
public class TenantRoomIdentity {

    private static final Logger logger = LoggerFactory.getLogger(TenantRoomIdentity.class);

    private static final char ALIAS_SIGIL = '#';
    private static final char USER_SIGIL = '@';
    private static final char SEGMENT_DELIMITER = '-';
    private static final char DOMAIN_DELIMITER = ':';
    private static final int MAX_IDENTIFIER_LENGTH = 255;

    private final String serverName;
    private final String botUsername;

    @Autowired
    public TenantRoomIdentity(MatrixProperties properties) {
        this(properties.getServerName(), properties.getBotUsername());
    }

    public TenantRoomIdentity(String serverName, String botUsername) {
        this.serverName = serverName;
        this.botUsername = botUsername;
    }

    public String getServerName() {
        return serverName;
    }

    /**
     * Build the room alias for an entity.
     *
     * @throws InvalidKeyException if the tenant id or slug has an invalid shape
     */
    public String buildAlias(String tenantId, EntityType entityType, String entitySlug) {
        return ALIAS_SIGIL + aliasLocalpart(tenantId, entityType, entitySlug) + DOMAIN_DELIMITER + serverName;
    }

    /**
     * Localpart of the alias, as passed to room creation (room_alias_name).
     */
    public String aliasLocalpart(String tenantId, EntityType entityType, String entitySlug) {
        requireTenantId(tenantId);
        requireSlug(entitySlug);
        if (entityType == null) {
            throw new InvalidKeyException("Entity type cannot be null");
        }
        return entityType.getValue() + SEGMENT_DELIMITER + entitySlug + SEGMENT_DELIMITER + tenantId;
    }

    /**
     * Parse a room alias. Never throws.
     */
    public Optional<RoomAliasInfo> parseAlias(String alias) {
        Optional<String> localpart = localpartOf(alias, ALIAS_SIGIL);
        if (localpart.isEmpty()) {
            logger.debug("Rejecting room alias with unexpected shape or domain: {}", alias);
            return Optional.empty();
        }

        String value = localpart.get();
        int typeEnd = value.indexOf(SEGMENT_DELIMITER);
        if (typeEnd <= 0) {
            return Optional.empty();
        }

        Optional<EntityType> entityType = EntityType.fromValue(value.substring(0, typeEnd));
        if (entityType.isEmpty()) {
            logger.debug("Rejecting room alias with unknown entity type: {}", alias);
            return Optional.empty();
        }

        return splitSlugAndTenant(value.substring(typeEnd + 1))
            .map(parts -> new RoomAliasInfo(entityType.get(), parts[0], parts[1], alias));
    }

    public String buildUserId(String tenantId, String userSlug) {
        requireTenantId(tenantId);
        requireSlug(userSlug);
        return USER_SIGIL + userSlug + SEGMENT_DELIMITER + tenantId + DOMAIN_DELIMITER + serverName;
    }

    /**
     * Parse a user id in the tenant namespace. Never throws.
     */
    public Optional<ChatUserInfo> parseUserId(String userId) {
        return localpartOf(userId, USER_SIGIL)
            .flatMap(this::splitSlugAndTenant)
            .map(parts -> new ChatUserInfo(parts[0], parts[1], userId));
    }

    /**
     * The automation actor administering a tenant's rooms.
     */
    public String botUserId(String tenantId) {
        return buildUserId(tenantId, botUsername);
    }

    /**
     * Normalise a free-form slug into the alias character set: lowercase letters, digits,
     * dots, underscores and single inner hyphens.
     */
    public static String sanitizeSlug(String slug) {
        if (slug == null) {
            return "";
        }
        return slug.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9._-]", "-")
            .replaceAll("-{2,}", "-")
            .replaceAll("^-+|-+$", "");
    }

    private Optional<String> localpartOf(String identifier, char sigil) {
        if (identifier == null || identifier.length() < 2 || identifier.length() > MAX_IDENTIFIER_LENGTH) {
            return Optional.empty();
        }
        if (identifier.charAt(0) != sigil) {
            return Optional.empty();
        }
        int domainStart = identifier.indexOf(DOMAIN_DELIMITER);
        if (domainStart < 0) {
            return Optional.empty();
        }
        String domain = identifier.substring(domainStart + 1);
        if (!serverName.equals(domain)) {
            return Optional.empty();
        }
        String localpart = identifier.substring(1, domainStart);
        return localpart.isEmpty() ? Optional.empty() : Optional.of(localpart);
    }

    private Optional<String[]> splitSlugAndTenant(String value) {
        int tenantStart = value.lastIndexOf(SEGMENT_DELIMITER);
        if (tenantStart <= 0 || tenantStart == value.length() - 1) {
            return Optional.empty();
        }
        String slug = value.substring(0, tenantStart);
        String tenantId = value.substring(tenantStart + 1);
        if (!RoomKeyFactory.isValidTenantId(tenantId) || !RoomKeyFactory.isValidSlug(slug)) {
            return Optional.empty();
        }
        return Optional.of(new String[]{slug, tenantId});
    }

    private static void requireTenantId(String tenantId) {
        if (!RoomKeyFactory.isValidTenantId(tenantId)) {
            throw new InvalidKeyException("Invalid tenant ID format: " + tenantId);
        }
    }

    private static void requireSlug(String slug) {
        if (!RoomKeyFactory.isValidSlug(slug)) {
            throw new InvalidKeyException("Invalid slug format: " + slug);
        }
    }
}
