package com.bbthechange.roomsync.model;

import com.bbthechange.roomsync.util.InstantAsLongAttributeConverter;
import com.bbthechange.roomsync.util.RoomKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached mapping from an internal entity to its external chat room.
 * The chat network stays authoritative for whether the room exists; this row is revalidated on every ensure.
 *
 * Key Pattern: PK = TENANT#{tenantId}, SK = ROOM#{entityType}#{entitySlug}
 * GSI Pattern: GSI1PK = CHATROOM#{externalRoomId} (RoomIndex)
 */
@DynamoDbBean
public class RoomRecord extends BaseItem {

    public static final String ITEM_TYPE = "ROOM_RECORD";

    private String tenantId;
    private String entityType;
    private String entitySlug;
    private String externalRoomId;
    private String canonicalAlias;
    private List<String> altAliases;
    private String status;
    private Instant lastVerifiedAt;

    // Default constructor for DynamoDB
    public RoomRecord() {
        super();
        setItemType(ITEM_TYPE);
    }

    public RoomRecord(String tenantId, EntityType entityType, String entitySlug,
                      String externalRoomId, String canonicalAlias) {
        super();
        setItemType(ITEM_TYPE);
        this.tenantId = tenantId;
        this.entityType = entityType.getValue();
        this.entitySlug = entitySlug;
        this.externalRoomId = externalRoomId;
        this.canonicalAlias = canonicalAlias;
        this.altAliases = new ArrayList<>();
        this.status = RoomStatus.ACTIVE.name();
        this.lastVerifiedAt = getCreatedAt();

        setPk(RoomKeyFactory.getTenantPk(tenantId));
        setSk(RoomKeyFactory.getRoomSk(entityType, entitySlug));
        setGsi1pk(RoomKeyFactory.getRoomIndexPk(externalRoomId));
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntitySlug() {
        return entitySlug;
    }

    public void setEntitySlug(String entitySlug) {
        this.entitySlug = entitySlug;
    }

    public String getExternalRoomId() {
        return externalRoomId;
    }

    public void setExternalRoomId(String externalRoomId) {
        this.externalRoomId = externalRoomId;
    }

    public String getCanonicalAlias() {
        return canonicalAlias;
    }

    public void setCanonicalAlias(String canonicalAlias) {
        this.canonicalAlias = canonicalAlias;
    }

    public List<String> getAltAliases() {
        return altAliases;
    }

    public void setAltAliases(List<String> altAliases) {
        this.altAliases = altAliases;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getLastVerifiedAt() {
        return lastVerifiedAt;
    }

    public void setLastVerifiedAt(Instant lastVerifiedAt) {
        this.lastVerifiedAt = lastVerifiedAt;
    }

    @DynamoDbIgnore
    public boolean isRetired() {
        return RoomStatus.RETIRED.name().equals(status);
    }

    /**
     * Point this record at a (possibly different) external room and mark it verified now.
     * Keeps the RoomIndex key in step with the room id.
     */
    public void adoptRoom(String roomId) {
        this.externalRoomId = roomId;
        this.status = RoomStatus.ACTIVE.name();
        this.lastVerifiedAt = Instant.now();
        setGsi1pk(RoomKeyFactory.getRoomIndexPk(roomId));
        touch();
    }

    /**
     * Move this record to a new slug, keeping the previous canonical alias as an alt alias.
     */
    public void repoint(EntityType type, String newSlug, String newAlias) {
        List<String> aliases = altAliases == null ? new ArrayList<>() : new ArrayList<>(altAliases);
        if (canonicalAlias != null && !canonicalAlias.equals(newAlias) && !aliases.contains(canonicalAlias)) {
            aliases.add(canonicalAlias);
        }
        aliases.remove(newAlias);
        this.altAliases = aliases;
        this.canonicalAlias = newAlias;
        this.entitySlug = newSlug;
        this.entityType = type.getValue();
        setSk(RoomKeyFactory.getRoomSk(type, newSlug));
        touch();
    }

    public void retire() {
        this.status = RoomStatus.RETIRED.name();
        touch();
    }
}
