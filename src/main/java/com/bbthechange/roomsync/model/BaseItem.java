package com.bbthechange.roomsync.model;

import com.bbthechange.roomsync.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

import java.time.Instant;

/**
 * Base class for items stored in the tenant-scoped chat table.
 * Every item is partitioned by tenant so one tenant's rows are never read through another's key.
 */
@DynamoDbBean
public abstract class BaseItem {

    private String pk;          // TENANT#{tenantId}
    private String sk;          // Item-specific sort key
    private String gsi1pk;      // RoomIndex partition key (reverse lookup by external room id)
    private String itemType;    // Type discriminator
    private Instant createdAt;
    private Instant updatedAt;

    public BaseItem() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @DynamoDbPartitionKey
    public String getPk() {
        return pk;
    }

    public void setPk(String pk) {
        this.pk = pk;
    }

    @DynamoDbSortKey
    public String getSk() {
        return sk;
    }

    public void setSk(String sk) {
        this.sk = sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "RoomIndex")
    public String getGsi1pk() {
        return gsi1pk;
    }

    public void setGsi1pk(String gsi1pk) {
        this.gsi1pk = gsi1pk;
    }

    @DynamoDbAttribute("itemType")
    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Update the updatedAt timestamp to current time.
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }
}
