package com.bbthechange.roomsync.repository.impl;

import com.bbthechange.roomsync.config.DynamoDBConfig;
import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.model.EntityMembership;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.MemberRole;
import com.bbthechange.roomsync.repository.EntityDirectory;
import com.bbthechange.roomsync.util.QueryPerformanceTracker;
import com.bbthechange.roomsync.util.RoomKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entity and membership lookups against the rows written by the events/groups subsystem.
 *
 * Entity row:     PK = TENANT#{tenantId}, SK = EVENT#{slug} | GROUP#{slug}
 * Membership row: PK = TENANT#{tenantId}, SK = EVENT#{slug}#MEMBER#{userSlug}, attributes role and userSlug
 */
@Repository
public class DynamoEntityDirectory implements EntityDirectory {

    private static final Logger logger = LoggerFactory.getLogger(DynamoEntityDirectory.class);
    private static final String ROLE_ATTRIBUTE = "role";
    private static final String USER_ATTRIBUTE = "userSlug";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;

    @Autowired
    public DynamoEntityDirectory(DynamoDbClient dynamoDbClient,
                                 QueryPerformanceTracker queryTracker,
                                 @Qualifier(DynamoDBConfig.CHAT_TABLE_NAME) String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = tableName;
    }

    @Override
    public boolean entityExists(String tenantId, EntityType entityType, String entitySlug) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getEntitySk(entityType, entitySlug)))
                    .projectionExpression("pk")
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                return response.hasItem() && !response.item().isEmpty();

            } catch (DynamoDbException e) {
                logger.error("Failed to check existence of {}/{} in tenant {}", entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to check entity existence", e);
            }
        });
    }

    @Override
    public Optional<MemberRole> findMemberRole(String tenantId, EntityType entityType,
                                               String entitySlug, String userSlug) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getMemberSk(entityType, entitySlug, userSlug)))
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || !response.item().containsKey(ROLE_ATTRIBUTE)) {
                    return Optional.empty();
                }

                String roleName = response.item().get(ROLE_ATTRIBUTE).s();
                Optional<MemberRole> role = MemberRole.fromName(roleName);
                if (role.isEmpty()) {
                    logger.warn("Ignoring unrecognized role '{}' for {} in {}/{} (tenant {})",
                        roleName, userSlug, entityType, entitySlug, tenantId);
                }
                return role;

            } catch (DynamoDbException e) {
                logger.error("Failed to find role of {} in {}/{} (tenant {})", userSlug, entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to find member role", e);
            }
        });
    }

    @Override
    public void recordMemberRole(String tenantId, EntityType entityType, String entitySlug,
                                 String userSlug, MemberRole role) {
        queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getMemberSk(entityType, entitySlug, userSlug)))
                    .updateExpression("SET #role = :role, userSlug = :user, updatedAt = :updated")
                    .expressionAttributeNames(Map.of("#role", ROLE_ATTRIBUTE))
                    .expressionAttributeValues(Map.of(
                        ":role", AttributeValue.builder().s(role.getRoleName()).build(),
                        ":user", AttributeValue.builder().s(userSlug).build(),
                        ":updated", AttributeValue.builder().n(String.valueOf(System.currentTimeMillis())).build()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                logger.info("Recorded role {} for {} in {}/{} (tenant {})", role, userSlug, entityType, entitySlug, tenantId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to record role of {} in {}/{} (tenant {})", userSlug, entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to record member role", e);
            }
        });
    }

    @Override
    public void removeMember(String tenantId, EntityType entityType, String entitySlug, String userSlug) {
        queryTracker.trackQuery("DeleteItem", tableName, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getMemberSk(entityType, entitySlug, userSlug)))
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.info("Removed {} from {}/{} (tenant {})", userSlug, entityType, entitySlug, tenantId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to remove {} from {}/{} (tenant {})", userSlug, entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to remove member", e);
            }
        });
    }

    @Override
    public List<EntityMembership> findMemberships(String tenantId, String userSlug) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                List<EntityMembership> memberships = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryRequest request = QueryRequest.builder()
                        .tableName(tableName)
                        .keyConditionExpression("pk = :pk")
                        .filterExpression("userSlug = :user AND attribute_exists(#role)")
                        .expressionAttributeNames(Map.of("#role", ROLE_ATTRIBUTE))
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(RoomKeyFactory.getTenantPk(tenantId)).build(),
                            ":user", AttributeValue.builder().s(userSlug).build()
                        ))
                        .exclusiveStartKey(startKey)
                        .build();

                    QueryResponse response = dynamoDbClient.query(request);
                    for (Map<String, AttributeValue> item : response.items()) {
                        toMembership(tenantId, userSlug, item).ifPresent(memberships::add);
                    }
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
                } while (startKey != null);

                logger.debug("Found {} memberships of {} in tenant {}", memberships.size(), userSlug, tenantId);
                return memberships;

            } catch (DynamoDbException e) {
                logger.error("Failed to list memberships of {} in tenant {}", userSlug, tenantId, e);
                throw new RepositoryException("Failed to list memberships", e);
            }
        });
    }

    private static Optional<EntityMembership> toMembership(String tenantId, String userSlug,
                                                           Map<String, AttributeValue> item) {
        Optional<EntityRef> entity = RoomKeyFactory.parseMemberSk(tenantId, item.get("sk").s());
        Optional<MemberRole> role = MemberRole.fromName(item.get(ROLE_ATTRIBUTE).s());
        if (entity.isEmpty() || role.isEmpty()) {
            logger.warn("Skipping unreadable membership row {} of {} in tenant {}", item.get("sk").s(), userSlug, tenantId);
            return Optional.empty();
        }
        return Optional.of(new EntityMembership(entity.get(), userSlug, role.get()));
    }

    private static Map<String, AttributeValue> key(String tenantId, String sk) {
        return Map.of(
            "pk", AttributeValue.builder().s(RoomKeyFactory.getTenantPk(tenantId)).build(),
            "sk", AttributeValue.builder().s(sk).build()
        );
    }
}
