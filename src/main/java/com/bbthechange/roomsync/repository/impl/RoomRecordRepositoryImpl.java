package com.bbthechange.roomsync.repository.impl;

import com.bbthechange.roomsync.config.DynamoDBConfig;
import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.RoomRecord;
import com.bbthechange.roomsync.repository.RoomRecordRepository;
import com.bbthechange.roomsync.util.QueryPerformanceTracker;
import com.bbthechange.roomsync.util.RoomKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.Optional;

/**
 * Implementation of RoomRecordRepository using the low-level DynamoDB client with bean table schemas.
 */
@Repository
public class RoomRecordRepositoryImpl implements RoomRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(RoomRecordRepositoryImpl.class);
    private static final String ROOM_INDEX = "RoomIndex";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<RoomRecord> roomRecordSchema;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;

    @Autowired
    public RoomRecordRepositoryImpl(DynamoDbClient dynamoDbClient,
                                    QueryPerformanceTracker queryTracker,
                                    @Qualifier(DynamoDBConfig.CHAT_TABLE_NAME) String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = tableName;
        this.roomRecordSchema = TableSchema.fromBean(RoomRecord.class);
    }

    @Override
    public void save(RoomRecord record) {
        queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(tableName)
                    .item(roomRecordSchema.itemToMap(record, true))
                    .build();

                dynamoDbClient.putItem(request);
                logger.debug("Saved room record {} -> {}", record.getSk(), record.getExternalRoomId());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to save room record {} for tenant {}", record.getSk(), record.getTenantId(), e);
                throw new RepositoryException("Failed to save room record", e);
            }
        });
    }

    @Override
    public Optional<RoomRecord> findByEntity(String tenantId, EntityType entityType, String entitySlug) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getRoomSk(entityType, entitySlug)))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(roomRecordSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find room record for {}/{} in tenant {}", entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to find room record", e);
            }
        });
    }

    @Override
    public Optional<RoomRecord> findByRoomId(String externalRoomId) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(ROOM_INDEX)
                    .keyConditionExpression("gsi1pk = :gsi1pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi1pk", AttributeValue.builder().s(RoomKeyFactory.getRoomIndexPk(externalRoomId)).build()
                    ))
                    .build();

                QueryResponse response = dynamoDbClient.query(request);

                return response.items().stream()
                    .map(roomRecordSchema::mapToItem)
                    .filter(record -> !record.isRetired())
                    .findFirst();

            } catch (DynamoDbException e) {
                logger.error("Failed to find room record by room id: {}", externalRoomId, e);
                throw new RepositoryException("Failed to find room record by room id", e);
            }
        });
    }

    @Override
    public void move(RoomRecord record, EntityType entityType, String previousSlug) {
        queryTracker.trackQuery("TransactWriteItems", tableName, () -> {
            try {
                TransactWriteItem putMoved = TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(tableName)
                        .item(roomRecordSchema.itemToMap(record, true))
                        .build())
                    .build();

                TransactWriteItem deletePrevious = TransactWriteItem.builder()
                    .delete(Delete.builder()
                        .tableName(tableName)
                        .key(key(record.getTenantId(), RoomKeyFactory.getRoomSk(entityType, previousSlug)))
                        .build())
                    .build();

                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(putMoved, deletePrevious)
                    .build());

                logger.info("Moved room record for tenant {} from {} to {}",
                    record.getTenantId(), previousSlug, record.getEntitySlug());
                return null;

            } catch (TransactionCanceledException e) {
                logger.error("Transaction cancelled while moving room record {}: {}",
                    record.getSk(), e.cancellationReasons());
                throw new RepositoryException("Failed to move room record atomically - transaction cancelled", e);
            } catch (DynamoDbException e) {
                logger.error("DynamoDB error while moving room record {}", record.getSk(), e);
                throw new RepositoryException("Failed to move room record due to DynamoDB error", e);
            }
        });
    }

    @Override
    public void delete(String tenantId, EntityType entityType, String entitySlug) {
        queryTracker.trackQuery("DeleteItem", tableName, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(tenantId, RoomKeyFactory.getRoomSk(entityType, entitySlug)))
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.info("Deleted room record for {}/{} in tenant {}", entityType, entitySlug, tenantId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete room record for {}/{} in tenant {}", entityType, entitySlug, tenantId, e);
                throw new RepositoryException("Failed to delete room record", e);
            }
        });
    }

    private static Map<String, AttributeValue> key(String tenantId, String sk) {
        return Map.of(
            "pk", AttributeValue.builder().s(RoomKeyFactory.getTenantPk(tenantId)).build(),
            "sk", AttributeValue.builder().s(sk).build()
        );
    }
}
