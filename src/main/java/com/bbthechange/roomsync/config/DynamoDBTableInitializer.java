package com.bbthechange.roomsync.config;

import com.bbthechange.roomsync.model.RoomRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the chat table with its RoomIndex GSI when running against DynamoDB Local.
 * Disabled in deployed environments, where the table is provisioned by infrastructure.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true")
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final String tableName;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    @Qualifier(DynamoDBConfig.CHAT_TABLE_NAME) String tableName) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.tableName = tableName;
    }

    @Override
    public void run(ApplicationArguments args) {
        DynamoDbTable<RoomRecord> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(RoomRecord.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(EnhancedGlobalSecondaryIndex.builder()
                    .indexName("RoomIndex")
                    .provisionedThroughput(throughput())
                    .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
                    .build())
                .build());
            logger.info("Table {} created with RoomIndex", tableName);
        }
    }

    private ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
