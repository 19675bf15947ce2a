package com.bbthechange.roomsync.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for the chat table that holds room mappings.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient,
                                   @Qualifier(DynamoDBConfig.CHAT_TABLE_NAME) String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            );
            TableStatus status = response.table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("table", tableName)
                    .withDetail("gsiCount", response.table().globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("status", status.toString())
                .withDetail("reason", "Chat table not active")
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
