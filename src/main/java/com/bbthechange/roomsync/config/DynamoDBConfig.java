package com.bbthechange.roomsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * Clients for the single chat table and the table's name.
 *
 * Room records, entity rows and membership rows all live in one table, so its name is
 * resolved once here and injected into every repository with {@code @Qualifier(CHAT_TABLE_NAME)}.
 * Setting {@code aws.dynamodb.endpoint} points the client at DynamoDB Local.
 */
@Configuration
public class DynamoDBConfig {

    public static final String CHAT_TABLE_NAME = "chatTableName";

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);
    private static final String LOCAL_CREDENTIAL = "local";

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Value("${dynamodb.table-name:ChatRoomTable}")
    private String tableName;

    @Bean
    @Qualifier(CHAT_TABLE_NAME)
    public String chatTableName() {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalStateException("dynamodb.table-name must not be blank");
        }
        return tableName.trim();
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region));

        if (usesLocalEndpoint()) {
            logger.info("Using DynamoDB Local at {} for table {}", endpoint, tableName);
            builder.endpointOverride(URI.create(endpoint.trim()))
                   .credentialsProvider(StaticCredentialsProvider.create(
                       AwsBasicCredentials.create(LOCAL_CREDENTIAL, LOCAL_CREDENTIAL)
                   ));
        } else {
            logger.info("Using DynamoDB in {} for table {}", region, tableName);
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        return builder.build();
    }

    /**
     * Only the local table initializer needs the enhanced client.
     */
    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    boolean usesLocalEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }
}
