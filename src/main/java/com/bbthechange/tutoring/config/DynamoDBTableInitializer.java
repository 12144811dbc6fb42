package com.bbthechange.tutoring.config;

import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.util.TutoringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
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
 * Creates the TutoringTable with its two indexes on startup when it is missing.
 * Meant for local DynamoDB; disable with {@code dynamodb.table.init.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        // Session carries every key attribute of the table, so its schema describes both GSIs
        DynamoDbTable<Session> table = dynamoDbEnhancedClient.table(
            TutoringKeyFactory.TABLE_NAME, TableSchema.fromBean(Session.class));

        try {
            table.describeTable();
            logger.info("Table {} already exists", TutoringKeyFactory.TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", TutoringKeyFactory.TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(TutoringKeyFactory.TUTOR_TIME_INDEX),
                    createGSI(TutoringKeyFactory.SUBSCRIPTION_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", TutoringKeyFactory.TABLE_NAME);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", TutoringKeyFactory.TABLE_NAME, e.getMessage());
            throw e;
        }
    }

    private static EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
