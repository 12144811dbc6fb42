package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.AvailabilityWindow;
import com.bbthechange.tutoring.repository.AvailabilityWindowRepository;
import com.bbthechange.tutoring.util.QueryPerformanceTracker;
import com.bbthechange.tutoring.util.TutoringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Availability windows live in the tutor's partition under WINDOW# sort keys.
 */
@Repository
public class AvailabilityWindowRepositoryImpl implements AvailabilityWindowRepository {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityWindowRepositoryImpl.class);

    private static final String TABLE_NAME = TutoringKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<AvailabilityWindow> windowTable;
    private final TableSchema<AvailabilityWindow> windowSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public AvailabilityWindowRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            DynamoDbEnhancedClient dynamoDbEnhancedClient,
            QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.windowSchema = TableSchema.fromBean(AvailabilityWindow.class);
        this.windowTable = dynamoDbEnhancedClient.table(TABLE_NAME, windowSchema);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public List<AvailabilityWindow> findByTutorId(String tutorId) {
        return performanceTracker.trackQuery("findWindowsByTutor", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :windowPrefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", AttributeValue.builder().s(TutoringKeyFactory.getTutorPk(tutorId)).build(),
                        ":windowPrefix", AttributeValue.builder().s(TutoringKeyFactory.WINDOW_PREFIX + "#").build()
                    ))
                    .build();

                List<AvailabilityWindow> windows = SessionRepositoryImpl.queryAll(dynamoDbClient, request).stream()
                    .map(windowSchema::mapToItem)
                    .collect(Collectors.toList());

                logger.debug("Found {} availability windows for tutor {}", windows.size(), tutorId);
                return windows;

            } catch (DynamoDbException e) {
                logger.error("Failed to query availability windows for tutor {}", tutorId, e);
                throw new RepositoryException("Failed to query availability windows", e);
            }
        });
    }

    @Override
    public Optional<AvailabilityWindow> findById(String tutorId, String windowId) {
        return performanceTracker.trackQuery("findWindowById", TABLE_NAME, () -> {
            try {
                Key key = Key.builder()
                    .partitionValue(TutoringKeyFactory.getTutorPk(tutorId))
                    .sortValue(TutoringKeyFactory.getWindowSk(windowId))
                    .build();
                return Optional.ofNullable(windowTable.getItem(key));

            } catch (DynamoDbException e) {
                logger.error("Failed to find availability window {} for tutor {}", windowId, tutorId, e);
                throw new RepositoryException("Failed to retrieve availability window", e);
            }
        });
    }

    @Override
    public AvailabilityWindow save(AvailabilityWindow window) {
        return performanceTracker.trackQuery("saveWindow", TABLE_NAME, () -> {
            try {
                window.touch();
                windowTable.putItem(window);
                logger.info("Saved availability window {} for tutor {}", window.getWindowId(), window.getTutorId());
                return window;

            } catch (DynamoDbException e) {
                logger.error("Failed to save availability window {}", window.getWindowId(), e);
                throw new RepositoryException("Failed to save availability window", e);
            }
        });
    }

    @Override
    public void delete(String tutorId, String windowId) {
        performanceTracker.trackQuery("deleteWindow", TABLE_NAME, () -> {
            try {
                windowTable.deleteItem(Key.builder()
                    .partitionValue(TutoringKeyFactory.getTutorPk(tutorId))
                    .sortValue(TutoringKeyFactory.getWindowSk(windowId))
                    .build());
                logger.info("Deleted availability window {} for tutor {}", windowId, tutorId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete availability window {}", windowId, e);
                throw new RepositoryException("Failed to delete availability window", e);
            }
        });
    }
}
