package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.Interval;
import com.bbthechange.tutoring.model.TimeBlock;
import com.bbthechange.tutoring.repository.TimeBlockRepository;
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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Time blocks live in the tutor's partition under BLOCK# sort keys.
 * A tutor has few of them, so range filtering happens after the query.
 */
@Repository
public class TimeBlockRepositoryImpl implements TimeBlockRepository {

    private static final Logger logger = LoggerFactory.getLogger(TimeBlockRepositoryImpl.class);

    private static final String TABLE_NAME = TutoringKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<TimeBlock> blockTable;
    private final TableSchema<TimeBlock> blockSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public TimeBlockRepositoryImpl(
            DynamoDbClient dynamoDbClient,
            DynamoDbEnhancedClient dynamoDbEnhancedClient,
            QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.blockSchema = TableSchema.fromBean(TimeBlock.class);
        this.blockTable = dynamoDbEnhancedClient.table(TABLE_NAME, blockSchema);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public List<TimeBlock> findOverlapping(String tutorId, long from, long to) {
        if (to <= from) {
            return List.of();
        }
        return performanceTracker.trackQuery("findTimeBlocks", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :blockPrefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", AttributeValue.builder().s(TutoringKeyFactory.getTutorPk(tutorId)).build(),
                        ":blockPrefix", AttributeValue.builder().s(TutoringKeyFactory.BLOCK_PREFIX + "#").build()
                    ))
                    .build();

                Interval range = Interval.of(from, to);
                return SessionRepositoryImpl.queryAll(dynamoDbClient, request).stream()
                    .map(blockSchema::mapToItem)
                    .filter(block -> block.getInterval().overlaps(range))
                    .sorted(Comparator.comparing(TimeBlock::getStartTime))
                    .collect(Collectors.toList());

            } catch (DynamoDbException e) {
                logger.error("Failed to query time blocks for tutor {}", tutorId, e);
                throw new RepositoryException("Failed to query time blocks", e);
            }
        });
    }

    @Override
    public Optional<TimeBlock> findById(String tutorId, String blockId) {
        return performanceTracker.trackQuery("findTimeBlockById", TABLE_NAME, () -> {
            try {
                return Optional.ofNullable(blockTable.getItem(Key.builder()
                    .partitionValue(TutoringKeyFactory.getTutorPk(tutorId))
                    .sortValue(TutoringKeyFactory.getBlockSk(blockId))
                    .build()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find time block {} for tutor {}", blockId, tutorId, e);
                throw new RepositoryException("Failed to retrieve time block", e);
            }
        });
    }

    @Override
    public TimeBlock save(TimeBlock timeBlock) {
        return performanceTracker.trackQuery("saveTimeBlock", TABLE_NAME, () -> {
            try {
                timeBlock.touch();
                blockTable.putItem(timeBlock);
                logger.info("Saved time block {} for tutor {}", timeBlock.getBlockId(), timeBlock.getTutorId());
                return timeBlock;

            } catch (DynamoDbException e) {
                logger.error("Failed to save time block {}", timeBlock.getBlockId(), e);
                throw new RepositoryException("Failed to save time block", e);
            }
        });
    }

    @Override
    public void delete(String tutorId, String blockId) {
        performanceTracker.trackQuery("deleteTimeBlock", TABLE_NAME, () -> {
            try {
                blockTable.deleteItem(Key.builder()
                    .partitionValue(TutoringKeyFactory.getTutorPk(tutorId))
                    .sortValue(TutoringKeyFactory.getBlockSk(blockId))
                    .build());
                logger.info("Deleted time block {} for tutor {}", blockId, tutorId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete time block {}", blockId, e);
                throw new RepositoryException("Failed to delete time block", e);
            }
        });
    }
}
