package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.TrialUsage;
import com.bbthechange.tutoring.repository.TrialConsumption;
import com.bbthechange.tutoring.repository.TrialUsageRepository;
import com.bbthechange.tutoring.util.QueryPerformanceTracker;
import com.bbthechange.tutoring.util.TutoringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trial usage counter plus one consumption marker per trial session.
 *
 * The marker (PARENT#{parentId} / TRIAL#{sessionId}) and the counter increment
 * are written in one transaction; the marker's attribute_not_exists condition
 * makes a repeated consumption for the same session a no-op, and the counter's
 * condition keeps it from passing the cap.
 */
@Repository
public class TrialUsageRepositoryImpl implements TrialUsageRepository {

    private static final Logger logger = LoggerFactory.getLogger(TrialUsageRepositoryImpl.class);

    private static final String TABLE_NAME = TutoringKeyFactory.TABLE_NAME;
    private static final String CONSUMPTION_ITEM_TYPE = "TRIAL_CONSUMPTION";
    private static final int MARKER_ITEM = 0;
    private static final int COUNTER_ITEM = 1;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<TrialUsage> usageSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public TrialUsageRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.usageSchema = TableSchema.fromBean(TrialUsage.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public TrialUsage getTrialUsage(String parentId) {
        return performanceTracker.trackQuery("getTrialUsage", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(TutoringKeyFactory.getParentPk(parentId)).build(),
                        "sk", AttributeValue.builder().s(TutoringKeyFactory.getTrialUsageSk()).build()
                    ))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem()) {
                    return new TrialUsage(parentId, 0);
                }
                TrialUsage usage = usageSchema.mapToItem(response.item());
                if (usage.getTrialsUsed() == null) {
                    usage.setTrialsUsed(0);
                }
                return usage;

            } catch (DynamoDbException e) {
                logger.error("Failed to read trial usage for parent {}", parentId, e);
                throw new RepositoryException("Failed to read trial usage", e);
            }
        });
    }

    @Override
    public TrialConsumption consumeTrial(String parentId, String sessionId, int cap) {
        return performanceTracker.trackQuery("consumeTrial", TABLE_NAME, () -> {
            String parentPk = TutoringKeyFactory.getParentPk(parentId);
            String now = String.valueOf(System.currentTimeMillis());

            Map<String, AttributeValue> marker = new HashMap<>();
            marker.put("pk", AttributeValue.builder().s(parentPk).build());
            marker.put("sk", AttributeValue.builder().s(TutoringKeyFactory.getTrialConsumptionSk(sessionId)).build());
            marker.put("itemType", AttributeValue.builder().s(CONSUMPTION_ITEM_TYPE).build());
            marker.put("parentId", AttributeValue.builder().s(parentId).build());
            marker.put("sessionId", AttributeValue.builder().s(sessionId).build());
            marker.put("createdAt", AttributeValue.builder().n(now).build());
            marker.put("updatedAt", AttributeValue.builder().n(now).build());

            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":zero", AttributeValue.builder().n("0").build());
            values.put(":one", AttributeValue.builder().n("1").build());
            values.put(":itemType", AttributeValue.builder().s(TrialUsage.ITEM_TYPE).build());
            values.put(":parentId", AttributeValue.builder().s(parentId).build());
            values.put(":now", AttributeValue.builder().n(now).build());
            values.put(":cap", AttributeValue.builder().n(String.valueOf(cap)).build());

            List<TransactWriteItem> transactItems = List.of(
                TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(TABLE_NAME)
                        .item(marker)
                        .conditionExpression("attribute_not_exists(pk)")
                        .build())
                    .build(),
                TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(TABLE_NAME)
                        .key(Map.of(
                            "pk", AttributeValue.builder().s(parentPk).build(),
                            "sk", AttributeValue.builder().s(TutoringKeyFactory.getTrialUsageSk()).build()
                        ))
                        .updateExpression("SET trialsUsed = if_not_exists(trialsUsed, :zero) + :one, "
                            + "itemType = :itemType, parentId = :parentId, "
                            + "createdAt = if_not_exists(createdAt, :now), updatedAt = :now")
                        .conditionExpression("attribute_not_exists(trialsUsed) OR trialsUsed < :cap")
                        .expressionAttributeValues(values)
                        .build())
                    .build()
            );

            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(transactItems)
                    .build());
                logger.info("Consumed trial for parent {} with session {}", parentId, sessionId);
                return TrialConsumption.COUNTED;

            } catch (TransactionCanceledException e) {
                if (failedCondition(e, MARKER_ITEM)) {
                    logger.debug("Trial for session {} already consumed", sessionId);
                    return TrialConsumption.ALREADY_COUNTED;
                }
                if (failedCondition(e, COUNTER_ITEM)) {
                    logger.info("Parent {} has no trials left under cap {}", parentId, cap);
                    return TrialConsumption.LIMIT_REACHED;
                }
                logger.error("Transaction cancelled while consuming trial for parent {}: {}",
                    parentId, e.cancellationReasons());
                throw new RepositoryException("Failed to consume trial - transaction cancelled", e);
            } catch (DynamoDbException e) {
                logger.error("DynamoDB error while consuming trial for parent {}", parentId, e);
                throw new RepositoryException("Failed to consume trial", e);
            }
        });
    }

    private static boolean failedCondition(TransactionCanceledException e, int itemIndex) {
        if (!e.hasCancellationReasons() || e.cancellationReasons().size() <= itemIndex) {
            return false;
        }
        return "ConditionalCheckFailed".equals(e.cancellationReasons().get(itemIndex).code());
    }
}
