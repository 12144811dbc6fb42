package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.Interval;
import com.bbthechange.tutoring.model.Session;
import com.bbthechange.tutoring.model.SessionScheduleUpdate;
import com.bbthechange.tutoring.model.SessionStatus;
import com.bbthechange.tutoring.repository.SessionRepository;
import com.bbthechange.tutoring.repository.WriteOutcome;
import com.bbthechange.tutoring.util.QueryPerformanceTracker;
import com.bbthechange.tutoring.util.TutoringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of SessionRepository.
 *
 * Every write that claims or moves time is a TransactWriteItems whose first
 * item bumps TUTOR#{tutorId}/SCHEDULE under the condition that its version is
 * still the one the caller read. A cancelled transaction caused by a failed
 * condition is reported as {@link WriteOutcome#CONFLICT}.
 */
@Repository
public class SessionRepositoryImpl implements SessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SessionRepositoryImpl.class);

    private static final String TABLE_NAME = TutoringKeyFactory.TABLE_NAME;
    private static final String SCHEDULE_ITEM_TYPE = "TUTOR_SCHEDULE";
    private static final String VERSION_ATTRIBUTE = "version";

    // Sessions starting this long before a range can still reach into it
    static final long SESSION_LOOKBACK_MS = 24L * 60 * 60 * 1000;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final TableSchema<Session> sessionSchema;

    @Autowired
    public SessionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.sessionSchema = TableSchema.fromBean(Session.class);
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        return performanceTracker.trackQuery("findSessionById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(sessionKey(sessionId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem()) {
                    return Optional.empty();
                }
                return Optional.of(sessionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find session {}", sessionId, e);
                throw new RepositoryException("Failed to retrieve session", e);
            }
        });
    }

    @Override
    public List<Session> findBookedSessions(String tutorId, long rangeStart, long rangeEnd, String excludeSessionId) {
        if (rangeEnd <= rangeStart) {
            return List.of();
        }
        return performanceTracker.trackQuery("findBookedSessions", TutoringKeyFactory.TUTOR_TIME_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(TutoringKeyFactory.TUTOR_TIME_INDEX)
                    .keyConditionExpression("gsi1pk = :tutorPk AND scheduledAt BETWEEN :from AND :to")
                    .filterExpression("itemType = :itemType AND #status <> :cancelled")
                    .expressionAttributeNames(Map.of("#status", "status"))
                    .expressionAttributeValues(Map.of(
                        ":tutorPk", AttributeValue.builder().s(TutoringKeyFactory.getTutorPk(tutorId)).build(),
                        ":from", AttributeValue.builder().n(String.valueOf(rangeStart - SESSION_LOOKBACK_MS)).build(),
                        ":to", AttributeValue.builder().n(String.valueOf(rangeEnd - 1)).build(),
                        ":itemType", AttributeValue.builder().s(Session.ITEM_TYPE).build(),
                        ":cancelled", AttributeValue.builder().s(SessionStatus.CANCELLED.name()).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                Interval range = Interval.of(rangeStart, rangeEnd);
                return queryAll(request).stream()
                    .map(sessionSchema::mapToItem)
                    .filter(Session::occupiesTime)
                    .filter(session -> !session.getSessionId().equals(excludeSessionId))
                    .filter(session -> session.getOccupiedInterval().overlaps(range))
                    .collect(Collectors.toList());

            } catch (DynamoDbException e) {
                logger.error("Failed to query booked sessions for tutor {}", tutorId, e);
                throw new RepositoryException("Failed to query booked sessions", e);
            }
        });
    }

    @Override
    public List<Session> findBySubscriptionId(String subscriptionId) {
        return performanceTracker.trackQuery("findSessionsBySubscription", TutoringKeyFactory.SUBSCRIPTION_INDEX, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(TutoringKeyFactory.SUBSCRIPTION_INDEX)
                    .keyConditionExpression("gsi2pk = :subscriptionPk")
                    .filterExpression("itemType = :itemType")
                    .expressionAttributeValues(Map.of(
                        ":subscriptionPk", AttributeValue.builder().s(TutoringKeyFactory.getSubscriptionPk(subscriptionId)).build(),
                        ":itemType", AttributeValue.builder().s(Session.ITEM_TYPE).build()
                    ))
                    .scanIndexForward(true)
                    .build();

                return queryAll(request).stream()
                    .map(sessionSchema::mapToItem)
                    .collect(Collectors.toList());

            } catch (DynamoDbException e) {
                logger.error("Failed to query sessions for subscription {}", subscriptionId, e);
                throw new RepositoryException("Failed to query sessions by subscription", e);
            }
        });
    }

    @Override
    public long getScheduleVersion(String tutorId) {
        return performanceTracker.trackQuery("getScheduleVersion", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(scheduleKey(tutorId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || !response.item().containsKey(VERSION_ATTRIBUTE)) {
                    return 0L;
                }
                return Long.parseLong(response.item().get(VERSION_ATTRIBUTE).n());

            } catch (DynamoDbException e) {
                logger.error("Failed to read schedule version for tutor {}", tutorId, e);
                throw new RepositoryException("Failed to read schedule version", e);
            }
        });
    }

    @Override
    public WriteOutcome insertSession(Session session, long expectedVersion) {
        return insertSessions(session.getTutorId(), List.of(session), expectedVersion);
    }

    @Override
    public WriteOutcome insertSessions(String tutorId, List<Session> sessions, long expectedVersion) {
        checkTransactionSize(sessions.size());
        return performanceTracker.trackQuery("insertSessions", TABLE_NAME, () -> {
            List<TransactWriteItem> transactItems = new ArrayList<>();
            transactItems.add(bumpScheduleVersion(tutorId, expectedVersion));

            for (Session session : sessions) {
                session.touch();
                transactItems.add(TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(TABLE_NAME)
                        .item(sessionSchema.itemToMap(session, true))
                        .conditionExpression("attribute_not_exists(pk)")
                        .build())
                    .build());
            }

            WriteOutcome outcome = executeTransaction(transactItems, "insert " + sessions.size() + " session(s) for tutor " + tutorId);
            if (outcome == WriteOutcome.OK) {
                logger.info("Inserted {} session(s) for tutor {} at schedule version {}",
                    sessions.size(), tutorId, expectedVersion + 1);
            }
            return outcome;
        });
    }

    @Override
    public WriteOutcome updateSessionSchedule(String tutorId, String sessionId, long newScheduledAt, long expectedVersion) {
        return updateSeriesSchedule(tutorId, List.of(new SessionScheduleUpdate(sessionId, newScheduledAt)), expectedVersion);
    }

    @Override
    public WriteOutcome updateSeriesSchedule(String tutorId, List<SessionScheduleUpdate> updates, long expectedVersion) {
        checkTransactionSize(updates.size());
        return performanceTracker.trackQuery("updateSessionSchedule", TABLE_NAME, () -> {
            long now = System.currentTimeMillis();
            List<TransactWriteItem> transactItems = new ArrayList<>();
            transactItems.add(bumpScheduleVersion(tutorId, expectedVersion));

            for (SessionScheduleUpdate update : updates) {
                transactItems.add(TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(TABLE_NAME)
                        .key(sessionKey(update.getSessionId()))
                        .updateExpression("SET scheduledAt = :scheduledAt, updatedAt = :now")
                        .conditionExpression("attribute_exists(pk) AND #status = :scheduled")
                        .expressionAttributeNames(Map.of("#status", "status"))
                        .expressionAttributeValues(Map.of(
                            ":scheduledAt", AttributeValue.builder().n(String.valueOf(update.getNewScheduledAt())).build(),
                            ":now", AttributeValue.builder().n(String.valueOf(now)).build(),
                            ":scheduled", AttributeValue.builder().s(SessionStatus.SCHEDULED.name()).build()
                        ))
                        .build())
                    .build());
            }

            WriteOutcome outcome = executeTransaction(transactItems, "move " + updates.size() + " session(s) for tutor " + tutorId);
            if (outcome == WriteOutcome.OK) {
                logger.info("Moved {} session(s) for tutor {}", updates.size(), tutorId);
            }
            return outcome;
        });
    }

    @Override
    public WriteOutcome updateSessionStatus(String sessionId, SessionStatus status, String notes) {
        return performanceTracker.trackQuery("updateSessionStatus", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(statusUpdate(sessionId, status, notes));
                logger.info("Session {} is now {}", sessionId, status);
                return WriteOutcome.OK;

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Session {} was no longer SCHEDULED when setting status {}", sessionId, status);
                return WriteOutcome.CONFLICT;
            } catch (DynamoDbException e) {
                logger.error("Failed to update status of session {}", sessionId, e);
                throw new RepositoryException("Failed to update session status", e);
            }
        });
    }

    @Override
    public WriteOutcome cancelSessions(List<String> sessionIds, String notes) {
        if (sessionIds.isEmpty()) {
            return WriteOutcome.OK;
        }
        checkTransactionSize(sessionIds.size());
        return performanceTracker.trackQuery("cancelSessions", TABLE_NAME, () -> {
            List<TransactWriteItem> transactItems = new ArrayList<>();
            for (String sessionId : sessionIds) {
                UpdateItemRequest request = statusUpdate(sessionId, SessionStatus.CANCELLED, notes);
                transactItems.add(TransactWriteItem.builder()
                    .update(Update.builder()
                        .tableName(TABLE_NAME)
                        .key(request.key())
                        .updateExpression(request.updateExpression())
                        .conditionExpression(request.conditionExpression())
                        .expressionAttributeNames(request.expressionAttributeNames())
                        .expressionAttributeValues(request.expressionAttributeValues())
                        .build())
                    .build());
            }

            WriteOutcome outcome = executeTransaction(transactItems, "cancel " + sessionIds.size() + " session(s)");
            if (outcome == WriteOutcome.OK) {
                logger.info("Cancelled {} session(s)", sessionIds.size());
            }
            return outcome;
        });
    }

    private UpdateItemRequest statusUpdate(String sessionId, SessionStatus status, String notes) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":status", AttributeValue.builder().s(status.name()).build());
        values.put(":scheduled", AttributeValue.builder().s(SessionStatus.SCHEDULED.name()).build());
        values.put(":now", AttributeValue.builder().n(String.valueOf(System.currentTimeMillis())).build());

        String updateExpression = "SET #status = :status, updatedAt = :now";
        if (notes != null) {
            updateExpression += ", notes = :notes";
            values.put(":notes", AttributeValue.builder().s(notes).build());
        }

        return UpdateItemRequest.builder()
            .tableName(TABLE_NAME)
            .key(sessionKey(sessionId))
            .updateExpression(updateExpression)
            .conditionExpression("attribute_exists(pk) AND #status = :scheduled")
            .expressionAttributeNames(Map.of("#status", "status"))
            .expressionAttributeValues(values)
            .build();
    }

    private TransactWriteItem bumpScheduleVersion(String tutorId, long expectedVersion) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":zero", AttributeValue.builder().n("0").build());
        values.put(":one", AttributeValue.builder().n("1").build());
        values.put(":itemType", AttributeValue.builder().s(SCHEDULE_ITEM_TYPE).build());
        values.put(":now", AttributeValue.builder().n(String.valueOf(System.currentTimeMillis())).build());

        String condition;
        if (expectedVersion == 0) {
            condition = "attribute_not_exists(#ver) OR #ver = :expectedVersion";
        } else {
            condition = "#ver = :expectedVersion";
        }
        values.put(":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build());

        return TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(scheduleKey(tutorId))
                .updateExpression("SET #ver = if_not_exists(#ver, :zero) + :one, itemType = :itemType, updatedAt = :now")
                .conditionExpression(condition)
                .expressionAttributeNames(Map.of("#ver", VERSION_ATTRIBUTE))
                .expressionAttributeValues(values)
                .build())
            .build();
    }

    private WriteOutcome executeTransaction(List<TransactWriteItem> transactItems, String description) {
        try {
            dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                .transactItems(transactItems)
                .build());
            return WriteOutcome.OK;

        } catch (TransactionCanceledException e) {
            if (isConditionFailure(e)) {
                logger.warn("Conditional check failed, could not {}: {}", description, e.cancellationReasons());
                return WriteOutcome.CONFLICT;
            }
            logger.error("Transaction cancelled, could not {}: {}", description, e.cancellationReasons());
            throw new RepositoryException("Failed to " + description + " - transaction cancelled", e);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error, could not {}", description, e);
            throw new RepositoryException("Failed to " + description, e);
        }
    }

    static boolean isConditionFailure(TransactionCanceledException e) {
        return e.hasCancellationReasons() && e.cancellationReasons().stream()
            .anyMatch(reason -> "ConditionalCheckFailed".equals(reason.code()));
    }

    private List<Map<String, AttributeValue>> queryAll(QueryRequest request) {
        return queryAll(dynamoDbClient, request);
    }

    /**
     * Runs the query page by page until DynamoDB stops returning a LastEvaluatedKey.
     */
    static List<Map<String, AttributeValue>> queryAll(DynamoDbClient client, QueryRequest request) {
        List<Map<String, AttributeValue>> items = new ArrayList<>();
        Map<String, AttributeValue> lastKey = null;
        do {
            QueryRequest page = lastKey == null ? request : request.toBuilder().exclusiveStartKey(lastKey).build();
            QueryResponse response = client.query(page);
            items.addAll(response.items());
            lastKey = response.hasLastEvaluatedKey() ? response.lastEvaluatedKey() : null;
        } while (lastKey != null && !lastKey.isEmpty());
        return items;
    }

    private static void checkTransactionSize(int sessionCount) {
        if (sessionCount > MAX_SESSIONS_PER_WRITE) {
            throw new IllegalArgumentException("At most " + MAX_SESSIONS_PER_WRITE
                + " sessions can be written in one transaction, got " + sessionCount);
        }
    }

    private static Map<String, AttributeValue> sessionKey(String sessionId) {
        return Map.of(
            "pk", AttributeValue.builder().s(TutoringKeyFactory.getSessionPk(sessionId)).build(),
            "sk", AttributeValue.builder().s(TutoringKeyFactory.getMetadataSk()).build()
        );
    }

    private static Map<String, AttributeValue> scheduleKey(String tutorId) {
        return Map.of(
            "pk", AttributeValue.builder().s(TutoringKeyFactory.getTutorPk(tutorId)).build(),
            "sk", AttributeValue.builder().s(TutoringKeyFactory.getScheduleSk()).build()
        );
    }
}
