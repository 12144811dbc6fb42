package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.Subscription;
import com.bbthechange.tutoring.repository.SubscriptionRepository;
import com.bbthechange.tutoring.util.QueryPerformanceTracker;
import com.bbthechange.tutoring.util.TutoringKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.Map;
import java.util.Optional;

@Repository
public class SubscriptionRepositoryImpl implements SubscriptionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRepositoryImpl.class);

    private static final String TABLE_NAME = TutoringKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Subscription> subscriptionSchema;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public SubscriptionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.subscriptionSchema = TableSchema.fromBean(Subscription.class);
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<Subscription> findById(String subscriptionId) {
        return performanceTracker.trackQuery("findSubscriptionById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(TutoringKeyFactory.getSubscriptionPk(subscriptionId)).build(),
                        "sk", AttributeValue.builder().s(TutoringKeyFactory.getMetadataSk()).build()
                    ))
                    .build());

                if (!response.hasItem()) {
                    return Optional.empty();
                }
                return Optional.of(subscriptionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find subscription {}", subscriptionId, e);
                throw new RepositoryException("Failed to retrieve subscription", e);
            }
        });
    }
}
