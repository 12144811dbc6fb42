package com.bbthechange.tutoring.repository.impl;

import com.bbthechange.tutoring.exception.RepositoryException;
import com.bbthechange.tutoring.model.TimeBlock;
import com.bbthechange.tutoring.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.bbthechange.tutoring.testutil.TestTimes.MONDAY;
import static com.bbthechange.tutoring.testutil.TestTimes.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeBlockRepositoryImplTest {

    private static final String TUTOR_ID = "9e8d7c6b-5a4f-4e3d-8c2b-1a0f9e8d7c6b";
    private static final TableSchema<TimeBlock> BLOCK_SCHEMA = TableSchema.fromBean(TimeBlock.class);

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Mock
    private QueryPerformanceTracker queryPerformanceTracker;

    private TimeBlockRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        lenient().when(queryPerformanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
        repository = new TimeBlockRepositoryImpl(dynamoDbClient, dynamoDbEnhancedClient, queryPerformanceTracker);
    }

    @Test
    void findOverlapping_KeepsOnlyBlocksTouchingRange_SortedByStart() {
        TimeBlock afternoon = new TimeBlock(TUTOR_ID, at(MONDAY, 14, 0), at(MONDAY, 15, 0), "dentist");
        TimeBlock morning = new TimeBlock(TUTOR_ID, at(MONDAY, 8, 0), at(MONDAY, 9, 30), "school run");
        TimeBlock endsAtRangeStart = new TimeBlock(TUTOR_ID, at(MONDAY, 7, 0), at(MONDAY, 9, 0), "gym");
        when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
            .items(toItem(afternoon), toItem(endsAtRangeStart), toItem(morning))
            .build());

        List<TimeBlock> blocks = repository.findOverlapping(TUTOR_ID, at(MONDAY, 9, 0), at(MONDAY, 18, 0));

        assertThat(blocks).extracting(TimeBlock::getReason).containsExactly("school run", "dentist");

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient).query(captor.capture());
        assertThat(captor.getValue().keyConditionExpression()).isEqualTo("pk = :pk AND begins_with(sk, :blockPrefix)");
        assertThat(captor.getValue().expressionAttributeValues().get(":blockPrefix").s()).isEqualTo("BLOCK#");
    }

    @Test
    void findOverlapping_FollowsEveryPage() {
        TimeBlock firstPage = new TimeBlock(TUTOR_ID, at(MONDAY, 12, 0), at(MONDAY, 13, 0), "lunch");
        TimeBlock secondPage = new TimeBlock(TUTOR_ID, at(MONDAY, 10, 0), at(MONDAY, 11, 0), "call");
        Map<String, AttributeValue> lastKey = Map.of(
            "pk", AttributeValue.builder().s("TUTOR#" + TUTOR_ID).build(),
            "sk", AttributeValue.builder().s("BLOCK#" + firstPage.getBlockId()).build());
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenReturn(QueryResponse.builder().items(toItem(firstPage)).lastEvaluatedKey(lastKey).build())
            .thenReturn(QueryResponse.builder().items(toItem(secondPage)).build());

        List<TimeBlock> blocks = repository.findOverlapping(TUTOR_ID, at(MONDAY, 9, 0), at(MONDAY, 18, 0));

        assertThat(blocks).extracting(TimeBlock::getReason).containsExactly("call", "lunch");
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dynamoDbClient, times(2)).query(captor.capture());
        assertThat(captor.getAllValues().get(0).exclusiveStartKey()).isEmpty();
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).isEqualTo(lastKey);
    }

    @Test
    void findOverlapping_EmptyRange_SkipsQuery() {
        assertThat(repository.findOverlapping(TUTOR_ID, at(MONDAY, 9, 0), at(MONDAY, 8, 0))).isEmpty();
        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    void findOverlapping_StoreFailure_ThrowsRepositoryException() {
        when(dynamoDbClient.query(any(QueryRequest.class)))
            .thenThrow(DynamoDbException.builder().message("unavailable").build());

        assertThatThrownBy(() -> repository.findOverlapping(TUTOR_ID, at(MONDAY, 9, 0), at(MONDAY, 10, 0)))
            .isInstanceOf(RepositoryException.class);
    }

    private static Map<String, AttributeValue> toItem(TimeBlock block) {
        return BLOCK_SCHEMA.itemToMap(block, true);
    }
}
