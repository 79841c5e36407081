package com.singularity.trading.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DynamoDbDocumentStore.
 */
@ExtendWith(MockitoExtension.class)
public class DynamoDbDocumentStoreTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    private DynamoDbDocumentStore store;

    @BeforeEach
    public void setUp() {
        store = new DynamoDbDocumentStore(dynamoDbClient, "TestTable");
    }

    /**
     * Tests that the document is read with a strongly consistent read.
     */
    @Test
    public void shouldReadDocumentConsistently() {
        // Given
        Map<String, AttributeValue> item = Map.of(
                "PK", AttributeValue.builder().s("DOC#trading/listings.json").build(),
                "SK", AttributeValue.builder().s("DOCUMENT").build(),
                "body", AttributeValue.builder().s("[]").build(),
                "version", AttributeValue.builder().s("v-1").build()
        );
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenReturn(GetItemResponse.builder().item(item).build());

        // When
        VersionedDocument document = store.read("trading/listings.json");

        // Then
        ArgumentCaptor<GetItemRequest> request = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(request.capture());
        assertThat(request.getValue().consistentRead()).isTrue();
        assertThat(request.getValue().key().get("PK").s()).isEqualTo("DOC#trading/listings.json");
        assertThat(document.getBody()).isEqualTo("[]");
        assertThat(document.getVersionToken()).isEqualTo("v-1");
    }

    /**
     * Tests that a missing item reads as an absent document.
     */
    @Test
    public void shouldReadAbsentDocumentWhenItemIsMissing() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenReturn(GetItemResponse.builder().build());

        assertThat(store.read("trading/listings.json").exists()).isFalse();
    }

    /**
     * Tests that an item missing its body or version is reported as unavailable.
     */
    @Test
    public void shouldFailReadWhenItemIsIncomplete() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenReturn(GetItemResponse.builder().item(Map.of(
                        "PK", AttributeValue.builder().s("DOC#trading/listings.json").build(),
                        "version", AttributeValue.builder().s("v-1").build())).build());

        assertThatThrownBy(() -> store.read("trading/listings.json"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("no body or version");
    }

    /**
     * Tests that a conditional write compares against the observed version and stamps a new one.
     */
    @Test
    public void shouldConditionWriteOnObservedVersion() {
        // Given
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        // When
        WriteResult result = store.writeIfVersion("trading/listings.json", "[]", "v-1");

        // Then
        ArgumentCaptor<PutItemRequest> request = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(request.capture());
        assertThat(request.getValue().conditionExpression()).isEqualTo("version = :expected");
        assertThat(request.getValue().expressionAttributeValues().get(":expected").s()).isEqualTo("v-1");
        assertThat(result.isCommitted()).isTrue();
        assertThat(request.getValue().item().get("version").s()).isEqualTo(result.getVersionToken());
        assertThat(result.getVersionToken()).isNotEqualTo("v-1");
    }

    /**
     * Tests that creating a document requires the item to be absent.
     */
    @Test
    public void shouldRequireAbsentItemWhenNoVersionExpected() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        store.writeIfVersion("trading/listings.json", "[]", null);

        ArgumentCaptor<PutItemRequest> request = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(request.capture());
        assertThat(request.getValue().conditionExpression()).isEqualTo("attribute_not_exists(PK)");
    }

    /**
     * Tests that a failed condition check is a version conflict.
     */
    @Test
    public void shouldReportConflictWhenConditionFails() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("The conditional request failed").build());

        WriteResult result = store.writeIfVersion("trading/listings.json", "[]", "v-1");

        assertThat(result.getStatus()).isEqualTo(WriteResult.Status.VERSION_CONFLICT);
    }

    /**
     * Tests that an internal server error during a write is an unknown outcome.
     */
    @Test
    public void shouldReportUnknownOutcomeOnServerError() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
                .thenThrow(DynamoDbException.builder().statusCode(500).message("Internal Server Error").build());

        WriteResult result = store.writeIfVersion("trading/listings.json", "[]", "v-1");

        assertThat(result.getStatus()).isEqualTo(WriteResult.Status.OUTCOME_UNKNOWN);
    }

    /**
     * Tests that a client-side validation error is surfaced as an unavailable store.
     */
    @Test
    public void shouldFailWriteOnValidationError() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
                .thenThrow(DynamoDbException.builder().statusCode(400).message("ValidationException").build());

        assertThatThrownBy(() -> store.writeIfVersion("trading/listings.json", "[]", "v-1"))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
