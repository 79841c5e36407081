package com.singularity.trading.store;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Documents stored as single DynamoDB items ({@code PK = DOC#<key>}, {@code SK = DOCUMENT}).
 * Every write stamps a fresh random {@code version}; conditional writes compare against it.
 */
public class DynamoDbDocumentStore implements DocumentStore {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    /**
     * @param dynamoDbClient The DynamoDB client.
     * @param tableName      The DynamoDB table name.
     */
    public DynamoDbDocumentStore(DynamoDbClient dynamoDbClient, String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public VersionedDocument read(String key) {
        try {
            GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(itemKey(key))
                    .consistentRead(true)
                    .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return VersionedDocument.absent();
            }
            Map<String, AttributeValue> item = response.item();
            AttributeValue body = item.get("body");
            AttributeValue version = item.get("version");
            if (body == null || body.s() == null || version == null || version.s() == null) {
                throw new StoreUnavailableException("Document " + key + " in " + tableName + " has no body or version");
            }
            return VersionedDocument.of(body.s(), version.s());
        } catch (SdkException e) {
            throw new StoreUnavailableException("Could not read document " + key + " from " + tableName, e);
        }
    }

    @Override
    public WriteResult writeIfVersion(String key, String body, String expectedVersionToken) {
        String newVersion = UUID.randomUUID().toString();
        PutItemRequest.Builder request = PutItemRequest.builder()
                .tableName(tableName)
                .item(item(key, body, newVersion));
        if (expectedVersionToken != null) {
            request.conditionExpression("version = :expected")
                    .expressionAttributeValues(Map.of(
                            ":expected", AttributeValue.builder().s(expectedVersionToken).build()));
        } else {
            request.conditionExpression("attribute_not_exists(PK)");
        }
        return put(key, request.build(), newVersion);
    }

    @Override
    public WriteResult writeUnconditionally(String key, String body) {
        String newVersion = UUID.randomUUID().toString();
        return put(key, PutItemRequest.builder()
                .tableName(tableName)
                .item(item(key, body, newVersion))
                .build(), newVersion);
    }

    private WriteResult put(String key, PutItemRequest request, String newVersion) {
        try {
            dynamoDbClient.putItem(request);
            return WriteResult.committed(newVersion);
        } catch (ConditionalCheckFailedException e) {
            return WriteResult.conflict();
        } catch (DynamoDbException e) {
            if (e.statusCode() >= 500) {
                return WriteResult.unknown(e);
            }
            throw new StoreUnavailableException("DynamoDB rejected write of document " + key, e);
        } catch (SdkClientException e) {
            return WriteResult.unknown(e);
        }
    }

    private Map<String, AttributeValue> itemKey(String key) {
        Map<String, AttributeValue> itemKey = new HashMap<>();
        itemKey.put("PK", AttributeValue.builder().s("DOC#" + key).build());
        itemKey.put("SK", AttributeValue.builder().s("DOCUMENT").build());
        return itemKey;
    }

    private Map<String, AttributeValue> item(String key, String body, String version) {
        Map<String, AttributeValue> item = itemKey(key);
        item.put("body", AttributeValue.builder().s(body).build());
        item.put("version", AttributeValue.builder().s(version).build());
        return item;
    }
}
