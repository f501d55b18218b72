/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.storage.dynamodb;

import com.google.common.annotations.VisibleForTesting;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import org.signal.accumulator.storage.FrontierStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * A frontier state repository that uses DynamoDB as its backing store.
 */
@Singleton
public class DynamoDbFrontierStateRepository implements FrontierStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(DynamoDbFrontierStateRepository.class);
  // there is only one tree per table, so the key is a constant value
  @VisibleForTesting
  static final AttributeValue KEY_ATTRIBUTE_VALUE = AttributeValue.builder().s("Frontier").build();
  @VisibleForTesting
  static final String KEY = "K";
  // serialized frontier state; bytes
  @VisibleForTesting
  static final String ATTR_FRONTIER_STATE = "F";
  private final DynamoDbClient dynamoDbClient;
  private final DynamoDbConfiguration dynamoDbConfiguration;

  public DynamoDbFrontierStateRepository(final DynamoDbClient dynamoDbClient,
      final DynamoDbConfiguration dynamoDbConfiguration) {
    this.dynamoDbClient = dynamoDbClient;
    this.dynamoDbConfiguration = dynamoDbConfiguration;
  }

  @Override
  public Optional<byte[]> getSerializedFrontierState() throws IOException {
    final GetItemResponse response;
    try {
      response = dynamoDbClient.getItem(GetItemRequest.builder()
          .tableName(dynamoDbConfiguration.tableName())
          .key(Map.of(KEY, KEY_ATTRIBUTE_VALUE))
          .consistentRead(true)
          .build());
    } catch (final SdkException e) {
      logger.error("Unexpected error getting frontier state", e);
      throw new IOException(e);
    }

    if (!response.hasItem() || response.item().isEmpty()) {
      logger.info("Frontier state not found in {}", dynamoDbConfiguration.tableName());
      return Optional.empty();
    }

    final AttributeValue frontierState = response.item().get(ATTR_FRONTIER_STATE);
    if (frontierState == null || frontierState.b() == null) {
      throw new IOException("Stored item has no frontier state attribute");
    }
    return Optional.of(frontierState.b().asByteArray());
  }

  @Override
  public void storeSerializedFrontierState(final byte[] serializedFrontierState) throws IOException {
    final PutItemRequest.Builder builder = PutItemRequest.builder()
        .tableName(dynamoDbConfiguration.tableName())
        .item(Map.of(
            KEY, KEY_ATTRIBUTE_VALUE,
            ATTR_FRONTIER_STATE, AttributeValue.builder().b(SdkBytes.fromByteArray(serializedFrontierState)).build()
        ));
    try {
      dynamoDbClient.putItem(builder.build());
    } catch (final SdkException e) {
      logger.error("Unexpected error writing frontier state", e);
      throw new IOException(e);
    }
  }
}
