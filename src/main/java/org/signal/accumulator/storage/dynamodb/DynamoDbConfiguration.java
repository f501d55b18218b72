/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.storage.dynamodb;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Context;
import jakarta.validation.constraints.NotBlank;

/**
 * @param tableName the table holding the frontier state item
 * @param region    the AWS region of the table
 */
@Context
@ConfigurationProperties("storage.dynamodb")
record DynamoDbConfiguration(@NotBlank String tableName, @NotBlank String region) {
}
