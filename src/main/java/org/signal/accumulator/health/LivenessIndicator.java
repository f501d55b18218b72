/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.health;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import io.micronaut.management.health.indicator.annotation.Liveness;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.signal.accumulator.MerkleTreeService;

@Singleton
@Liveness
public class LivenessIndicator implements HealthIndicator {

  private final MerkleTreeService merkleTreeService;

  public LivenessIndicator(final MerkleTreeService merkleTreeService) {
    this.merkleTreeService = merkleTreeService;
  }

  @Override
  public Publisher<HealthResult> getResult() {
    return Publishers.just(HealthResult.builder("MerkleTreeHealthy",
        merkleTreeService.isHealthy() ? HealthStatus.UP : HealthStatus.DOWN).build());
  }
}
