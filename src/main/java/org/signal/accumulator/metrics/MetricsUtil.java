/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.metrics;

public class MetricsUtil {

  private static final String METRIC_NAME_PREFIX = "merkleAccumulator";

  /**
   * Returns a dot-separated metric name prefixed with the application name and the simple name of the given class,
   * e.g. {@code merkleAccumulator.MerkleTreeService.insert}.
   */
  public static String name(final Class<?> clazz, final String metricName) {
    return String.join(".", METRIC_NAME_PREFIX, clazz.getSimpleName(), metricName);
  }
}
