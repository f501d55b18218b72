/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Configuration parameters for a {@link MerkleTreeService}.
 *
 * @param depth The number of levels between a leaf and the root. Every party computing or verifying roots of the same
 *              tree must agree on it; changing it for a tree that already holds leaves invalidates its stored state.
 */
@ConfigurationProperties("merkle-tree")
record MerkleTreeConfiguration(
    @Min(1)
    @Max(Frontier.MAX_DEPTH)
    int depth) {
}
