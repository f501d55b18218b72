/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

/**
 * The declared ways in which a frontier operation can be refused. Codes are stable and shared with external
 * implementations of the same accumulator.
 */
public enum MerkleTreeError {

  /**
   * The tree holds the maximum number of leaves representable at its depth.
   */
  TREE_FULL(1),

  /**
   * The frontier or the zero-hash table violates a structural invariant. This indicates corrupted persisted state or
   * a construction bug and is not retryable.
   */
  INVALID_STATE(2);

  private final int code;

  MerkleTreeError(final int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
