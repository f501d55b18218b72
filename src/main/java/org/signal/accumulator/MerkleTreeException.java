/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

/**
 * Indicates that a frontier operation was refused. A refused operation never leaves a partially updated frontier
 * behind.
 */
public class MerkleTreeException extends Exception {

  private final MerkleTreeError error;

  public MerkleTreeException(final MerkleTreeError error, final String message) {
    super(message);
    this.error = error;
  }

  public MerkleTreeException(final MerkleTreeError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  public MerkleTreeError getError() {
    return error;
  }
}
