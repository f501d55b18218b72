/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

/**
 * Indicates that a caller provided a malformed inclusion proof, either a sibling path of the wrong length or a leaf
 * index that does not fit in the tree.
 */
public class InvalidProofException extends Exception {

  InvalidProofException(final String message) {
    super(message);
  }
}
