/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import java.security.MessageDigest;
import org.signal.accumulator.util.Keccak256MessageDigest;

/**
 * Combines two child hashes into their parent hash.
 * <p>
 * The parent is {@code Keccak-256(left || right)} over the 64 raw bytes of the children. The concatenation order is
 * part of the accumulator's compatibility contract: any external verifier must reproduce it exactly.
 */
public final class CommitFunction {

  private CommitFunction() {
  }

  /**
   * @param left  the left child
   * @param right the right child
   * @return the parent of the given children
   */
  public static Hash commit(final Hash left, final Hash right) {
    return commit(Keccak256MessageDigest.getMessageDigest(), left, right);
  }

  /**
   * Variant of {@link #commit(Hash, Hash)} for callers that hash many pairs in a row and want to reuse a single digest.
   * The digest is reset by {@link MessageDigest#digest()}, so it may be reused immediately.
   */
  static Hash commit(final MessageDigest messageDigest, final Hash left, final Hash right) {
    messageDigest.update(left.bytes());
    messageDigest.update(right.bytes());
    return new Hash(messageDigest.digest());
  }
}
