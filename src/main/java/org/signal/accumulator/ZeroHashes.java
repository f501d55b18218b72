/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Suppliers;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.signal.accumulator.util.Keccak256MessageDigest;

/**
 * The roots of empty subtrees, indexed by subtree height.
 * <p>
 * {@code Z[0]} is the all-zero hash and {@code Z[i] = commit(Z[i-1], Z[i-1])}. The table is derived from the commit
 * function the first time it is needed and shared by every frontier thereafter; tables for shallower trees are
 * prefixes of the table for the maximum depth.
 */
public final class ZeroHashes {

  private static final Supplier<List<Hash>> MAX_DEPTH_TABLE =
      Suppliers.memoize(() -> generate(Frontier.MAX_DEPTH));

  private final List<Hash> hashes;

  @VisibleForTesting
  ZeroHashes(final List<Hash> hashes) {
    this.hashes = List.copyOf(hashes);
  }

  /**
   * @param depth the depth of the tree the table pads
   * @return a table with exactly {@code depth} entries
   * @throws IllegalArgumentException if the depth is outside {@code [1, Frontier.MAX_DEPTH]}
   */
  public static ZeroHashes forDepth(final int depth) {
    Frontier.checkDepth(depth);
    return new ZeroHashes(MAX_DEPTH_TABLE.get().subList(0, depth));
  }

  /**
   * @param height the height of the empty subtree
   * @return the root of an empty subtree of the given height
   * @throws IndexOutOfBoundsException if the height is not covered by this table
   */
  public Hash get(final int height) {
    return hashes.get(height);
  }

  public int size() {
    return hashes.size();
  }

  @VisibleForTesting
  static List<Hash> generate(final int size) {
    final MessageDigest messageDigest = Keccak256MessageDigest.getMessageDigest();
    final List<Hash> table = new ArrayList<>(size);

    Hash current = Hash.ZERO;
    for (int i = 0; i < size; i++) {
      table.add(current);
      current = CommitFunction.commit(messageDigest, current, current);
    }

    return table;
  }
}
