/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.signal.accumulator.util.Keccak256MessageDigest;

/**
 * The frontier of an append-only, fixed-depth binary Merkle tree: the minimal state needed to reconstruct the root of
 * the tree formed by every leaf inserted so far, with all positions to the right of the last leaf empty.
 * <p>
 * For every bit {@code i} set in {@link #getCount()}, {@code branch[i]} holds the root of the maximal full subtree of
 * height {@code i} that ends at the most recently inserted leaf. Entries for cleared bits are stale and are never
 * read. The branch only ever grows, one level at a time, so it holds at most {@code depth} entries.
 * <p>
 * Frontiers are not thread safe; callers that share one must serialize access to it.
 */
public class Frontier {

  public static final int DEFAULT_DEPTH = 32;

  /**
   * Leaf counts are persisted as unsigned 32-bit integers, which bounds the depth.
   */
  public static final int MAX_DEPTH = 32;

  private final int depth;
  private final List<Hash> branch;
  private long count;

  /**
   * Creates an empty frontier of the default depth.
   */
  public Frontier() {
    this(DEFAULT_DEPTH);
  }

  /**
   * Creates an empty frontier of the given depth.
   *
   * @param depth the number of levels between a leaf and the root
   */
  public Frontier(final int depth) {
    this(depth, List.of(), 0);
  }

  /**
   * Restores a frontier from previously stored state. Structural problems with the branch are not detected here but
   * by {@link #insert(Hash)} and {@link #root(ZeroHashes)}, which refuse to operate on it.
   *
   * @param depth  the number of levels between a leaf and the root
   * @param branch the cached subtree roots, indexed by level
   * @param count  the number of leaves in the tree
   * @throws IllegalArgumentException if the depth is out of range or the count does not fit in a tree of the given
   *                                  depth
   */
  public Frontier(final int depth, final List<Hash> branch, final long count) {
    checkDepth(depth);
    if (count < 0 || count > getCapacity(depth)) {
      throw new IllegalArgumentException("Leaf count " + count + " does not fit in a tree of depth " + depth);
    }

    this.depth = depth;
    this.branch = new ArrayList<>(Objects.requireNonNull(branch, "branch"));
    this.count = count;

    if (this.branch.contains(null)) {
      throw new NullPointerException("Branch entries must not be null");
    }
  }

  /**
   * Appends a leaf to the tree.
   * <p>
   * The new leaf is combined with the completed subtrees to its left for as long as the new leaf count has a cleared
   * bit at the current level; the resulting hash is cached at the first level whose bit is set.
   *
   * @param leaf the leaf to append
   * @throws MerkleTreeException if the tree is full ({@link MerkleTreeError#TREE_FULL}) or the frontier is corrupt
   *                             ({@link MerkleTreeError#INVALID_STATE}); the frontier is unchanged in either case
   */
  public void insert(final Hash leaf) throws MerkleTreeException {
    Objects.requireNonNull(leaf, "leaf");

    if (count >= getCapacity()) {
      throw new MerkleTreeException(MerkleTreeError.TREE_FULL,
          "Merkle tree of depth " + depth + " is full at " + count + " leaves");
    }
    checkBranchSize();

    final long newCount = count + 1;
    final MessageDigest messageDigest = Keccak256MessageDigest.getMessageDigest();
    Hash carry = leaf;

    for (int level = 0; level < depth; level++) {
      if (isBitSet(newCount, level)) {
        // All lower levels were read above, so the branch holds at least `level` entries
        if (level == branch.size()) {
          branch.add(carry);
        } else {
          branch.set(level, carry);
        }
        count = newCount;
        return;
      }

      if (level >= branch.size()) {
        throw new MerkleTreeException(MerkleTreeError.INVALID_STATE,
            "No completed subtree stored at level " + level + " for leaf count " + count);
      }
      carry = CommitFunction.commit(messageDigest, branch.get(level), carry);
    }

    // newCount is positive and below 2^depth, so one of its low `depth` bits is set
    throw new AssertionError("Insertion fell through all " + depth + " levels for leaf count " + newCount);
  }

  /**
   * Reconstructs the root of the full tree of this frontier's depth, in which every position after the last inserted
   * leaf is empty.
   *
   * @param zeroHashes the empty subtree roots used to pad the right side of the tree
   * @return the root hash
   * @throws MerkleTreeException with {@link MerkleTreeError#INVALID_STATE} if the frontier is corrupt or the table
   *                             does not have exactly one entry per level
   */
  public Hash root(final ZeroHashes zeroHashes) throws MerkleTreeException {
    checkBranchSize();
    if (zeroHashes.size() != depth) {
      throw new MerkleTreeException(MerkleTreeError.INVALID_STATE,
          "Expected " + depth + " zero hashes but got " + zeroHashes.size());
    }

    final MessageDigest messageDigest = Keccak256MessageDigest.getMessageDigest();
    Hash current = Hash.ZERO;

    for (int level = 0; level < depth; level++) {
      if (isBitSet(count, level)) {
        if (level >= branch.size()) {
          throw new MerkleTreeException(MerkleTreeError.INVALID_STATE,
              "No completed subtree stored at level " + level + " for leaf count " + count);
        }
        current = CommitFunction.commit(messageDigest, branch.get(level), current);
      } else {
        current = CommitFunction.commit(messageDigest, current, zeroHashes.get(level));
      }
    }

    return current;
  }

  /**
   * @return the root hash, padded with the shared zero-hash table for this frontier's depth
   * @see #root(ZeroHashes)
   */
  public Hash root() throws MerkleTreeException {
    return root(ZeroHashes.forDepth(depth));
  }

  public int getDepth() {
    return depth;
  }

  public long getCount() {
    return count;
  }

  /**
   * @return the maximum number of leaves this frontier accepts
   */
  public long getCapacity() {
    return getCapacity(depth);
  }

  /**
   * @return an unmodifiable snapshot of the cached subtree roots, indexed by level
   */
  public List<Hash> getBranch() {
    return List.copyOf(branch);
  }

  public Frontier copy() {
    return new Frontier(depth, branch, count);
  }

  private void checkBranchSize() throws MerkleTreeException {
    if (branch.size() > depth) {
      throw new MerkleTreeException(MerkleTreeError.INVALID_STATE,
          "Branch has " + branch.size() + " entries but the tree only has " + depth + " levels");
    }
  }

  /**
   * The largest leaf count representable with {@code depth} bits. The final position of the tree is never filled.
   */
  static long getCapacity(final int depth) {
    return (1L << depth) - 1;
  }

  static boolean isBitSet(final long value, final int bit) {
    return ((value >>> bit) & 1) == 1;
  }

  static void checkDepth(final int depth) {
    if (depth < 1 || depth > MAX_DEPTH) {
      throw new IllegalArgumentException("Depth must be between 1 and " + MAX_DEPTH + ", got " + depth);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Frontier frontier = (Frontier) o;
    return depth == frontier.depth && count == frontier.count && branch.equals(frontier.branch);
  }

  @Override
  public int hashCode() {
    return Objects.hash(depth, branch, count);
  }

  @Override
  public String toString() {
    return "Frontier{" +
        "depth=" + depth +
        ", count=" + count +
        ", branch=" + branch +
        "}";
  }
}
