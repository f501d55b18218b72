/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;
import org.signal.accumulator.util.Keccak256MessageDigest;

/**
 * Recomputes Merkle roots from inclusion proofs. Verification is stateless and does not need a {@link Frontier}; the
 * caller compares the computed root against a root it trusts.
 */
public final class ProofVerifier {

  private ProofVerifier() {
  }

  /**
   * Computes the root of a tree of the default depth implied by the given leaf, sibling path and leaf index.
   *
   * @see #branchRoot(Hash, List, long, int)
   */
  public static Hash branchRoot(final Hash leaf, final List<Hash> proof, final long index)
      throws InvalidProofException {
    return branchRoot(leaf, proof, index, Frontier.DEFAULT_DEPTH);
  }

  /**
   * Computes the root implied by the given leaf, sibling path and leaf index.
   * <p>
   * At each level, bit {@code i} of the index tells whether the running hash is the right child (bit set) or the left
   * child (bit cleared) of its parent, and {@code proof[i]} is its sibling.
   * <p>
   * The sibling path must cover every level. Missing siblings are not assumed to be zero, since zero bytes are only the
   * empty subtree root at height 0.
   *
   * @param leaf  the leaf whose inclusion is being proven
   * @param proof the sibling hashes from the leaf's level up to just below the root
   * @param index the position of the leaf in the tree
   * @param depth the number of levels between a leaf and the root
   * @return the root implied by the proof
   * @throws InvalidProofException if the proof does not have exactly {@code depth} siblings or the index does not fit
   *                               in a tree of the given depth
   */
  public static Hash branchRoot(final Hash leaf, final List<Hash> proof, final long index, final int depth)
      throws InvalidProofException {
    Objects.requireNonNull(leaf, "leaf");
    Objects.requireNonNull(proof, "proof");
    Frontier.checkDepth(depth);

    if (proof.size() != depth) {
      throw new InvalidProofException("Expected " + depth + " siblings but got " + proof.size());
    }
    if (index < 0 || index > Frontier.getCapacity(depth)) {
      throw new InvalidProofException("Leaf index " + index + " does not fit in a tree of depth " + depth);
    }

    final MessageDigest messageDigest = Keccak256MessageDigest.getMessageDigest();
    Hash current = leaf;

    for (int level = 0; level < depth; level++) {
      final Hash sibling = proof.get(level);
      if (sibling == null) {
        throw new InvalidProofException("Missing sibling at level " + level);
      }

      current = Frontier.isBitSet(index, level)
          ? CommitFunction.commit(messageDigest, sibling, current)
          : CommitFunction.commit(messageDigest, current, sibling);
    }

    return current;
  }
}
