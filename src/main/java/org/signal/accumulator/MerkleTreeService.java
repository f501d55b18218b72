/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.signal.accumulator.metrics.MetricsUtil;
import org.signal.accumulator.storage.FrontierState;
import org.signal.accumulator.storage.FrontierStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains a single persistent Merkle accumulator. Every call loads the frontier from the
 * {@link FrontierStateRepository}, applies at most one insertion and, if the insertion succeeded, stores the frontier
 * again. Calls are serialized so that concurrent insertions never lose a leaf.
 * <p>
 * Proof verification does not touch stored state at all; see {@link #branchRoot(Hash, List, long)}.
 */
@Singleton
public class MerkleTreeService {

  private static final Logger logger = LoggerFactory.getLogger(MerkleTreeService.class);
  private final MerkleTreeConfiguration configuration;
  private final FrontierStateRepository frontierStateRepository;
  private final ZeroHashes zeroHashes;
  private final ReentrantLock treeUpdateLock;
  private final MeterRegistry meterRegistry;
  private final Counter leavesInsertedCounter;
  private final Counter getFrontierStateCounter;
  private final Counter storeFrontierStateCounter;
  private final Timer insertTimer;
  private final Timer rootTimer;
  private volatile boolean storedStateLoaded;

  public MerkleTreeService(final MerkleTreeConfiguration configuration,
      final FrontierStateRepository frontierStateRepository,
      final MeterRegistry meterRegistry) {
    this.configuration = configuration;
    this.frontierStateRepository = frontierStateRepository;
    this.zeroHashes = ZeroHashes.forDepth(configuration.depth());
    this.treeUpdateLock = new ReentrantLock();
    this.meterRegistry = meterRegistry;
    this.leavesInsertedCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "leavesInserted"));
    this.getFrontierStateCounter = meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "getFrontierState"));
    this.storeFrontierStateCounter =
        meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "storeFrontierState"));
    this.insertTimer = meterRegistry.timer(MetricsUtil.name(MerkleTreeService.class, "insert"));
    this.rootTimer = meterRegistry.timer(MetricsUtil.name(MerkleTreeService.class, "root"));
  }

  /**
   * Checks at startup that the stored frontier can be read and is consistent with the configured depth, so that a
   * corrupt or mismatched store is found before the first caller arrives.
   */
  @PostConstruct
  @VisibleForTesting
  void loadStoredState() throws IOException, MerkleTreeException {
    treeUpdateLock.lock();

    try {
      final Frontier frontier = loadFrontier();
      // computing the root walks every level and rejects a structurally inconsistent branch
      frontier.root(zeroHashes);
      logger.info("Loaded frontier of depth {} with {} leaves", frontier.getDepth(), frontier.getCount());
      storedStateLoaded = true;
    } finally {
      treeUpdateLock.unlock();
    }
  }

  public boolean isHealthy() {
    return true;
  }

  public boolean isReady() {
    return storedStateLoaded;
  }

  /**
   * Appends a leaf to the stored tree.
   *
   * @param leaf the leaf to append
   * @return the frontier after the insertion
   * @throws IOException         if the frontier could not be loaded or stored
   * @throws MerkleTreeException if the tree is full or the stored frontier is corrupt; nothing is stored in either
   *                             case
   */
  public Frontier insert(final Hash leaf) throws IOException, MerkleTreeException {
    treeUpdateLock.lock();
    final Timer.Sample sample = Timer.start();

    try {
      final Frontier frontier = loadFrontier();

      try {
        frontier.insert(leaf);
      } catch (final MerkleTreeException e) {
        meterRegistry.counter(MetricsUtil.name(MerkleTreeService.class, "insertRejected"),
            "error", e.getError().name()).increment();
        logger.warn("Rejected insertion of leaf {} with error code {}: {}", leaf, e.getError().code(), e.getMessage());
        throw e;
      }

      storeFrontier(frontier);
      leavesInsertedCounter.increment();
      logger.debug("Inserted leaf {} at index {}", leaf, frontier.getCount() - 1);

      return frontier;
    } finally {
      treeUpdateLock.unlock();
      sample.stop(insertTimer);
    }
  }

  /**
   * @return the current root of the stored tree
   * @throws IOException         if the frontier could not be loaded
   * @throws MerkleTreeException if the stored frontier is corrupt
   */
  public Hash getRoot() throws IOException, MerkleTreeException {
    treeUpdateLock.lock();
    final Timer.Sample sample = Timer.start();

    try {
      return loadFrontier().root(zeroHashes);
    } finally {
      treeUpdateLock.unlock();
      sample.stop(rootTimer);
    }
  }

  /**
   * @return a copy of the stored frontier, or an empty frontier if nothing has been stored yet
   * @throws IOException         if the frontier could not be loaded
   * @throws MerkleTreeException if the stored frontier could not be decoded
   */
  public Frontier getTree() throws IOException, MerkleTreeException {
    treeUpdateLock.lock();

    try {
      return loadFrontier();
    } finally {
      treeUpdateLock.unlock();
    }
  }

  /**
   * Computes the root implied by an inclusion proof for a tree of the configured depth. Stored state is not consulted.
   *
   * @see ProofVerifier#branchRoot(Hash, List, long, int)
   */
  public Hash branchRoot(final Hash leaf, final List<Hash> proof, final long index) throws InvalidProofException {
    return ProofVerifier.branchRoot(leaf, proof, index, configuration.depth());
  }

  /**
   * Checks an inclusion proof against the current root of the stored tree.
   *
   * @return {@code true} if the proof yields the current root
   * @throws InvalidProofException if the proof is malformed
   * @throws IOException           if the frontier could not be loaded
   * @throws MerkleTreeException   if the stored frontier is corrupt
   */
  public boolean verifyInclusion(final Hash leaf, final List<Hash> proof, final long index)
      throws InvalidProofException, IOException, MerkleTreeException {
    return branchRoot(leaf, proof, index).equals(getRoot());
  }

  private Frontier loadFrontier() throws IOException, MerkleTreeException {
    getFrontierStateCounter.increment();
    final Optional<byte[]> storedState = frontierStateRepository.getSerializedFrontierState();

    if (storedState.isEmpty()) {
      return new Frontier(configuration.depth());
    }

    final FrontierState frontierState;
    try {
      frontierState = FrontierState.parseFrom(storedState.get());
    } catch (final InvalidProtocolBufferException e) {
      logger.error("Stored frontier state could not be parsed", e);
      throw new MerkleTreeException(MerkleTreeError.INVALID_STATE, "Stored frontier state could not be parsed", e);
    }

    return fromFrontierStateProtobuf(frontierState, configuration.depth());
  }

  private void storeFrontier(final Frontier frontier) throws IOException {
    frontierStateRepository.storeSerializedFrontierState(toFrontierStateProtobuf(frontier).toByteArray());
    storeFrontierStateCounter.increment();
  }

  @VisibleForTesting
  static FrontierState toFrontierStateProtobuf(final Frontier frontier) {
    return FrontierState.newBuilder()
        .addAllBranch(frontier.getBranch().stream().map(hash -> ByteString.copyFrom(hash.bytes())).toList())
        // counts never exceed 2^32 - 1, so the narrowing keeps all bits of the unsigned value
        .setCount((int) frontier.getCount())
        .build();
  }

  @VisibleForTesting
  static Frontier fromFrontierStateProtobuf(final FrontierState frontierState, final int depth)
      throws MerkleTreeException {
    try {
      final List<Hash> branch = frontierState.getBranchList().stream()
          .map(bytes -> new Hash(bytes.toByteArray()))
          .toList();
      return new Frontier(depth, branch, Integer.toUnsignedLong(frontierState.getCount()));
    } catch (final IllegalArgumentException e) {
      logger.error("Stored frontier state is inconsistent with a tree of depth {}", depth, e);
      throw new MerkleTreeException(MerkleTreeError.INVALID_STATE,
          "Stored frontier state is inconsistent with a tree of depth " + depth, e);
    }
  }

  @VisibleForTesting
  MerkleTreeConfiguration getConfiguration() {
    return configuration;
  }
}
