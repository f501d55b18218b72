/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.protobuf.ByteString;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Named;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.signal.accumulator.storage.FrontierState;
import org.signal.accumulator.storage.FrontierStateRepository;
import org.signal.accumulator.util.Util;

public class MerkleTreeServiceTest {

  private FrontierStateRepository frontierStateRepository;
  private AtomicReference<byte[]> storedState;
  private SimpleMeterRegistry meterRegistry;
  private MerkleTreeService merkleTreeService;

  @BeforeEach
  void setUp() throws IOException, MerkleTreeException {
    frontierStateRepository = mock(FrontierStateRepository.class);
    storedState = new AtomicReference<>();

    when(frontierStateRepository.getSerializedFrontierState())
        .thenAnswer(invocation -> Optional.ofNullable(storedState.get()));
    doAnswer(invocation -> {
      storedState.set(invocation.getArgument(0));
      return null;
    }).when(frontierStateRepository).storeSerializedFrontierState(any());

    meterRegistry = new SimpleMeterRegistry();
    merkleTreeService = new MerkleTreeService(new MerkleTreeConfiguration(Frontier.DEFAULT_DEPTH),
        frontierStateRepository, meterRegistry);
    merkleTreeService.loadStoredState();
  }

  @Test
  void absentStateIsEmptyTree() throws IOException, MerkleTreeException {
    assertTrue(merkleTreeService.isReady());
    assertEquals(new Frontier(), merkleTreeService.getTree());
    assertEquals(new Frontier().root(), merkleTreeService.getRoot());
    verify(frontierStateRepository, never()).storeSerializedFrontierState(any());
  }

  @Test
  void insertPersistsFrontier() throws IOException, MerkleTreeException {
    final List<Hash> leaves = Util.generateRandomHashes(5);
    final Frontier expected = new Frontier();

    for (final Hash leaf : leaves) {
      expected.insert(leaf);
      assertEquals(expected, merkleTreeService.insert(leaf));
    }

    final FrontierState frontierState = FrontierState.parseFrom(storedState.get());
    assertEquals(5, frontierState.getCount());
    assertEquals(expected.getBranch().size(), frontierState.getBranchCount());

    assertEquals(expected, merkleTreeService.getTree());
    assertEquals(new ReferenceMerkleTree(leaves, Frontier.DEFAULT_DEPTH).root(), merkleTreeService.getRoot());
    assertEquals(5.0, meterRegistry.counter("merkleAccumulator.MerkleTreeService.leavesInserted").count());
  }

  @Test
  void resumesFromStoredState() throws IOException, MerkleTreeException {
    final List<Hash> leaves = new ArrayList<>(Util.generateRandomHashes(6));
    for (final Hash leaf : leaves) {
      merkleTreeService.insert(leaf);
    }

    final MerkleTreeService restarted = new MerkleTreeService(new MerkleTreeConfiguration(Frontier.DEFAULT_DEPTH),
        frontierStateRepository, new SimpleMeterRegistry());
    restarted.loadStoredState();

    final Hash nextLeaf = Util.generateRandomHash();
    leaves.add(nextLeaf);
    assertEquals(7, restarted.insert(nextLeaf).getCount());
    assertEquals(new ReferenceMerkleTree(leaves, Frontier.DEFAULT_DEPTH).root(), restarted.getRoot());
  }

  @Test
  void rejectedInsertIsNotPersisted() throws IOException, MerkleTreeException {
    merkleTreeService = new MerkleTreeService(new MerkleTreeConfiguration(2), frontierStateRepository,
        meterRegistry);

    for (final Hash leaf : Util.generateRandomHashes(3)) {
      merkleTreeService.insert(leaf);
    }
    final byte[] fullState = storedState.get();

    final MerkleTreeException e =
        assertThrows(MerkleTreeException.class, () -> merkleTreeService.insert(Util.generateRandomHash()));

    assertEquals(MerkleTreeError.TREE_FULL, e.getError());
    assertArrayEquals(fullState, storedState.get());
    assertEquals(1.0, meterRegistry.counter("merkleAccumulator.MerkleTreeService.insertRejected",
        "error", MerkleTreeError.TREE_FULL.name()).count());
  }

  @ParameterizedTest
  @MethodSource
  void corruptStoredState(final byte[] serializedFrontierState) throws IOException {
    when(frontierStateRepository.getSerializedFrontierState()).thenReturn(Optional.of(serializedFrontierState));

    final MerkleTreeService service = new MerkleTreeService(new MerkleTreeConfiguration(3),
        frontierStateRepository, new SimpleMeterRegistry());

    final MerkleTreeException loadException = assertThrows(MerkleTreeException.class, service::loadStoredState);
    final MerkleTreeException insertException =
        assertThrows(MerkleTreeException.class, () -> service.insert(Util.generateRandomHash()));

    assertEquals(MerkleTreeError.INVALID_STATE, loadException.getError());
    assertEquals(MerkleTreeError.INVALID_STATE, insertException.getError());
    assertFalse(service.isReady());
    verify(frontierStateRepository, never()).storeSerializedFrontierState(any());
  }

  private static Stream<Arguments> corruptStoredState() {
    return Stream.of(
        Arguments.of(Named.named("unparseable", new byte[]{(byte) 0xff, (byte) 0xff, (byte) 0xff})),
        Arguments.of(Named.named("short hash", FrontierState.newBuilder()
            .addBranch(ByteString.copyFrom(Util.generateRandomBytes(31)))
            .setCount(1)
            .build()
            .toByteArray())),
        Arguments.of(Named.named("count beyond capacity", FrontierState.newBuilder()
            .addAllBranch(Util.generateRandomHashes(3).stream().map(hash -> ByteString.copyFrom(hash.bytes())).toList())
            .setCount(8)
            .build()
            .toByteArray())),
        Arguments.of(Named.named("branch deeper than tree", FrontierState.newBuilder()
            .addAllBranch(Util.generateRandomHashes(4).stream().map(hash -> ByteString.copyFrom(hash.bytes())).toList())
            .setCount(3)
            .build()
            .toByteArray())),
        Arguments.of(Named.named("missing subtree", FrontierState.newBuilder()
            .addBranch(ByteString.copyFrom(Util.generateRandomBytes(32)))
            .setCount(3)
            .build()
            .toByteArray()))
    );
  }

  @Test
  void repositoryFailurePropagates() throws IOException {
    when(frontierStateRepository.getSerializedFrontierState()).thenThrow(new IOException("unavailable"));

    assertThrows(IOException.class, () -> merkleTreeService.insert(Util.generateRandomHash()));
    assertThrows(IOException.class, () -> merkleTreeService.getRoot());
  }

  @Test
  void verifyInclusion() throws IOException, MerkleTreeException, InvalidProofException {
    final List<Hash> leaves = Util.generateRandomHashes(9);
    for (final Hash leaf : leaves) {
      merkleTreeService.insert(leaf);
    }
    final ReferenceMerkleTree referenceMerkleTree = new ReferenceMerkleTree(leaves, Frontier.DEFAULT_DEPTH);

    assertTrue(merkleTreeService.verifyInclusion(leaves.get(4), referenceMerkleTree.siblingPath(4), 4));
    assertFalse(merkleTreeService.verifyInclusion(leaves.get(4), referenceMerkleTree.siblingPath(4), 5));
    assertFalse(merkleTreeService.verifyInclusion(Util.generateRandomHash(), referenceMerkleTree.siblingPath(4), 4));
    assertThrows(InvalidProofException.class,
        () -> merkleTreeService.branchRoot(leaves.get(4), referenceMerkleTree.siblingPath(4).subList(0, 16), 4));
  }

  @Test
  void frontierStateRoundTrip() throws MerkleTreeException {
    final Frontier frontier = new Frontier(Frontier.DEFAULT_DEPTH, Util.generateRandomHashes(32), (1L << 32) - 1);

    final Frontier decoded = MerkleTreeService.fromFrontierStateProtobuf(
        MerkleTreeService.toFrontierStateProtobuf(frontier), Frontier.DEFAULT_DEPTH);

    assertEquals(frontier, decoded);
    assertEquals((1L << 32) - 1, decoded.getCount());
  }
}
