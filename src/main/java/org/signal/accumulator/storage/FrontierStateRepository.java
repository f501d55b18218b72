/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.storage;

import java.io.IOException;
import java.util.Optional;


/**
 * Stores the serialized frontier of the Merkle accumulator under a single, fixed key. The frontier is read before and
 * written after every mutating call, so the repository always holds the state after the most recent successful
 * insertion.
 */
public interface FrontierStateRepository {

  /**
   * @return the most recently stored serialized frontier state, or empty if nothing has been stored yet
   */
  Optional<byte[]> getSerializedFrontierState() throws IOException;

  /**
   * Store the serialized frontier state, replacing any previously stored state.
   *
   * @param serializedFrontierState the serialized frontier state to persist
   */
  void storeSerializedFrontierState(byte[] serializedFrontierState) throws IOException;
}
