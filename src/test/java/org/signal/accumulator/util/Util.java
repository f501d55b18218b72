/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.util;

import java.security.SecureRandom;
import java.util.List;
import java.util.stream.Stream;
import org.signal.accumulator.Hash;

public class Util {

  public static byte[] generateRandomBytes(final int length) {
    final byte[] bytes = new byte[length];
    new SecureRandom().nextBytes(bytes);
    return bytes;
  }

  public static Hash generateRandomHash() {
    return new Hash(generateRandomBytes(Hash.LENGTH));
  }

  public static List<Hash> generateRandomHashes(final int count) {
    return Stream.generate(Util::generateRandomHash).limit(count).toList();
  }
}
