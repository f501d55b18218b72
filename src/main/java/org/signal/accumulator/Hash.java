/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A 32-byte node value in the Merkle accumulator. Leaves, branch entries, zero hashes and roots are all hashes.
 * <p>
 * Hashes are immutable and compared by value; the backing array is copied on the way in and on the way out.
 *
 * @param bytes the raw 32 bytes of the hash
 */
public record Hash(byte[] bytes) {

  public static final int LENGTH = 32;

  /**
   * The all-zero hash, which is also the empty subtree of height 0.
   */
  public static final Hash ZERO = new Hash(new byte[LENGTH]);

  public Hash {
    if (bytes == null) {
      throw new NullPointerException("Hash bytes must not be null");
    } else if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("Hash must be exactly " + LENGTH + " bytes, got " + bytes.length);
    }

    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Hash other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return HexFormat.of().formatHex(bytes);
  }

  /**
   * @param hex 64 hexadecimal characters
   * @return the hash with the given hex encoding
   * @throws IllegalArgumentException if the string is not valid hex or does not encode 32 bytes
   */
  public static Hash fromHex(final String hex) {
    return new Hash(HexFormat.of().parseHex(hex));
  }
}
