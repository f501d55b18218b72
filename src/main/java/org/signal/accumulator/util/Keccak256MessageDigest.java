/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.util;

import java.security.MessageDigest;
import org.bouncycastle.jcajce.provider.digest.Keccak;

public class Keccak256MessageDigest {

  /**
   * Returns a new {@code MessageDigest} instance that computes Keccak-256 as used by Ethereum, i.e. with the original
   * Keccak padding rather than the NIST SHA3-256 padding. The JDK only ships the latter, so the Bouncy Castle
   * implementation is instantiated directly instead of going through a registered provider.
   *
   * @return a new {@code MessageDigest} instance that uses the Keccak-256 algorithm
   */
  public static MessageDigest getMessageDigest() {
    return new Keccak.Digest256();
  }
}
