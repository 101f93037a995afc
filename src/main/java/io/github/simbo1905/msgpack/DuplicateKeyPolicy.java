// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Arrays;

/// What the decoder does when a map repeats a key. Set via system property `micro.msgpack.DuplicateKeys`.
/// The default is ERROR since decoders that disagree on which duplicate wins can be played against each other.
public enum DuplicateKeyPolicy {
  /// Fail with [MsgPackException.Kind#DUPLICATE_KEY].
  ERROR,
  /// Keep the first entry for the key and drop later ones.
  FIRST_WINS;

  public static DuplicateKeyPolicy current() {
    final String mode = System.getProperty("micro.msgpack.DuplicateKeys", "ERROR").toUpperCase();
    try {
      return DuplicateKeyPolicy.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid duplicate key policy: " + mode + ". Must be one of: " + Arrays.toString(DuplicateKeyPolicy.values()));
    }
  }
}
