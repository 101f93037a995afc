// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Arrays;

/// What the decoder does with a map key that is not key-eligible, such as an array, a map, binary data or
/// an unresolved extension. Set via system property `micro.msgpack.UnsupportedKeys`. The default is ERROR.
public enum UnsupportedKeyPolicy {
  /// Fail with [MsgPackException.Kind#UNSUPPORTED_KEY_TYPE].
  ERROR,
  /// Silently drop the key and its value.
  DROP;

  public static UnsupportedKeyPolicy current() {
    final String mode = System.getProperty("micro.msgpack.UnsupportedKeys", "ERROR").toUpperCase();
    try {
      return UnsupportedKeyPolicy.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid unsupported key policy: " + mode + ". Must be one of: " + Arrays.toString(UnsupportedKeyPolicy.values()));
    }
  }
}
