// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Arrays;

/// What the decoder does with an extension type no handler is registered for.
/// Set via system property `micro.msgpack.UnknownExtensions`. The default is PASS_THROUGH.
public enum UnknownExtensionPolicy {
  /// Fail with [MsgPackException.Kind#UNSUPPORTED_EXTENSION_TYPE].
  ERROR,
  /// Return the block as a [MsgValue.ExtensionValue] that is not key-eligible.
  PASS_THROUGH;

  public static UnknownExtensionPolicy current() {
    final String mode = System.getProperty("micro.msgpack.UnknownExtensions", "PASS_THROUGH").toUpperCase();
    try {
      return UnknownExtensionPolicy.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid unknown extension policy: " + mode + ". Must be one of: " + Arrays.toString(UnknownExtensionPolicy.values()));
    }
  }
}
