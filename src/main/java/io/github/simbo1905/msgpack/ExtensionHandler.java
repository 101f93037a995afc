// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Objects;

/// Handler for one extension type, pairing the encode side claim with the decode side resolution.
public record ExtensionHandler(
    byte type,
    ExtensionEncoder encoder,
    ExtensionDecoder decoder
) {
  public ExtensionHandler {
    Objects.requireNonNull(encoder, "encoder must not be null");
    Objects.requireNonNull(decoder, "decoder must not be null");
  }

  /// Application extension types are 0..127; negative types are reserved for standard extensions.
  public static ExtensionHandler application(int type, ExtensionEncoder encoder, ExtensionDecoder decoder) {
    if (type < 0 || type > Byte.MAX_VALUE) {
      throw new IllegalArgumentException("Application extension types must be in 0..127, got: " + type);
    }
    return new ExtensionHandler((byte) type, encoder, decoder);
  }

  static ExtensionHandler standard(int type, ExtensionEncoder encoder, ExtensionDecoder decoder) {
    if (type < Byte.MIN_VALUE || type >= 0) {
      throw new IllegalArgumentException("Standard extension types must be in -128..-1, got: " + type);
    }
    return new ExtensionHandler((byte) type, encoder, decoder);
  }

  boolean isStandard() {
    return type < 0;
  }
}
