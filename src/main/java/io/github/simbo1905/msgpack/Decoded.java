// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Objects;

/// A decoded value together with whether it may be used as a map key.
public record Decoded(MsgValue value, boolean keyEligible) {
  public Decoded {
    Objects.requireNonNull(value, "value must not be null");
  }

  public static Decoded key(MsgValue value) {
    return new Decoded(value, true);
  }

  public static Decoded notKey(MsgValue value) {
    return new Decoded(value, false);
  }
}
