// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.Optional;

/// Claims a host value for an extension type by producing its payload, or declines with an empty result.
@FunctionalInterface
public interface ExtensionEncoder {

  Optional<byte[]> encode(Object value) throws MsgPackException;

  /// Claims nothing, for handlers that only decode.
  ExtensionEncoder NONE = value -> Optional.empty();
}
