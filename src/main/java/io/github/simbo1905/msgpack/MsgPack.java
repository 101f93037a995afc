// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.logging.Logger;

/// Entry point for encoding host values to MessagePack and decoding MessagePack to [MsgValue] trees.
/// Instances are immutable and may be shared between threads. Every call works on its own source or sink.
public sealed interface MsgPack permits Codec {

  Logger LOGGER = Logger.getLogger(MsgPack.class.getName());

  /// A codec with [EncodeOptions#defaults()] and [DecodeOptions#defaults()].
  static MsgPack standard() {
    return of(EncodeOptions.defaults(), DecodeOptions.defaults());
  }

  static MsgPack of(EncodeOptions encodeOptions, DecodeOptions decodeOptions) {
    return new Codec(encodeOptions, decodeOptions);
  }

  EncodeOptions encodeOptions();

  DecodeOptions decodeOptions();

  /// Encode a value into a new array.
  /// @param value `null`, a boxed primitive, `String`, `byte[]`, `List`, `Map`, a [MsgValue], or anything the
  ///              configured extensions and transformers can turn into one of those
  byte[] encode(Object value) throws IOException;

  /// Encode a value onto a stream. Nothing is flushed or closed.
  void encode(OutputStream out, Object value) throws IOException;

  /// Encode a value into a buffer from its position, advancing it.
  /// @return the number of bytes written
  int encode(ByteBuffer buffer, Object value) throws IOException;

  /// Decode exactly one value. Trailing bytes are ignored.
  MsgValue decode(byte[] bytes) throws IOException;

  /// Decode exactly one value from the buffer's position, leaving the position after the value.
  MsgValue decode(ByteBuffer buffer) throws IOException;

  /// Decode exactly one value, reading no further than its last byte.
  MsgValue decode(InputStream in) throws IOException;

  /// Like [#decode(byte[])] but also reports whether the value may be used as a map key.
  Decoded decodeWithKeyEligibility(byte[] bytes) throws IOException;
}
