// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/// Holds the options and the extension lookups built from them. A fresh encoder or decoder is built per call.
final class Codec implements MsgPack {

  private final EncodeOptions encodeOptions;
  private final DecodeOptions decodeOptions;
  private final List<ExtensionHandler> encodeHandlers;
  private final ExtensionHandler[] decodeHandlers;

  Codec(EncodeOptions encodeOptions, DecodeOptions decodeOptions) {
    this.encodeOptions = Objects.requireNonNull(encodeOptions, "encodeOptions must not be null");
    this.decodeOptions = Objects.requireNonNull(decodeOptions, "decodeOptions must not be null");
    this.encodeHandlers = MsgPackEncoder.handlerChain(encodeOptions);
    this.decodeHandlers = MsgPackDecoder.handlerTable(decodeOptions);
    LOGGER.fine(() -> "Built codec with " + encodeHandlers.size() + " encode extension handler(s), "
        + decodeOptions.duplicateKeys() + " duplicate keys, " + decodeOptions.unsupportedKeys()
        + " unsupported keys, " + decodeOptions.unknownExtensions() + " unknown extensions");
  }

  @Override
  public EncodeOptions encodeOptions() {
    return encodeOptions;
  }

  @Override
  public DecodeOptions decodeOptions() {
    return decodeOptions;
  }

  @Override
  public byte[] encode(Object value) throws IOException {
    final var out = new ByteArrayOutputStream();
    encode(ByteSink.of(out), value);
    return out.toByteArray();
  }

  @Override
  public void encode(OutputStream out, Object value) throws IOException {
    encode(ByteSink.of(Objects.requireNonNull(out, "out must not be null")), value);
  }

  @Override
  public int encode(ByteBuffer buffer, Object value) throws IOException {
    Objects.requireNonNull(buffer, "buffer must not be null");
    final int start = buffer.position();
    encode(ByteSink.of(buffer), value);
    return buffer.position() - start;
  }

  private void encode(ByteSink sink, Object value) throws IOException {
    new MsgPackEncoder(encodeOptions, encodeHandlers, sink).encodeObject(value, 0);
  }

  @Override
  public MsgValue decode(byte[] bytes) throws IOException {
    return decodeWithKeyEligibility(bytes).value();
  }

  @Override
  public MsgValue decode(ByteBuffer buffer) throws IOException {
    return decode(ByteSource.of(Objects.requireNonNull(buffer, "buffer must not be null"))).value();
  }

  @Override
  public MsgValue decode(InputStream in) throws IOException {
    return decode(ByteSource.of(Objects.requireNonNull(in, "in must not be null"))).value();
  }

  @Override
  public Decoded decodeWithKeyEligibility(byte[] bytes) throws IOException {
    return decode(ByteSource.of(Objects.requireNonNull(bytes, "bytes must not be null")));
  }

  private Decoded decode(ByteSource source) throws IOException {
    return new MsgPackDecoder(decodeOptions, decodeHandlers, source).decodeObject(0);
  }

  @Override
  public String toString() {
    return "Codec[encodeOptions=" + encodeOptions + ", decodeOptions=" + decodeOptions + "]";
  }
}
