// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/// Where the encoder writes. Writes are never rolled back, so after a failure the sink may hold a truncated encoding.
/// Failures of the underlying stream or buffer propagate unchanged.
sealed interface ByteSink permits ByteSink.StreamSink, ByteSink.BufferSink {

  void write(byte[] bytes, int offset, int length) throws IOException;

  default void write(byte[] bytes) throws IOException {
    write(bytes, 0, bytes.length);
  }

  static ByteSink of(OutputStream out) {
    return new StreamSink(out);
  }

  static ByteSink of(ByteBuffer buffer) {
    return new BufferSink(buffer);
  }

  record StreamSink(OutputStream out) implements ByteSink {
    public StreamSink {
      Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
      out.write(bytes, offset, length);
    }
  }

  /// A full buffer surfaces as the buffer's own `BufferOverflowException`.
  record BufferSink(ByteBuffer buffer) implements ByteSink {
    public BufferSink {
      Objects.requireNonNull(buffer, "buffer must not be null");
    }

    @Override
    public void write(byte[] bytes, int offset, int length) {
      buffer.put(bytes, offset, length);
    }
  }
}
