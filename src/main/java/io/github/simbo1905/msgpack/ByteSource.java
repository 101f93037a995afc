// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

import static io.github.simbo1905.msgpack.MsgPack.LOGGER;

/// Bounded reader the decoder pulls bytes from.
/// Both reads fail with [MsgPackException.Kind#EOF] when no byte of the requested field is available and with
/// [MsgPackException.Kind#UNEXPECTED_EOF] when only part of it is. Lengths come straight off the wire so
/// implementations never trust them for an up front allocation larger than [#CHUNK_SIZE].
sealed interface ByteSource permits ByteSource.BufferSource, ByteSource.StreamSource {

  /// Largest single allocation made for a length read from the wire.
  int CHUNK_SIZE = 4096;

  /// Largest array the JVM will reliably allocate.
  int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

  byte[] EMPTY = new byte[0];

  /// @return the next byte as an unsigned value in 0..255
  int readByte() throws IOException;

  /// @param length number of bytes, up to 2^32-1
  /// @return a new array the caller owns
  byte[] readExact(long length) throws IOException;

  static ByteSource of(byte[] bytes) {
    return new BufferSource(ByteBuffer.wrap(bytes));
  }

  static ByteSource of(ByteBuffer buffer) {
    return new BufferSource(buffer);
  }

  static ByteSource of(InputStream in) {
    return new StreamSource(in);
  }

  /// Reads from the buffer position onward. As the remaining length is known nothing is allocated
  /// for a field that is not fully present.
  final class BufferSource implements ByteSource {
    private final ByteBuffer buffer;

    BufferSource(ByteBuffer buffer) {
      this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    }

    @Override
    public int readByte() throws MsgPackException {
      if (!buffer.hasRemaining()) {
        throw MsgPackException.eof(1);
      }
      return buffer.get() & 0xff;
    }

    @Override
    public byte[] readExact(long length) throws MsgPackException {
      if (length == 0) {
        return EMPTY;
      }
      final int remaining = buffer.remaining();
      if (remaining == 0) {
        throw MsgPackException.eof(length);
      }
      if (remaining < length) {
        throw MsgPackException.unexpectedEof(length, remaining);
      }
      final byte[] bytes = new byte[(int) length];
      buffer.get(bytes);
      return bytes;
    }
  }

  /// Reads from a stream in chunks of at most [#CHUNK_SIZE] bytes so that a hostile length prefix
  /// only costs memory in proportion to the bytes the stream actually delivers.
  final class StreamSource implements ByteSource {
    private final InputStream in;

    StreamSource(InputStream in) {
      this.in = Objects.requireNonNull(in, "in must not be null");
    }

    @Override
    public int readByte() throws IOException {
      final int b = in.read();
      if (b < 0) {
        throw MsgPackException.eof(1);
      }
      return b;
    }

    @Override
    public byte[] readExact(long length) throws IOException {
      if (length == 0) {
        return EMPTY;
      }
      if (length <= CHUNK_SIZE) {
        final byte[] bytes = new byte[(int) length];
        final int got = readFully(bytes, bytes.length);
        if (got < bytes.length) {
          throw got == 0 ? MsgPackException.eof(length) : MsgPackException.unexpectedEof(length, got);
        }
        return bytes;
      }

      LOGGER.finer(() -> "Reading " + length + " bytes in chunks of " + CHUNK_SIZE);
      final var out = new ByteArrayOutputStream(CHUNK_SIZE);
      final byte[] chunk = new byte[CHUNK_SIZE];
      long total = 0;
      while (total < length) {
        final int wanted = (int) Math.min(CHUNK_SIZE, length - total);
        final int got = readFully(chunk, wanted);
        total += got;
        if (got < wanted) {
          throw total == 0 ? MsgPackException.eof(length) : MsgPackException.unexpectedEof(length, total);
        }
        if (total > MAX_ARRAY_LENGTH) {
          throw MsgPackException.tooBig(length);
        }
        out.write(chunk, 0, got);
      }
      return out.toByteArray();
    }

    private int readFully(byte[] bytes, int length) throws IOException {
      int offset = 0;
      while (offset < length) {
        final int n = in.read(bytes, offset, length - offset);
        if (n < 0) {
          break;
        }
        offset += n;
      }
      return offset;
    }
  }
}
