// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.github.simbo1905.msgpack.MsgPack.LOGGER;

/// The extension types defined by the MessagePack specification itself. These use negative type numbers.
public final class StandardExtensions {

  public static final int TIMESTAMP_TYPE = -1;

  static final long NANOS_PER_SECOND = 1_000_000_000L;
  /// Seconds that fit the 34 bit field of timestamp 64.
  static final long MAX_SECONDS_64 = (1L << 34) - 1;
  static final long MAX_SECONDS_32 = 0xffff_ffffL;

  /// Timestamp: `Instant` to the smallest of timestamp 32, 64 or 96, and back to a key-eligible
  /// [MsgValue.ResolvedValue] holding an `Instant`.
  public static final ExtensionHandler TIMESTAMP = ExtensionHandler.standard(TIMESTAMP_TYPE,
      StandardExtensions::encodeTimestamp,
      StandardExtensions::decodeTimestamp);

  /// The handlers consulted when standard extensions are enabled.
  public static final List<ExtensionHandler> ALL = List.of(TIMESTAMP);

  private StandardExtensions() {
  }

  static Optional<byte[]> encodeTimestamp(Object value) {
    if (!(value instanceof Instant instant)) {
      return Optional.empty();
    }
    final long seconds = instant.getEpochSecond();
    final int nanos = instant.getNano();
    if (seconds >= 0 && seconds <= MAX_SECONDS_64) {
      if (nanos == 0 && seconds <= MAX_SECONDS_32) {
        return Optional.of(ByteBuffer.allocate(4).putInt((int) seconds).array());
      }
      final long packed = ((long) nanos << 34) | seconds;
      return Optional.of(ByteBuffer.allocate(8).putLong(packed).array());
    }
    return Optional.of(ByteBuffer.allocate(12).putInt(nanos).putLong(seconds).array());
  }

  static Decoded decodeTimestamp(byte[] payload) throws MsgPackException {
    final var buffer = ByteBuffer.wrap(payload);
    final long seconds;
    final long nanos;
    switch (payload.length) {
      case 4 -> {
        seconds = Integer.toUnsignedLong(buffer.getInt());
        nanos = 0;
      }
      case 8 -> {
        final long packed = buffer.getLong();
        nanos = packed >>> 34;
        seconds = packed & MAX_SECONDS_64;
      }
      case 12 -> {
        nanos = Integer.toUnsignedLong(buffer.getInt());
        seconds = buffer.getLong();
      }
      default -> throw new MsgPackException(MsgPackException.Kind.INVALID_TIMESTAMP,
          "Timestamp payload must be 4, 8 or 12 bytes, got " + payload.length);
    }
    if (nanos >= NANOS_PER_SECOND) {
      throw new MsgPackException(MsgPackException.Kind.INVALID_TIMESTAMP, "Timestamp nanoseconds out of range: " + nanos);
    }
    try {
      final Instant instant = Instant.ofEpochSecond(seconds, nanos);
      LOGGER.finer(() -> "Decoded timestamp " + instant + " from " + payload.length + " bytes");
      return Decoded.key(MsgValue.resolved(instant));
    } catch (DateTimeException e) {
      throw new MsgPackException(MsgPackException.Kind.INVALID_TIMESTAMP, "Timestamp seconds out of range: " + seconds, e);
    }
  }
}
