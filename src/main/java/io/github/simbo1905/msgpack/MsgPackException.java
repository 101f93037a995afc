// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.IOException;
import java.util.Objects;

/// Failure of a single encode or decode call. Every failure is terminal for the call that raised it.
/// Exceptions thrown by the underlying stream or buffer are never wrapped in this type.
public class MsgPackException extends IOException {

  /// What went wrong.
  public enum Kind {
    /// No bytes at all were available for the field being read.
    EOF,
    /// Some but not all bytes of the field being read were available.
    UNEXPECTED_EOF,
    /// The reserved tag byte `0xc1` was read.
    INVALID_FORMAT,
    DUPLICATE_KEY,
    UNSUPPORTED_KEY_TYPE,
    UNSUPPORTED_EXTENSION_TYPE,
    INVALID_TIMESTAMP,
    /// Nothing in the encode pipeline could turn the value into a wire type.
    UNSUPPORTED_TYPE,
    /// A length or count does not fit the largest wire width (2^32-1) or a Java array.
    TOO_BIG,
    NESTING_TOO_DEEP
  }

  private final Kind kind;

  public MsgPackException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
  }

  public MsgPackException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
  }

  public Kind kind() {
    return kind;
  }

  static MsgPackException eof(long wanted) {
    return new MsgPackException(Kind.EOF, "End of input before reading " + wanted + " byte(s)");
  }

  static MsgPackException unexpectedEof(long wanted, long got) {
    return new MsgPackException(Kind.UNEXPECTED_EOF, "End of input after " + got + " of " + wanted + " byte(s)");
  }

  static MsgPackException tooBig(long length) {
    return new MsgPackException(Kind.TOO_BIG, "Length " + length + " is too big");
  }
}
