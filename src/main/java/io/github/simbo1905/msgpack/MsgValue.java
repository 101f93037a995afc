// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The dynamic value model produced by decoding and accepted by encoding.
/// All variants are nested within this interface. The set is closed as the wire format is fixed.
/// Variants holding a `byte[]` compare by content so that they behave as map keys.
public sealed interface MsgValue permits
    MsgValue.NilValue, MsgValue.BoolValue, MsgValue.IntValue, MsgValue.UIntValue,
    MsgValue.Float32Value, MsgValue.Float64Value, MsgValue.TextValue, MsgValue.BinaryValue,
    MsgValue.ArrayValue, MsgValue.MapValue, MsgValue.ExtensionValue, MsgValue.ResolvedValue {

  NilValue NIL = new NilValue();
  BoolValue TRUE = new BoolValue(true);
  BoolValue FALSE = new BoolValue(false);

  record NilValue() implements MsgValue {
  }

  record BoolValue(boolean value) implements MsgValue {
  }

  /// A signed 64 bit integer. Always encoded with fixint or signed int tags.
  record IntValue(long value) implements MsgValue {
  }

  /// An unsigned 64 bit integer held as its bit pattern in a `long`. Always encoded with uint tags.
  record UIntValue(long value) implements MsgValue {
    @Override
    public String toString() {
      return "UIntValue[value=" + Long.toUnsignedString(value) + "]";
    }
  }

  record Float32Value(float value) implements MsgValue {
  }

  record Float64Value(double value) implements MsgValue {
  }

  /// Text as raw UTF-8 bytes. The bytes are not validated as UTF-8 on decode.
  record TextValue(byte[] utf8) implements MsgValue {
    public TextValue {
      Objects.requireNonNull(utf8, "utf8 must not be null");
    }

    public String string() {
      return new String(utf8, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof TextValue other && Arrays.equals(utf8, other.utf8);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(utf8);
    }

    @Override
    public String toString() {
      return "TextValue[" + string() + "]";
    }
  }

  record BinaryValue(byte[] bytes) implements MsgValue {
    public BinaryValue {
      Objects.requireNonNull(bytes, "bytes must not be null");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BinaryValue other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "BinaryValue" + Arrays.toString(bytes);
    }
  }

  record ArrayValue(List<MsgValue> elements) implements MsgValue {
    public ArrayValue {
      Objects.requireNonNull(elements, "elements must not be null");
    }
  }

  /// A map whose iteration order is the order the entries were decoded or supplied in.
  record MapValue(Map<MsgValue, MsgValue> entries) implements MsgValue {
    public MapValue {
      Objects.requireNonNull(entries, "entries must not be null");
    }
  }

  /// An extension block that no registered handler resolved.
  /// Negative types are reserved for standard extensions; zero and above are for applications.
  record ExtensionValue(byte type, byte[] data) implements MsgValue {
    public ExtensionValue {
      Objects.requireNonNull(data, "data must not be null");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof ExtensionValue other && type == other.type && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return 31 * type + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
      return "ExtensionValue[type=" + type + ", data=" + Arrays.toString(data) + "]";
    }
  }

  /// A host value produced by an extension handler, such as an `Instant` for the timestamp extension.
  /// The codec treats the host object opaquely; on encode it is unwrapped and sent back through the pipeline.
  record ResolvedValue(@NotNull Object host) implements MsgValue {
    public ResolvedValue {
      Objects.requireNonNull(host, "host must not be null");
    }
  }

  static BoolValue bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  static IntValue integer(long value) {
    return new IntValue(value);
  }

  static UIntValue unsigned(long bits) {
    return new UIntValue(bits);
  }

  static TextValue text(String value) {
    return new TextValue(value.getBytes(StandardCharsets.UTF_8));
  }

  static BinaryValue binary(byte[] bytes) {
    return new BinaryValue(bytes);
  }

  static ArrayValue array(MsgValue... elements) {
    return new ArrayValue(List.of(elements));
  }

  static ArrayValue array(List<MsgValue> elements) {
    return new ArrayValue(Collections.unmodifiableList(elements));
  }

  /// @param keysAndValues alternating keys and values, in order
  static MapValue map(MsgValue... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected alternating keys and values but got " + keysAndValues.length + " items");
    }
    final var entries = new LinkedHashMap<MsgValue, MsgValue>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.putIfAbsent(keysAndValues[i], keysAndValues[i + 1]);
    }
    return new MapValue(Collections.unmodifiableMap(entries));
  }

  static ExtensionValue extension(int type, byte[] data) {
    if (type < Byte.MIN_VALUE || type > Byte.MAX_VALUE) {
      throw new IllegalArgumentException("Extension type must be in -128..127, got: " + type);
    }
    return new ExtensionValue((byte) type, data);
  }

  static ResolvedValue resolved(Object host) {
    return new ResolvedValue(host);
  }
}
