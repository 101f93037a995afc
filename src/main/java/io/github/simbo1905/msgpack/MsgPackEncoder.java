// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.msgpack.MsgPack.LOGGER;

/// Walks a value tree depth-first writing the canonical, minimal width encoding of each value.
/// One instance serves one call and is then discarded.
final class MsgPackEncoder {

  private final EncodeOptions options;
  private final List<ExtensionHandler> handlers;
  private final ByteSink sink;
  /// Scratch space for a tag plus up to eight bytes of big-endian payload.
  private final byte[] scratch = new byte[9];

  MsgPackEncoder(EncodeOptions options, List<ExtensionHandler> handlers, ByteSink sink) {
    this.options = Objects.requireNonNull(options);
    this.handlers = Objects.requireNonNull(handlers);
    this.sink = Objects.requireNonNull(sink);
  }

  /// Application handlers in registration order followed by the standard handlers when enabled.
  static List<ExtensionHandler> handlerChain(EncodeOptions options) {
    if (!options.standardExtensions()) {
      return options.extensions();
    }
    final var chain = new ArrayList<>(options.extensions());
    chain.addAll(StandardExtensions.ALL);
    return List.copyOf(chain);
  }

  /// Run the transformer pipeline on a value until it is encodable, then write it.
  void encodeObject(Object value, int depth) throws IOException {
    Object current = value;
    // Late transformers that already fired for this value. Each may fire once, so the loop terminates.
    BitSet fired = null;
    while (true) {
      current = unwrap(current);
      for (EncodeTransformer transformer : options.transformers()) {
        current = transformer.transform(current);
      }
      current = unwrap(current);

      if (tryExtension(current)) {
        return;
      }
      if (isCanonical(current)) {
        encodeCanonical(current, depth);
        return;
      }

      final List<EncodeTransformer> late = options.lateTransformers();
      Object next = current;
      for (int i = 0; i < late.size() && next == current; i++) {
        if (fired != null && fired.get(i)) {
          continue;
        }
        next = late.get(i).transform(current);
        if (next != current) {
          if (fired == null) {
            fired = new BitSet(late.size());
          }
          fired.set(i);
          final int index = i;
          final Object from = current;
          LOGGER.fine(() -> "Late transformer " + index + " rewrote " + from.getClass().getName());
        }
      }
      if (next == current) {
        throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_TYPE,
            "Unsupported type for encoding: " + current.getClass().getName());
      }
      current = next;
    }
  }

  private static Object unwrap(Object value) {
    Object current = value;
    while (current instanceof MsgValue.ResolvedValue resolved) {
      current = resolved.host();
    }
    return current;
  }

  /// @return true if an extension handler claimed the value and it was written
  private boolean tryExtension(Object value) throws IOException {
    if (value == null || value instanceof MsgValue) {
      return false;
    }
    for (ExtensionHandler handler : handlers) {
      final var payload = handler.encoder().encode(value);
      if (payload.isPresent()) {
        LOGGER.finer(() -> "Extension type " + handler.type() + " claimed " + value.getClass().getName());
        writeExtension(handler.type(), payload.get());
        return true;
      }
    }
    return false;
  }

  /// Values written directly without any transformation.
  static boolean isCanonical(Object value) {
    return value == null
        || (value instanceof MsgValue && !(value instanceof MsgValue.ResolvedValue))
        || value instanceof Boolean
        || value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
        || value instanceof Float || value instanceof Double
        || value instanceof String || value instanceof byte[]
        || value instanceof List || value instanceof Map;
  }

  private void encodeCanonical(Object value, int depth) throws IOException {
    if (value == null || value instanceof MsgValue.NilValue) {
      writeTag(WireFormat.NIL);
    } else if (value instanceof Boolean b) {
      writeTag(b ? WireFormat.TRUE : WireFormat.FALSE);
    } else if (value instanceof MsgValue.BoolValue b) {
      writeTag(b.value() ? WireFormat.TRUE : WireFormat.FALSE);
    } else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      writeSigned(((Number) value).longValue());
    } else if (value instanceof MsgValue.IntValue i) {
      writeSigned(i.value());
    } else if (value instanceof MsgValue.UIntValue u) {
      writeUnsigned(u.value());
    } else if (value instanceof Float f) {
      writeFloat32(f);
    } else if (value instanceof MsgValue.Float32Value f) {
      writeFloat32(f.value());
    } else if (value instanceof Double d) {
      writeFloat64(d);
    } else if (value instanceof MsgValue.Float64Value d) {
      writeFloat64(d.value());
    } else if (value instanceof String s) {
      writeText(s.getBytes(StandardCharsets.UTF_8));
    } else if (value instanceof MsgValue.TextValue t) {
      writeText(t.utf8());
    } else if (value instanceof byte[] bytes) {
      writeBinary(bytes);
    } else if (value instanceof MsgValue.BinaryValue b) {
      writeBinary(b.bytes());
    } else if (value instanceof List<?> list) {
      writeArray(list, depth);
    } else if (value instanceof MsgValue.ArrayValue a) {
      writeArray(a.elements(), depth);
    } else if (value instanceof Map<?, ?> map) {
      writeMap(map, depth);
    } else if (value instanceof MsgValue.MapValue m) {
      writeMap(m.entries(), depth);
    } else if (value instanceof MsgValue.ExtensionValue e) {
      writeExtension(e.type(), e.data());
    } else {
      throw new AssertionError("Not a canonical value: " + value.getClass().getName());
    }
  }

  private void writeArray(List<?> elements, int depth) throws IOException {
    checkDepth(depth);
    writeArrayPrefix(elements.size());
    for (Object element : elements) {
      encodeObject(element, depth + 1);
    }
  }

  private void writeMap(Map<?, ?> entries, int depth) throws IOException {
    checkDepth(depth);
    writeMapPrefix(entries.size());
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      encodeObject(entry.getKey(), depth + 1);
      encodeObject(entry.getValue(), depth + 1);
    }
  }

  private void checkDepth(int depth) throws MsgPackException {
    if (depth >= options.maxDepth()) {
      throw new MsgPackException(MsgPackException.Kind.NESTING_TOO_DEEP,
          "Containers nested deeper than " + options.maxDepth());
    }
  }

  /// Smallest of positive fixint, negative fixint, int 8/16/32/64. Never a uint tag.
  void writeSigned(long value) throws IOException {
    if (value >= 0 && value <= 0x7f) {
      writeTag(WireFormat.POSITIVE_FIXINT.tag() + (int) value);
    } else if (value >= -32 && value < 0) {
      writeTag((int) value & 0xff);
    } else if (value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE) {
      writeTagged(WireFormat.INT8, value, 1);
    } else if (value >= Short.MIN_VALUE && value <= Short.MAX_VALUE) {
      writeTagged(WireFormat.INT16, value, 2);
    } else if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      writeTagged(WireFormat.INT32, value, 4);
    } else {
      writeTagged(WireFormat.INT64, value, 8);
    }
  }

  /// Smallest of uint 8/16/32/64 for the unsigned bit pattern. Never a fixint or signed tag.
  void writeUnsigned(long bits) throws IOException {
    if (Long.compareUnsigned(bits, 0xffL) <= 0) {
      writeTagged(WireFormat.UINT8, bits, 1);
    } else if (Long.compareUnsigned(bits, 0xffffL) <= 0) {
      writeTagged(WireFormat.UINT16, bits, 2);
    } else if (Long.compareUnsigned(bits, 0xffff_ffffL) <= 0) {
      writeTagged(WireFormat.UINT32, bits, 4);
    } else {
      writeTagged(WireFormat.UINT64, bits, 8);
    }
  }

  private void writeFloat32(float value) throws IOException {
    writeTagged(WireFormat.FLOAT32, Float.floatToRawIntBits(value), 4);
  }

  private void writeFloat64(double value) throws IOException {
    writeTagged(WireFormat.FLOAT64, Double.doubleToRawLongBits(value), 8);
  }

  private void writeText(byte[] utf8) throws IOException {
    final long length = utf8.length;
    if (length <= WireFormat.MAX_FIX_STR) {
      writeTag(WireFormat.FIXSTR.tag() + (int) length);
    } else {
      writeLengthPrefix(length, WireFormat.STR8, WireFormat.STR16, WireFormat.STR32);
    }
    sink.write(utf8);
  }

  private void writeBinary(byte[] bytes) throws IOException {
    writeLengthPrefix(bytes.length, WireFormat.BIN8, WireFormat.BIN16, WireFormat.BIN32);
    sink.write(bytes);
  }

  void writeArrayPrefix(long count) throws IOException {
    if (count <= WireFormat.MAX_FIX_CONTAINER) {
      writeTag(WireFormat.FIXARRAY.tag() + (int) count);
    } else {
      writeLengthPrefix(count, null, WireFormat.ARRAY16, WireFormat.ARRAY32);
    }
  }

  void writeMapPrefix(long count) throws IOException {
    if (count <= WireFormat.MAX_FIX_CONTAINER) {
      writeTag(WireFormat.FIXMAP.tag() + (int) count);
    } else {
      writeLengthPrefix(count, null, WireFormat.MAP16, WireFormat.MAP32);
    }
  }

  /// fixext for payloads of exactly 1, 2, 4, 8 or 16 bytes, otherwise the smallest ext 8/16/32.
  void writeExtension(byte type, byte[] data) throws IOException {
    final long length = data.length;
    final WireFormat fixed = switch (data.length) {
      case 1 -> WireFormat.FIXEXT1;
      case 2 -> WireFormat.FIXEXT2;
      case 4 -> WireFormat.FIXEXT4;
      case 8 -> WireFormat.FIXEXT8;
      case 16 -> WireFormat.FIXEXT16;
      default -> null;
    };
    if (fixed != null) {
      writeTag(fixed);
    } else {
      writeLengthPrefix(length, WireFormat.EXT8, WireFormat.EXT16, WireFormat.EXT32);
    }
    writeTag(type & 0xff);
    sink.write(data);
  }

  /// Write the tag and length for the first width that fits. Containers pass a null `width8` as they have no
  /// 8 bit length form.
  private void writeLengthPrefix(long length, WireFormat width8, WireFormat width16, WireFormat width32)
      throws IOException {
    if (length < 0 || length > WireFormat.MAX_LENGTH) {
      throw MsgPackException.tooBig(length);
    }
    if (width8 != null && length <= 0xff) {
      writeTagged(width8, length, 1);
    } else if (length <= 0xffff) {
      writeTagged(width16, length, 2);
    } else {
      writeTagged(width32, length, 4);
    }
  }

  private void writeTag(WireFormat format) throws IOException {
    writeTag(format.tag());
  }

  private void writeTag(int tag) throws IOException {
    scratch[0] = (byte) tag;
    sink.write(scratch, 0, 1);
  }

  /// Write a tag followed by the low `size` bytes of `value`, big-endian.
  private void writeTagged(WireFormat format, long value, int size) throws IOException {
    scratch[0] = (byte) format.tag();
    for (int i = 0; i < size; i++) {
      scratch[size - i] = (byte) (value >>> (8 * i));
    }
    sink.write(scratch, 0, size + 1);
  }
}
