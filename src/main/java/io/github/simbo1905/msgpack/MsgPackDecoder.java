// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Objects;

import static io.github.simbo1905.msgpack.MsgPack.LOGGER;

/// Recursive descent parser for exactly one value. One instance serves one call and is then discarded.
final class MsgPackDecoder {

  /// Upper bound on the capacity reserved for an array or map from its declared count. Larger containers
  /// grow as elements actually arrive.
  static final int MAX_PREALLOCATED_ELEMENTS = 1000;

  private final DecodeOptions options;
  private final ExtensionHandler[] handlers;
  private final ByteSource source;

  MsgPackDecoder(DecodeOptions options, ExtensionHandler[] handlers, ByteSource source) {
    this.options = Objects.requireNonNull(options);
    this.handlers = Objects.requireNonNull(handlers);
    this.source = Objects.requireNonNull(source);
  }

  /// Index the handlers by the unsigned value of their type byte.
  static ExtensionHandler[] handlerTable(DecodeOptions options) {
    final var table = new ExtensionHandler[256];
    options.extensions().forEach(handler -> table[handler.type() & 0xff] = handler);
    if (options.standardExtensions()) {
      StandardExtensions.ALL.forEach(handler -> table[handler.type() & 0xff] = handler);
    }
    return table;
  }

  /// Decode one value and run the post-decode transformers over it.
  Decoded decodeObject(int depth) throws IOException {
    Decoded decoded = decodeStandardObject(depth);
    for (DecodeTransformer transformer : options.transformers()) {
      decoded = Objects.requireNonNull(transformer.transform(decoded), "Decode transformer returned null");
    }
    return decoded;
  }

  private Decoded decodeStandardObject(int depth) throws IOException {
    final int tag = source.readByte();
    final WireFormat format = WireFormat.of(tag);
    if (format == null) {
      throw new AssertionError("No wire format for tag 0x" + Integer.toHexString(tag));
    }
    LOGGER.finer(() -> "Read tag 0x" + Integer.toHexString(tag) + " " + format + " at depth " + depth);
    return switch (format) {
      case POSITIVE_FIXINT -> Decoded.key(MsgValue.integer(tag));
      case NEGATIVE_FIXINT -> Decoded.key(MsgValue.integer((byte) tag));
      case FIXMAP -> decodeMap(format.payloadBits(tag), depth);
      case FIXARRAY -> decodeArray(format.payloadBits(tag), depth);
      case FIXSTR -> decodeText(format.payloadBits(tag));
      case NIL -> Decoded.key(MsgValue.NIL);
      case NEVER_USED -> throw new MsgPackException(MsgPackException.Kind.INVALID_FORMAT, "Invalid format byte 0xc1");
      case FALSE -> Decoded.key(MsgValue.bool(false));
      case TRUE -> Decoded.key(MsgValue.bool(true));
      case BIN8 -> decodeBinary(readUint8());
      case BIN16 -> decodeBinary(readUint16());
      case BIN32 -> decodeBinary(readUint32());
      case EXT8 -> decodeExtension(readUint8());
      case EXT16 -> decodeExtension(readUint16());
      case EXT32 -> decodeExtension(readUint32());
      case FLOAT32 -> Decoded.key(new MsgValue.Float32Value(Float.intBitsToFloat(readFixed(Integer.BYTES).getInt())));
      case FLOAT64 -> Decoded.key(new MsgValue.Float64Value(Double.longBitsToDouble(readFixed(Long.BYTES).getLong())));
      case UINT8 -> Decoded.key(MsgValue.unsigned(readUint8()));
      case UINT16 -> Decoded.key(MsgValue.unsigned(readUint16()));
      case UINT32 -> Decoded.key(MsgValue.unsigned(readUint32()));
      case UINT64 -> Decoded.key(MsgValue.unsigned(readFixed(Long.BYTES).getLong()));
      // Casting narrows first so that widening back to long sign-extends.
      case INT8 -> Decoded.key(MsgValue.integer((byte) source.readByte()));
      case INT16 -> Decoded.key(MsgValue.integer(readFixed(Short.BYTES).getShort()));
      case INT32 -> Decoded.key(MsgValue.integer(readFixed(Integer.BYTES).getInt()));
      case INT64 -> Decoded.key(MsgValue.integer(readFixed(Long.BYTES).getLong()));
      case FIXEXT1 -> decodeExtension(1);
      case FIXEXT2 -> decodeExtension(2);
      case FIXEXT4 -> decodeExtension(4);
      case FIXEXT8 -> decodeExtension(8);
      case FIXEXT16 -> decodeExtension(16);
      case STR8 -> decodeText(readUint8());
      case STR16 -> decodeText(readUint16());
      case STR32 -> decodeText(readUint32());
      case ARRAY16 -> decodeArray(readUint16(), depth);
      case ARRAY32 -> decodeArray(readUint32(), depth);
      case MAP16 -> decodeMap(readUint16(), depth);
      case MAP32 -> decodeMap(readUint32(), depth);
    };
  }

  private Decoded decodeMap(long count, int depth) throws IOException {
    checkDepth(depth);
    LOGGER.finer(() -> "Decoding map of " + count + " entries at depth " + depth);
    final var entries = new LinkedHashMap<MsgValue, MsgValue>(initialCapacity(count));
    for (long i = 0; i < count; i++) {
      // Always decode both the key and the value, even if the pair will be rejected or dropped,
      // so that the source is positioned at the next entry.
      final Decoded key = decodeObject(depth + 1);
      final Decoded value = decodeObject(depth + 1);
      if (!key.keyEligible()) {
        if (options.unsupportedKeys() == UnsupportedKeyPolicy.ERROR) {
          throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_KEY_TYPE,
              "Unsupported map key type: " + key.value().getClass().getSimpleName());
        }
        LOGGER.fine(() -> "Dropping map entry with unsupported key type " + key.value().getClass().getSimpleName());
      } else if (entries.containsKey(key.value())) {
        if (options.duplicateKeys() == DuplicateKeyPolicy.ERROR) {
          throw new MsgPackException(MsgPackException.Kind.DUPLICATE_KEY, "Duplicate map key: " + key.value());
        }
        LOGGER.fine(() -> "Keeping first entry for duplicate map key " + key.value());
      } else {
        entries.put(key.value(), value.value());
      }
    }
    return Decoded.notKey(new MsgValue.MapValue(Collections.unmodifiableMap(entries)));
  }

  private Decoded decodeArray(long count, int depth) throws IOException {
    checkDepth(depth);
    LOGGER.finer(() -> "Decoding array of " + count + " elements at depth " + depth);
    final var elements = new ArrayList<MsgValue>(initialCapacity(count));
    for (long i = 0; i < count; i++) {
      elements.add(decodeObject(depth + 1).value());
    }
    return Decoded.notKey(MsgValue.array(elements));
  }

  /// Text is not validated as UTF-8.
  private Decoded decodeText(long length) throws IOException {
    return Decoded.key(new MsgValue.TextValue(source.readExact(length)));
  }

  private Decoded decodeBinary(long length) throws IOException {
    return Decoded.notKey(new MsgValue.BinaryValue(source.readExact(length)));
  }

  private Decoded decodeExtension(long length) throws IOException {
    final byte type = (byte) source.readByte();
    final byte[] payload = source.readExact(length);
    final ExtensionHandler handler = handlers[type & 0xff];
    if (handler != null) {
      LOGGER.finer(() -> "Resolving extension type " + type + " with " + length + " byte payload");
      return Objects.requireNonNull(handler.decoder().decode(payload), "Extension decoder returned null for type " + type);
    }
    if (options.unknownExtensions() == UnknownExtensionPolicy.ERROR) {
      throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_EXTENSION_TYPE, "Unsupported extension type " + type);
    }
    return Decoded.notKey(new MsgValue.ExtensionValue(type, payload));
  }

  private void checkDepth(int depth) throws MsgPackException {
    if (depth >= options.maxDepth()) {
      throw new MsgPackException(MsgPackException.Kind.NESTING_TOO_DEEP,
          "Containers nested deeper than " + options.maxDepth());
    }
  }

  private long readUint8() throws IOException {
    return source.readByte();
  }

  private long readUint16() throws IOException {
    return Short.toUnsignedLong(readFixed(Short.BYTES).getShort());
  }

  private long readUint32() throws IOException {
    return Integer.toUnsignedLong(readFixed(Integer.BYTES).getInt());
  }

  /// Big-endian view over exactly `size` freshly read bytes.
  private ByteBuffer readFixed(int size) throws IOException {
    return ByteBuffer.wrap(source.readExact(size));
  }

  private static int initialCapacity(long count) {
    return (int) Math.min(count, MAX_PREALLOCATED_ELEMENTS);
  }
}
