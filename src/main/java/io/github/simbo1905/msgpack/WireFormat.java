// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.msgpack;

/// The MessagePack formats, each owning a contiguous range of tag bytes.
/// Every one of the 256 tag byte values belongs to exactly one format.
enum WireFormat {
  POSITIVE_FIXINT(0x00, 0x7f),
  FIXMAP(0x80, 0x8f),
  FIXARRAY(0x90, 0x9f),
  FIXSTR(0xa0, 0xbf),
  NIL(0xc0),
  NEVER_USED(0xc1),
  FALSE(0xc2),
  TRUE(0xc3),
  BIN8(0xc4),
  BIN16(0xc5),
  BIN32(0xc6),
  EXT8(0xc7),
  EXT16(0xc8),
  EXT32(0xc9),
  FLOAT32(0xca),
  FLOAT64(0xcb),
  UINT8(0xcc),
  UINT16(0xcd),
  UINT32(0xce),
  UINT64(0xcf),
  INT8(0xd0),
  INT16(0xd1),
  INT32(0xd2),
  INT64(0xd3),
  FIXEXT1(0xd4),
  FIXEXT2(0xd5),
  FIXEXT4(0xd6),
  FIXEXT8(0xd7),
  FIXEXT16(0xd8),
  STR8(0xd9),
  STR16(0xda),
  STR32(0xdb),
  ARRAY16(0xdc),
  ARRAY32(0xdd),
  MAP16(0xde),
  MAP32(0xdf),
  NEGATIVE_FIXINT(0xe0, 0xff);

  /// Largest count a fixmap or fixarray tag can carry.
  static final int MAX_FIX_CONTAINER = 0x0f;
  /// Largest byte length a fixstr tag can carry.
  static final int MAX_FIX_STR = 0x1f;
  /// Largest length any of the 8/16/32 bit prefixes can carry.
  static final long MAX_LENGTH = 0xffff_ffffL;

  private static final WireFormat[] BY_TAG = new WireFormat[256];

  static {
    for (WireFormat format : values()) {
      for (int tag = format.first; tag <= format.last; tag++) {
        assert BY_TAG[tag] == null : "Overlapping tag ranges at 0x" + Integer.toHexString(tag);
        BY_TAG[tag] = format;
      }
    }
  }

  private final int first;
  private final int last;

  WireFormat(int tag) {
    this(tag, tag);
  }

  WireFormat(int first, int last) {
    this.first = first;
    this.last = last;
  }

  /// The tag byte, or the first tag byte of a range.
  int tag() {
    return first;
  }

  /// The bits of a tag byte that belong to the payload for fix formats.
  int payloadBits(int tag) {
    return tag - first;
  }

  /// @param tag an unsigned tag byte in 0..255
  /// @return the format owning the tag, or null only if the table is inconsistent
  static WireFormat of(int tag) {
    return BY_TAG[tag & 0xff];
  }
}
