// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class MsgPackDecoderTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// Explicit policies so that system properties on the test JVM cannot change the outcome.
  static final DecodeOptions STRICT = DecodeOptions.defaults()
      .withDuplicateKeys(DuplicateKeyPolicy.ERROR)
      .withUnsupportedKeys(UnsupportedKeyPolicy.ERROR)
      .withUnknownExtensions(UnknownExtensionPolicy.PASS_THROUGH);

  static byte[] bytes(int... values) {
    final byte[] result = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = (byte) values[i];
    }
    return result;
  }

  static MsgValue decode(DecodeOptions options, int... encoded) throws IOException {
    return MsgPack.of(EncodeOptions.defaults(), options).decode(bytes(encoded));
  }

  static MsgValue decode(int... encoded) throws IOException {
    return decode(STRICT, encoded);
  }

  static MsgPackException.Kind failure(DecodeOptions options, int... encoded) {
    try {
      decode(options, encoded);
    } catch (MsgPackException e) {
      return e.kind();
    } catch (IOException e) {
      throw new AssertionError("Expected a MsgPackException", e);
    }
    throw new AssertionError("Expected decoding " + Arrays.toString(encoded) + " to fail");
  }

  static MsgPackException.Kind failure(int... encoded) {
    return failure(STRICT, encoded);
  }

  @Test
  void fixedTags() throws IOException {
    assertEquals(MsgValue.NIL, decode(0xc0));
    assertEquals(MsgValue.FALSE, decode(0xc2));
    assertEquals(MsgValue.TRUE, decode(0xc3));
    assertSame(MsgValue.bool(true), decode(0xc3));
    assertSame(MsgValue.bool(false), decode(0xc2));
    assertEquals(MsgValue.integer(0), decode(0x00));
    assertEquals(MsgValue.integer(127), decode(0x7f));
    assertEquals(MsgValue.integer(-32), decode(0xe0));
    assertEquals(MsgValue.integer(-1), decode(0xff));
  }

  @Test
  void signedIntegersAreSignExtended() throws IOException {
    assertEquals(MsgValue.integer(-128), decode(0xd0, 0x80));
    assertEquals(MsgValue.integer(-256), decode(0xd1, 0xff, 0x00));
    assertEquals(MsgValue.integer(Integer.MIN_VALUE), decode(0xd2, 0x80, 0x00, 0x00, 0x00));
    assertEquals(MsgValue.integer(Long.MIN_VALUE), decode(0xd3, 0x80, 0, 0, 0, 0, 0, 0, 0));
    assertEquals(MsgValue.integer(1), decode(0xd3, 0, 0, 0, 0, 0, 0, 0, 1));
  }

  @Test
  void unsignedIntegersStayUnsigned() throws IOException {
    assertEquals(MsgValue.unsigned(255), decode(0xcc, 0xff));
    assertEquals(MsgValue.unsigned(65535), decode(0xcd, 0xff, 0xff));
    assertEquals(MsgValue.unsigned(0xffff_ffffL), decode(0xce, 0xff, 0xff, 0xff, 0xff));
    final var max = decode(0xcf, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff);
    assertThat(max).isEqualTo(MsgValue.unsigned(-1L));
    assertThat(max.toString()).contains("18446744073709551615");
  }

  @Test
  void floatsKeepTheirWidth() throws IOException {
    assertEquals(new MsgValue.Float32Value(1.5f), decode(0xca, 0x3f, 0xc0, 0x00, 0x00));
    assertEquals(new MsgValue.Float64Value(4.5), decode(0xcb, 0x40, 0x12, 0, 0, 0, 0, 0, 0));
  }

  @Test
  void textAndBinary() throws IOException {
    assertEquals(MsgValue.text("foo"), decode(0xa3, 0x66, 0x6f, 0x6f));
    assertEquals(MsgValue.text(""), decode(0xa0));
    assertEquals(MsgValue.text(""), decode(0xd9, 0x00));
    assertEquals(MsgValue.text("a"), decode(0xda, 0x00, 0x01, 0x61));
    assertEquals(MsgValue.binary(new byte[]{1, 2}), decode(0xc4, 0x02, 0x01, 0x02));
    assertEquals(MsgValue.binary(new byte[0]), decode(0xc6, 0, 0, 0, 0));
  }

  @Test
  void invalidUtf8IsNotRejected() throws IOException {
    final var value = decode(0xa2, 0xc3, 0x28);
    assertThat(value).isInstanceOf(MsgValue.TextValue.class);
    assertThat(((MsgValue.TextValue) value).utf8()).containsExactly((byte) 0xc3, (byte) 0x28);
  }

  @Test
  void neverUsedTagIsInvalid() {
    assertEquals(MsgPackException.Kind.INVALID_FORMAT, failure(0xc1));
    assertEquals(MsgPackException.Kind.INVALID_FORMAT, failure(0x91, 0xc1));
  }

  @Test
  void truncationIsReportedPerField() {
    assertEquals(MsgPackException.Kind.EOF, failure());
    assertEquals(MsgPackException.Kind.EOF, failure(0xd0));
    assertEquals(MsgPackException.Kind.EOF, failure(0xd1));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xd1, 0x00));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xcf, 0, 0, 0, 0, 0, 0, 0));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xca, 0x00, 0x00, 0x00));
    assertEquals(MsgPackException.Kind.EOF, failure(0xa1));
    assertEquals(MsgPackException.Kind.EOF, failure(0xd9, 0x01));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xd9, 0x02, 0x00));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xda, 0x00));
    assertEquals(MsgPackException.Kind.EOF, failure(0xdb, 0x00, 0x00, 0x00, 0x01));
    assertEquals(MsgPackException.Kind.EOF, failure(0xc4, 0x01));
    assertEquals(MsgPackException.Kind.EOF, failure(0xd4));
    assertEquals(MsgPackException.Kind.EOF, failure(0xd4, 0x05));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xd5, 0x05, 0x00));
    // The missing element is a whole field of its own.
    assertEquals(MsgPackException.Kind.EOF, failure(0x92, 0x01));
  }

  @Test
  void hostileLengthsFailWithoutHugeAllocation() throws IOException {
    assertEquals(MsgPackException.Kind.EOF, failure(0xdb, 0xff, 0xff, 0xff, 0xff));
    assertEquals(MsgPackException.Kind.UNEXPECTED_EOF, failure(0xc6, 0xff, 0xff, 0xff, 0xff, 0x00));
    assertEquals(MsgPackException.Kind.EOF, failure(0xdd, 0xff, 0xff, 0xff, 0xff, 0x01));
    assertEquals(MsgPackException.Kind.EOF, failure(0xdf, 0xff, 0xff, 0xff, 0xff, 0x01, 0x01));

    final var codec = MsgPack.of(EncodeOptions.defaults(), STRICT);
    final byte[] hostile = bytes(0xc6, 0xff, 0xff, 0xff, 0xff, 1, 2, 3);
    assertThatThrownBy(() -> codec.decode(new ByteArrayInputStream(hostile)))
        .isInstanceOfSatisfying(MsgPackException.class,
            e -> assertThat(e.kind()).isEqualTo(MsgPackException.Kind.UNEXPECTED_EOF));
  }

  @Test
  void containersPreserveOrder() throws IOException {
    final var decoded = decode(0x93, 0x81, 0xa3, 0x66, 0x6f, 0x6f, 0xa3, 0x62, 0x61, 0x72, 0x7b,
        0xcb, 0x40, 0x12, 0, 0, 0, 0, 0, 0);
    assertEquals(MsgValue.array(
        MsgValue.map(MsgValue.text("foo"), MsgValue.text("bar")),
        MsgValue.integer(123),
        new MsgValue.Float64Value(4.5)), decoded);

    final var map = (MsgValue.MapValue) decode(0x83, 0x03, 0xc0, 0x01, 0xc0, 0x02, 0xc0);
    assertThat(map.entries().keySet()).containsExactly(MsgValue.integer(3), MsgValue.integer(1), MsgValue.integer(2));
  }

  @Test
  void decodedContainersAreImmutable() throws IOException {
    final var array = (MsgValue.ArrayValue) decode(0x91, 0x01);
    assertThatThrownBy(() -> array.elements().add(MsgValue.NIL)).isInstanceOf(UnsupportedOperationException.class);
    final var map = (MsgValue.MapValue) decode(0x81, 0x01, 0x01);
    assertThatThrownBy(() -> map.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void unsupportedKeysFollowThePolicy() throws IOException {
    // {bin[0]: 1}, {[]: 1}, {{}: 1}
    assertEquals(MsgPackException.Kind.UNSUPPORTED_KEY_TYPE, failure(0x81, 0xc4, 0x01, 0x00, 0x01));
    assertEquals(MsgPackException.Kind.UNSUPPORTED_KEY_TYPE, failure(0x81, 0x90, 0x01));
    assertEquals(MsgPackException.Kind.UNSUPPORTED_KEY_TYPE, failure(0x81, 0x80, 0x01));
    // An unresolved extension is not a key either.
    assertEquals(MsgPackException.Kind.UNSUPPORTED_KEY_TYPE, failure(0x81, 0xd4, 0x05, 0xaa, 0x01));

    final var dropping = STRICT.withUnsupportedKeys(UnsupportedKeyPolicy.DROP);
    assertEquals(MsgValue.map(MsgValue.integer(2), MsgValue.integer(3)),
        decode(dropping, 0x82, 0xc4, 0x01, 0x00, 0x01, 0x02, 0x03));
  }

  @Test
  void resolvedTimestampIsAKey() throws IOException {
    final var decoded = decode(0x81, 0xd6, 0xff, 0x00, 0x00, 0x00, 0x01, 0x01);
    assertEquals(MsgValue.map(MsgValue.resolved(Instant.ofEpochSecond(1)), MsgValue.integer(1)), decoded);
  }

  @Test
  void duplicateKeysFollowThePolicy() throws IOException {
    // {1: "a", 1: "b"}
    final int[] duplicated = {0x82, 0x01, 0xa1, 0x61, 0x01, 0xa1, 0x62};
    assertEquals(MsgPackException.Kind.DUPLICATE_KEY, failure(duplicated));
    assertEquals(MsgValue.map(MsgValue.integer(1), MsgValue.text("a")),
        decode(STRICT.withDuplicateKeys(DuplicateKeyPolicy.FIRST_WINS), duplicated));
    // Signed and unsigned one are different keys.
    assertThat(((MsgValue.MapValue) decode(0x82, 0x01, 0xc0, 0xcc, 0x01, 0xc0)).entries()).hasSize(2);
  }

  @Test
  void floatKeysCompareByBitPattern() throws IOException {
    // {NaN: 1, NaN: 2}
    final int[] nanKeys = {0x82,
        0xcb, 0x7f, 0xf8, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x01,
        0xcb, 0x7f, 0xf8, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x02};
    assertEquals(MsgPackException.Kind.DUPLICATE_KEY, failure(nanKeys));
    assertEquals(MsgValue.map(new MsgValue.Float64Value(Double.NaN), MsgValue.integer(1)),
        decode(STRICT.withDuplicateKeys(DuplicateKeyPolicy.FIRST_WINS), nanKeys));
    // {0.0: 1, -0.0: 2}
    final var signedZeros = (MsgValue.MapValue) decode(0x82,
        0xcb, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x01,
        0xcb, 0x80, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x02);
    assertThat(signedZeros.entries())
        .hasSize(2)
        .containsEntry(new MsgValue.Float64Value(0.0), MsgValue.integer(1))
        .containsEntry(new MsgValue.Float64Value(-0.0), MsgValue.integer(2));
  }

  @Test
  void valueIsReadBeforeTheKeyIsJudged() {
    // {1: 1, 1: <missing>} runs out of input before the duplicate is noticed.
    assertEquals(MsgPackException.Kind.EOF, failure(0x82, 0x01, 0x01, 0x01));
    assertEquals(MsgPackException.Kind.EOF, failure(0x81, 0xc4, 0x00));
  }

  @Test
  void unknownExtensionsFollowThePolicy() throws IOException {
    assertEquals(MsgValue.extension(5, new byte[]{(byte) 0xaa}), decode(0xd4, 0x05, 0xaa));
    assertEquals(MsgValue.extension(-100, new byte[0]), decode(0xc7, 0x00, 0x9c));
    assertEquals(MsgPackException.Kind.UNSUPPORTED_EXTENSION_TYPE,
        failure(STRICT.withUnknownExtensions(UnknownExtensionPolicy.ERROR), 0xd4, 0x05, 0xaa));
  }

  @Test
  void timestampPassesThroughWhenStandardExtensionsAreOff() throws IOException {
    final var decoded = decode(STRICT.withStandardExtensions(false), 0xd6, 0xff, 0x00, 0x00, 0x00, 0x01);
    assertEquals(MsgValue.extension(-1, new byte[]{0, 0, 0, 1}), decoded);
  }

  @Test
  void applicationExtensionHandlerResolvesItsType() throws IOException {
    final var handler = ExtensionHandler.application(7, ExtensionEncoder.NONE,
        payload -> Decoded.notKey(MsgValue.resolved(payload.length)));
    final var options = STRICT.withExtensions(List.of(handler));
    assertEquals(MsgValue.resolved(3), decode(options, 0xc7, 0x03, 0x07, 1, 2, 3));
    assertEquals(MsgValue.extension(8, new byte[]{1}), decode(options, 0xd4, 0x08, 0x01));
  }

  @Test
  void nestingIsBounded() throws IOException {
    final var shallow = STRICT.withMaxDepth(3);
    assertEquals(MsgValue.array(MsgValue.array(MsgValue.array(MsgValue.NIL))), decode(shallow, 0x91, 0x91, 0x91, 0xc0));
    assertEquals(MsgPackException.Kind.NESTING_TOO_DEEP, failure(shallow, 0x91, 0x91, 0x91, 0x91, 0xc0));
    assertEquals(MsgPackException.Kind.NESTING_TOO_DEEP, failure(shallow, 0x81, 0x01, 0x81, 0x01, 0x81, 0x01, 0x81));

    final int[] deep = new int[DecodeOptions.DEFAULT_MAX_DEPTH + 1];
    Arrays.fill(deep, 0x91);
    assertEquals(MsgPackException.Kind.NESTING_TOO_DEEP, failure(deep));
  }

  @Test
  void transformersSeeValuesInnermostFirst() throws IOException {
    final var seen = new ArrayList<MsgValue>();
    final DecodeTransformer recorder = decoded -> {
      seen.add(decoded.value());
      return decoded;
    };
    decode(STRICT.withTransformers(List.of(recorder)), 0x92, 0x01, 0x02);
    assertThat(seen).containsExactly(MsgValue.integer(1), MsgValue.integer(2),
        MsgValue.array(MsgValue.integer(1), MsgValue.integer(2)));
  }

  @Test
  void transformerCanMakeAValueKeyEligible() throws IOException {
    // Binary becomes a text key.
    final DecodeTransformer binaryAsText = decoded -> decoded.value() instanceof MsgValue.BinaryValue binary
        ? Decoded.key(new MsgValue.TextValue(binary.bytes()))
        : decoded;
    final var decoded = decode(STRICT.withTransformers(List.of(binaryAsText)), 0x81, 0xc4, 0x01, 0x61, 0x01);
    assertEquals(MsgValue.map(MsgValue.text("a"), MsgValue.integer(1)), decoded);
  }

  @Test
  void keyEligibilityIsReported() throws IOException {
    final var codec = MsgPack.of(EncodeOptions.defaults(), STRICT);
    assertThat(codec.decodeWithKeyEligibility(bytes(0xa1, 0x61)).keyEligible()).isTrue();
    assertThat(codec.decodeWithKeyEligibility(bytes(0x90)).keyEligible()).isFalse();
    assertThat(codec.decodeWithKeyEligibility(bytes(0xc4, 0x00)).keyEligible()).isFalse();
  }

  @Test
  void readsExactlyOneValue() throws IOException {
    final var codec = MsgPack.of(EncodeOptions.defaults(), STRICT);
    final var in = new ByteArrayInputStream(bytes(0x92, 0x01, 0x02, 0x2a));
    assertEquals(MsgValue.array(MsgValue.integer(1), MsgValue.integer(2)), codec.decode(in));
    assertEquals(0x2a, in.read());

    final var buffer = ByteBuffer.wrap(bytes(0xa1, 0x61, 0xc3));
    assertEquals(MsgValue.text("a"), codec.decode(buffer));
    assertEquals(2, buffer.position());
    assertEquals(MsgValue.TRUE, codec.decode(buffer));
  }

  @Test
  void invalidOptionsFailFast() {
    final var handler = ExtensionHandler.application(1, value -> Optional.empty(), payload -> Decoded.key(MsgValue.NIL));
    assertThatThrownBy(() -> STRICT.withExtensions(List.of(handler, handler)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> STRICT.withExtensions(List.of(StandardExtensions.TIMESTAMP)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> STRICT.withMaxDepth(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExtensionHandler.application(128, ExtensionEncoder.NONE, payload -> null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExtensionHandler.application(-1, ExtensionEncoder.NONE, payload -> null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
