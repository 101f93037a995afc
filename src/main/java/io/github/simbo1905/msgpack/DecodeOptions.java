// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/// Immutable decoding configuration. Safe to share between threads.
/// @param duplicateKeys what to do when a map repeats a key
/// @param unsupportedKeys what to do with a map key that is not key-eligible
/// @param unknownExtensions what to do with an extension type that has no handler
/// @param standardExtensions whether the standard handlers (the timestamp) resolve negative extension types
/// @param extensions application handlers for extension types 0..127
/// @param transformers run in order on every decoded value
/// @param maxDepth deepest container nesting accepted
public record DecodeOptions(
    DuplicateKeyPolicy duplicateKeys,
    UnsupportedKeyPolicy unsupportedKeys,
    UnknownExtensionPolicy unknownExtensions,
    boolean standardExtensions,
    List<ExtensionHandler> extensions,
    List<DecodeTransformer> transformers,
    int maxDepth
) {

  public static final int DEFAULT_MAX_DEPTH = 512;

  public DecodeOptions {
    Objects.requireNonNull(duplicateKeys, "duplicateKeys must not be null");
    Objects.requireNonNull(unsupportedKeys, "unsupportedKeys must not be null");
    Objects.requireNonNull(unknownExtensions, "unknownExtensions must not be null");
    extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions must not be null"));
    transformers = List.copyOf(Objects.requireNonNull(transformers, "transformers must not be null"));
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
    }
    // Validate the handlers as they are user input.
    final var seen = new HashSet<Byte>();
    for (ExtensionHandler handler : extensions) {
      if (handler.isStandard()) {
        throw new IllegalArgumentException("Application extension types must be in 0..127, got: " + handler.type());
      }
      if (!seen.add(handler.type())) {
        throw new IllegalArgumentException("More than one handler registered for extension type " + handler.type());
      }
    }
  }

  /// Policies from system properties, standard extensions on, no application handlers or transformers.
  public static DecodeOptions defaults() {
    return new DecodeOptions(DuplicateKeyPolicy.current(), UnsupportedKeyPolicy.current(),
        UnknownExtensionPolicy.current(), true, List.of(), List.of(), DEFAULT_MAX_DEPTH);
  }

  public DecodeOptions withDuplicateKeys(DuplicateKeyPolicy policy) {
    return new DecodeOptions(policy, unsupportedKeys, unknownExtensions, standardExtensions, extensions, transformers, maxDepth);
  }

  public DecodeOptions withUnsupportedKeys(UnsupportedKeyPolicy policy) {
    return new DecodeOptions(duplicateKeys, policy, unknownExtensions, standardExtensions, extensions, transformers, maxDepth);
  }

  public DecodeOptions withUnknownExtensions(UnknownExtensionPolicy policy) {
    return new DecodeOptions(duplicateKeys, unsupportedKeys, policy, standardExtensions, extensions, transformers, maxDepth);
  }

  public DecodeOptions withStandardExtensions(boolean enabled) {
    return new DecodeOptions(duplicateKeys, unsupportedKeys, unknownExtensions, enabled, extensions, transformers, maxDepth);
  }

  public DecodeOptions withExtensions(List<ExtensionHandler> handlers) {
    return new DecodeOptions(duplicateKeys, unsupportedKeys, unknownExtensions, standardExtensions, handlers, transformers, maxDepth);
  }

  public DecodeOptions withTransformers(List<DecodeTransformer> chain) {
    return new DecodeOptions(duplicateKeys, unsupportedKeys, unknownExtensions, standardExtensions, extensions, chain, maxDepth);
  }

  public DecodeOptions withMaxDepth(int depth) {
    return new DecodeOptions(duplicateKeys, unsupportedKeys, unknownExtensions, standardExtensions, extensions, transformers, depth);
  }
}
