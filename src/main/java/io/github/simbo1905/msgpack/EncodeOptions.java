// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.util.List;
import java.util.Objects;

/// Immutable encoding configuration. Safe to share between threads.
/// @param standardExtensions whether the standard handlers (the timestamp) may claim values
/// @param extensions application handlers for extension types 0..127, consulted before the standard ones
/// @param transformers run in order on every value before extension resolution
/// @param lateTransformers general rewrites tried only when a value is still not encodable; each fires at most
///                         once per value
/// @param maxDepth deepest container nesting accepted
public record EncodeOptions(
    boolean standardExtensions,
    List<ExtensionHandler> extensions,
    List<EncodeTransformer> transformers,
    List<EncodeTransformer> lateTransformers,
    int maxDepth
) {

  public static final int DEFAULT_MAX_DEPTH = DecodeOptions.DEFAULT_MAX_DEPTH;

  public EncodeOptions {
    extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions must not be null"));
    transformers = List.copyOf(Objects.requireNonNull(transformers, "transformers must not be null"));
    lateTransformers = List.copyOf(Objects.requireNonNull(lateTransformers, "lateTransformers must not be null"));
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
    }
    extensions.stream().filter(ExtensionHandler::isStandard)
        .findAny()
        .ifPresent(h -> {
          throw new IllegalArgumentException("Application extension types must be in 0..127, got: " + h.type());
        });
  }

  /// Standard extensions on, no application handlers, array-like values converted to lists.
  public static EncodeOptions defaults() {
    return new EncodeOptions(true, List.of(), List.of(), List.of(Transformers.ARRAY_LIKE), DEFAULT_MAX_DEPTH);
  }

  public EncodeOptions withStandardExtensions(boolean enabled) {
    return new EncodeOptions(enabled, extensions, transformers, lateTransformers, maxDepth);
  }

  public EncodeOptions withExtensions(List<ExtensionHandler> handlers) {
    return new EncodeOptions(standardExtensions, handlers, transformers, lateTransformers, maxDepth);
  }

  public EncodeOptions withTransformers(List<EncodeTransformer> chain) {
    return new EncodeOptions(standardExtensions, extensions, chain, lateTransformers, maxDepth);
  }

  public EncodeOptions withLateTransformers(List<EncodeTransformer> chain) {
    return new EncodeOptions(standardExtensions, extensions, transformers, chain, maxDepth);
  }

  public EncodeOptions withMaxDepth(int depth) {
    return new EncodeOptions(standardExtensions, extensions, transformers, lateTransformers, depth);
  }
}
