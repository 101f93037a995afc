// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static io.github.simbo1905.msgpack.MsgPack.LOGGER;

/// Ready made encode transformers.
public final class Transformers {

  /// Java arrays other than `byte[]`, and collections that are not a `List`, become an unmodifiable `List`.
  public static final EncodeTransformer ARRAY_LIKE = Transformers::arrayLike;

  private Transformers() {
  }

  /// Records become a `Map` from component name to component value, in declaration order.
  public static EncodeTransformer records() {
    return records(component -> Optional.of(component.getName()));
  }

  /// Records become a `Map` keyed by the name `componentFn` gives each component.
  /// A component is left out when `componentFn` returns empty. [MsgValue] variants are left alone.
  public static EncodeTransformer records(Function<RecordComponent, Optional<String>> componentFn) {
    Objects.requireNonNull(componentFn, "componentFn must not be null");
    return value -> {
      if (value == null || value instanceof MsgValue || !value.getClass().isRecord()) {
        return value;
      }
      final List<NamedAccessor> accessors = accessors(value.getClass(), componentFn);
      final var mapping = new LinkedHashMap<String, Object>(accessors.size() * 2);
      for (NamedAccessor accessor : accessors) {
        mapping.put(accessor.name(), accessor.get(value));
      }
      return mapping;
    };
  }

  /// A single transformer that runs the given ones in order, feeding each output to the next.
  public static EncodeTransformer compose(EncodeTransformer... transformers) {
    final List<EncodeTransformer> chain = List.of(transformers);
    return value -> {
      Object current = value;
      for (EncodeTransformer transformer : chain) {
        current = transformer.transform(current);
      }
      return current;
    };
  }

  private static Object arrayLike(Object value) {
    if (value == null || value instanceof byte[] || value instanceof List) {
      return value;
    }
    if (value.getClass().isArray()) {
      final int length = Array.getLength(value);
      final var elements = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        elements.add(Array.get(value, i));
      }
      return Collections.unmodifiableList(elements);
    }
    if (value instanceof Collection<?> collection) {
      return Collections.unmodifiableList(new ArrayList<>(collection));
    }
    return value;
  }

  /// Non-public records are read through a private lookup, which works wherever the record package is open to this module.
  private static List<NamedAccessor> accessors(Class<?> recordType,
                                               Function<RecordComponent, Optional<String>> componentFn)
      throws MsgPackException {
    LOGGER.finer(() -> "Reading record components of " + recordType.getName());
    final MethodHandles.Lookup lookup;
    try {
      lookup = MethodHandles.privateLookupIn(recordType, MethodHandles.lookup());
    } catch (IllegalAccessException e) {
      throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_TYPE,
          "Record package is not open for reading components: " + recordType.getName(), e);
    }
    final var accessors = new ArrayList<NamedAccessor>();
    for (RecordComponent component : recordType.getRecordComponents()) {
      final Optional<String> name = componentFn.apply(component);
      if (name.isEmpty()) {
        continue;
      }
      try {
        accessors.add(new NamedAccessor(name.get(), lookup.unreflect(component.getAccessor())));
      } catch (IllegalAccessException e) {
        throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_TYPE,
            "Cannot read component " + component.getName() + " of " + recordType.getName(), e);
      }
    }
    return List.copyOf(accessors);
  }

  private record NamedAccessor(String name, MethodHandle accessor) {
    Object get(Object record) throws MsgPackException {
      try {
        return accessor.invoke(record);
      } catch (RuntimeException | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new MsgPackException(MsgPackException.Kind.UNSUPPORTED_TYPE,
            "Failed to read component " + name + " of " + record.getClass().getName(), t);
      }
    }
  }
}
