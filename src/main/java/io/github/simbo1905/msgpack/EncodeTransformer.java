// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

/// Rewrites a host value before it is encoded. A transformer that does not apply returns its argument unchanged;
/// returning any other reference, including `null` for nil, counts as having fired.
@FunctionalInterface
public interface EncodeTransformer {

  Object transform(Object value) throws MsgPackException;
}
