// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

/// Enriches every decoded value, innermost first. Return the argument to leave the value alone.
@FunctionalInterface
public interface DecodeTransformer {

  Decoded transform(Decoded decoded) throws MsgPackException;
}
