// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.msgpack;

/// Turns the payload of a known extension type into a value. The payload array is owned by the callee.
@FunctionalInterface
public interface ExtensionDecoder {

  Decoded decode(byte[] payload) throws MsgPackException;
}
