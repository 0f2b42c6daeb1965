// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

/// The kinds of failure that can end the processing of a single message. None of them is retried.
public enum ErrorKind {
  /// Neither parseable as a plaintext message nor decryptable as an envelope.
  MALFORMED_WIRE_BYTES,
  /// No family module or no handler matched the `@type`.
  UNROUTABLE_MESSAGE,
  /// A handshake message is missing a required field or has the wrong shape.
  INVALID_HANDSHAKE_MESSAGE,
  /// A signed field did not verify against its declared signer.
  SIGNATURE_VERIFICATION_FAILED,
  /// The wallet backing identities and keys is not open.
  WALLET_UNAVAILABLE
}
