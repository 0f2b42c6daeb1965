// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/// The cryptographic capability the agent consumes. The agent never touches key material: keys are named by their
/// base58 verkey and every operation is delegated here. Calls may block on I/O.
public interface CryptoProvider {

  /// Signs `data` with the private key behind `signerVerkey`.
  byte[] sign(String signerVerkey, byte[] data);

  /// A `false` result is a normal outcome. Implementations must not throw for a bad signature or a bad key.
  boolean verify(String verkey, byte[] data, byte[] signature);

  /// Encrypts `plaintext` for every recipient. With a null `senderVerkey` the envelope is anonymous, otherwise
  /// the recipients can authenticate the sender.
  byte[] packEnvelope(List<String> recipientVerkeys, @Nullable String senderVerkey, byte[] plaintext);

  /// @throws SecurityException when the bytes are not an envelope addressed to a key held by this provider
  UnpackedEnvelope unpackEnvelope(byte[] envelope);

  /// Creates a fresh signing key and returns its verkey.
  String createKey();

  /// Creates a fresh key and a local DID bound to it.
  LocalIdentity createLocalIdentity();
}
