// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

/// An open wallet supplies both the crypto provider and the identity store, as one backing store holds the keys
/// and the DIDs that name them.
public interface Wallet extends CryptoProvider, IdentityStore, AutoCloseable {

  String name();

  boolean isOpen();

  @Override
  void close();
}
