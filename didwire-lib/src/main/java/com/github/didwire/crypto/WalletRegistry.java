// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

/// Named wallets guarded by a passphrase.
public interface WalletRegistry {

  WalletCreation create(String name, String passphrase);

  /// @throws WalletUnavailableException when the wallet does not exist or the passphrase is wrong
  Wallet open(String name, String passphrase);

  /// @return false when there was no such wallet
  boolean delete(String name, String passphrase);
}
