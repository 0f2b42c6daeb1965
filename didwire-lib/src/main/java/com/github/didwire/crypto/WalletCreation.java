// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

/// Outcome of creating a named wallet. `AlreadyExists` is benign; callers decide what to do with `Failed`.
public sealed interface WalletCreation {
  record Created(String name) implements WalletCreation {
  }

  record AlreadyExists(String name) implements WalletCreation {
  }

  record Failed(String name, Throwable cause) implements WalletCreation {
  }

  String name();

  default boolean benign() {
    return !(this instanceof Failed);
  }
}
