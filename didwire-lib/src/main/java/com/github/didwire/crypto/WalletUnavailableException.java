// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import com.github.didwire.ErrorKind;

/// Thrown by any operation that needs a wallet when none is open, or when a wallet cannot be opened.
public class WalletUnavailableException extends RuntimeException {
  public WalletUnavailableException(String message) {
    super(message);
  }

  public WalletUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public ErrorKind kind() {
    return ErrorKind.WALLET_UNAVAILABLE;
  }
}
