// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import java.util.Objects;
import java.util.Optional;

/// The decrypted content of an envelope. `senderVerkey` is empty for an anonymous envelope.
public record UnpackedEnvelope(String message, String recipientVerkey, Optional<String> senderVerkey) {
  public UnpackedEnvelope {
    Objects.requireNonNull(message, "message cannot be null");
    Objects.requireNonNull(recipientVerkey, "recipientVerkey cannot be null");
    Objects.requireNonNull(senderVerkey, "senderVerkey cannot be null");
  }
}
