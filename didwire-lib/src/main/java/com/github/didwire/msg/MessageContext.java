// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import org.jetbrains.annotations.Nullable;

/// Out-of-band facts about how a message arrived. It is attached by the secure envelope after unpacking and is
/// never serialized. Only `toKey` is expected for an encrypted message; a plaintext message carries all nulls.
public record MessageContext(
    @Nullable String fromDid,
    @Nullable String toDid,
    @Nullable String fromKey,
    @Nullable String toKey) {

  public static final MessageContext PLAINTEXT = new MessageContext(null, null, null, null);

  public boolean senderAuthenticated() {
    return fromKey != null;
  }
}
