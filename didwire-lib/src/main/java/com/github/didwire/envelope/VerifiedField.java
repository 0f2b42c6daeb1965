// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

import java.time.Instant;
import java.util.Optional;

/// The result of verifying a [SignedField]. An unverified result never exposes a payload.
///
/// @param payload   the signed value, present only when verified
/// @param verified  whether the signature checked out against the declared signer
/// @param signer    the declared signer verkey
/// @param signedAt  the time the signer embedded, present only when verified; freshness is left to the caller
public record VerifiedField(Optional<Object> payload, boolean verified, String signer, Optional<Instant> signedAt) {

  static VerifiedField unverified(String signer) {
    return new VerifiedField(Optional.empty(), false, signer, Optional.empty());
  }
}
