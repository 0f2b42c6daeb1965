// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import java.util.Objects;

/// A relationship established by a completed handshake: the DID we use with the peer and how to reach them.
public record PairwiseInfo(String theirDid, String myDid, String theirVerkey, String theirEndpoint, String label) {
  public PairwiseInfo {
    Objects.requireNonNull(theirDid, "theirDid cannot be null");
    Objects.requireNonNull(myDid, "myDid cannot be null");
    Objects.requireNonNull(theirVerkey, "theirVerkey cannot be null");
    Objects.requireNonNull(theirEndpoint, "theirEndpoint cannot be null");
  }
}
