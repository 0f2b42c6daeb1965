// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.crypto.PairwiseInfo;

/// An established connection as seen from our side.
public record Connection(String myDid, String myVerkey, String theirDid, String theirVerkey, String theirEndpoint,
                         String theirLabel) {

  public PairwiseInfo toPairwise() {
    return new PairwiseInfo(theirDid, myDid, theirVerkey, theirEndpoint, theirLabel);
  }
}
