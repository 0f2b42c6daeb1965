// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The identity bookkeeping the agent consumes: which DID owns a key, our key for our DID, and the pairwise
/// relationships created by handshakes.
public interface IdentityStore {

  /// Resolves a verkey to a known DID, local or remote. Empty is a normal answer for an unknown key.
  Optional<String> verkeyToDid(String verkey);

  /// @throws IllegalArgumentException when the DID is not one of ours
  String localKeyForDid(String did);

  /// @throws IllegalArgumentException when there is no relationship with the DID
  PairwiseInfo pairwiseInfo(String theirDid);

  void storeTheirDid(String did, String verkey);

  void createPairwise(PairwiseInfo pairwise);

  List<PairwiseInfo> listPairwise();

  /// Small typed records, for example the invitations issued by this agent.
  void putRecord(String type, String id, String value);

  Map<String, String> records(String type);
}
