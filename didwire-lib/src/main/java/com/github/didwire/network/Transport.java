// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.network;

/// Outbound delivery of wire bytes. Inbound bytes are enqueued on the agent by whatever receives them.
public interface Transport {
  String MEDIA_TYPE = "application/ssi-agent-wire";
  int ACCEPTED = 202;

  /// Delivers the bytes and returns the status the far end answered with. There is no retry.
  ///
  /// @throws TransportException when nothing could be delivered
  int send(String endpoint, byte[] bytes);
}
