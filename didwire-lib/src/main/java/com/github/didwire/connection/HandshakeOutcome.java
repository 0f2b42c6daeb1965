// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.ErrorKind;

/// What a handshake role made of one inbound message.
///
/// The inviter answers a bad request with [Ignored], which must never produce anything on the wire. The invitee
/// reports a bad response as [Failed] so that it can be surfaced.
public sealed interface HandshakeOutcome {

  /// The inviter accepted a request; the response still has to be delivered.
  record Responded(Connection connection, OutboundMessage response) implements HandshakeOutcome {
  }

  /// The invitee verified the response.
  record Verified(Connection connection) implements HandshakeOutcome {
  }

  record Ignored(ErrorKind kind, String detail) implements HandshakeOutcome {
  }

  record Failed(ErrorKind kind, String detail) implements HandshakeOutcome {
  }
}
