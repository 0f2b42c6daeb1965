// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;

import java.util.Optional;

/// Outcome of routing one message.
public sealed interface RouteResult {

  /// A handler ran and may have produced a reply.
  record Handled(Optional<Message> reply) implements RouteResult {
  }

  /// No handler was invoked. `scope` is [FamilyRouter#TOP_LEVEL] or the family identifier of the module that
  /// had no handler for the exact type.
  record Unroutable(String type, String scope) implements RouteResult {
    public ErrorKind kind() {
      return ErrorKind.UNROUTABLE_MESSAGE;
    }
  }
}
