// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;

import java.util.Optional;

/// Handles every message type of one protocol family. A module is registered with the [FamilyRouter] under its
/// family identifier.
public interface Module {

  /// The `@type` prefix this module owns, e.g. `did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/connections/1.0`.
  String familyId();

  /// Handles one message and optionally returns a reply for the sender.
  ///
  /// @throws UnroutableMessageException when the module has no handler for the exact type
  Optional<Message> route(Message message);
}
