// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import java.util.Optional;

/// What became of one inbound message. None of these stop the processing loop.
public sealed interface ProcessingOutcome {

  /// A handler ran. `replyStatus` is the delivery status of its reply, if it had one that could be sent.
  record Processed(String type, Optional<Integer> replyStatus) implements ProcessingOutcome {
  }

  /// The message was dropped without invoking a handler.
  record Dropped(ErrorKind kind, String detail) implements ProcessingOutcome {
  }

  /// A handler or the reply path threw.
  record Failed(String type, Throwable cause) implements ProcessingOutcome {
  }
}
