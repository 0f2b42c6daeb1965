// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

import com.github.didwire.ErrorKind;
import com.github.didwire.msg.Message;

/// Outcome of unpacking wire bytes. A rejection is a normal outcome that the caller logs and drops.
public sealed interface UnpackResult {

  record Unpacked(Message message) implements UnpackResult {
  }

  record Rejected(ErrorKind kind, String detail, Throwable cause) implements UnpackResult {
  }
}
