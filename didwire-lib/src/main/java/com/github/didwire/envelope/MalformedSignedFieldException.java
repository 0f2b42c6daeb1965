// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

/// A signed field that cannot be read at all, as opposed to one that reads but does not verify.
public class MalformedSignedFieldException extends IllegalArgumentException {
  public MalformedSignedFieldException(String message) {
    super(message);
  }

  public MalformedSignedFieldException(String message, Throwable cause) {
    super(message, cause);
  }
}
