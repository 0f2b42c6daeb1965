// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

/// Raised by a [Module] that owns a family but has no handler for the exact message type.
public class UnroutableMessageException extends RuntimeException {
  private final String type;
  private final String scope;

  public UnroutableMessageException(String type, String scope) {
    super("No handler for " + type + " in " + scope);
    this.type = type;
    this.scope = scope;
  }

  public String type() {
    return type;
  }

  public String scope() {
    return scope;
  }

  public ErrorKind kind() {
    return ErrorKind.UNROUTABLE_MESSAGE;
  }
}
