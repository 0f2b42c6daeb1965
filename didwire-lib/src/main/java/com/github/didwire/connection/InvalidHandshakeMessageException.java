// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.ErrorKind;

import java.util.Map;

/// A handshake message is missing a required field or its fields are inconsistent.
public class InvalidHandshakeMessageException extends IllegalArgumentException {
  public InvalidHandshakeMessageException(String message) {
    super(message);
  }

  public InvalidHandshakeMessageException(String message, Throwable cause) {
    super(message, cause);
  }

  public ErrorKind kind() {
    return ErrorKind.INVALID_HANDSHAKE_MESSAGE;
  }

  static String requireString(Object value, String what) {
    if (value instanceof String s && !s.isBlank()) {
      return s;
    }
    throw new InvalidHandshakeMessageException("Missing or empty " + what);
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> requireMap(Object value, String what) {
    if (value instanceof Map<?, ?> m) {
      return (Map<String, Object>) m;
    }
    throw new InvalidHandshakeMessageException("Missing " + what);
  }
}
