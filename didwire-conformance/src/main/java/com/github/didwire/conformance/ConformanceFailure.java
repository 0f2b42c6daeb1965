// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

/// The agent under test did not behave as the protocol requires.
public class ConformanceFailure extends AssertionError {
  public ConformanceFailure(String message) {
    super(message);
  }

  public ConformanceFailure(String message, Throwable cause) {
    super(message, cause);
  }
}
