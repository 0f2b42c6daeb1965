// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import java.time.Duration;

/// Either the next inbound message or the news that none came in time.
public sealed interface AwaitResult {

  record Received(byte[] bytes) implements AwaitResult {
  }

  record TimedOut(Duration waited) implements AwaitResult {
  }
}
