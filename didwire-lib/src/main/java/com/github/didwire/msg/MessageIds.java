// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import com.github.f4b6a3.uuid.UuidCreator;

/// Generates `@id` values. Time-ordered UUIDs keep ids of one agent sortable by creation time in logs.
public final class MessageIds {
  private MessageIds() {
  }

  public static String next() {
    return UuidCreator.getTimeOrderedEpoch().toString();
  }
}
