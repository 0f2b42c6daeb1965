// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

/// Packed bytes and where to post them.
public record OutboundMessage(String endpoint, byte[] bytes) {
}
