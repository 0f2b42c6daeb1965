// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Secure envelope unpacking and packing, and detached signatures over message fields.
package com.github.didwire.envelope;
