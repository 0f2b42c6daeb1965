// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Conformance procedures that exercise an agent over the wire, with the timeout-bound mailbox they wait on.
package com.github.didwire.conformance;
