// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Liveness checks over an established connection.
package com.github.didwire.trustping;
