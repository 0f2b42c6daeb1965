// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Administrative families. Admin requests arrive as plaintext on the inbound queue and answers go to the admin
/// queue.
package com.github.didwire.admin;
