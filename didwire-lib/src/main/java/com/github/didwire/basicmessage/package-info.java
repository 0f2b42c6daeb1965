// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Plain text messages between connected agents.
package com.github.didwire.basicmessage;
