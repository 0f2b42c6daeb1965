// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// HTTP delivery of wire messages using the `application/ssi-agent-wire` media type.
package com.github.didwire.network;
