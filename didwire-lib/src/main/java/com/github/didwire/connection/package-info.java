// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The `connections/1.0` handshake.
///
/// ```
/// inviter                                  invitee
///   issueInvite  -- <endpoint>?c_i=... -->   receiveInvite
///                <-- request {DID, DIDDoc}   sendRequest
///   handleRequest
///                --- response connection~sig --> handleResponse
/// ```
///
/// [com.github.didwire.connection.InviterRole] and [com.github.didwire.connection.InviteeRole] hold the state of
/// one handshake each and only exchange wire bytes. [com.github.didwire.connection.ConnectionModule] runs them
/// inside an agent; the conformance suite runs them against one.
package com.github.didwire.connection;
