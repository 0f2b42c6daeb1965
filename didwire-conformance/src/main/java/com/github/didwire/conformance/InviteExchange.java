// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

/// The out-of-band step of a handshake: getting an invitation URL from the agent under test, or giving it one.
/// An operator pasting URLs is one implementation; an in-process agent driven by admin messages is another.
public interface InviteExchange {

  /// Asks the agent to invite the suite.
  String inviteFromAgent();

  /// Hands the agent an invitation issued by the suite.
  void inviteToAgent(String url);
}
