// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import java.util.logging.Logger;

/// The single JUL logger shared by the agent, its modules and the reference wallet. Configure the
/// `com.github.didwire` logger to control the output of the whole library.
public final class DidwireLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.didwire");

  private DidwireLogger() {
  }
}
