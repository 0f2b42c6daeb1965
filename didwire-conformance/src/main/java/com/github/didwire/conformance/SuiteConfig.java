// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import lombok.With;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// Settings of a conformance run.
@With
public record SuiteConfig(
    String label,
    // where the agent under test sends to the suite
    String endpoint,
    // how long to wait for a message the agent must send
    Duration expectTimeout,
    // how long the agent must stay quiet when it must not answer
    Duration silenceWindow
) {
  public static final String PREFIX = "didwire.suite.";

  public SuiteConfig {
    Objects.requireNonNull(label, "label cannot be null");
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
    if (expectTimeout.isNegative() || silenceWindow.isNegative()) {
      throw new IllegalArgumentException("Timeouts cannot be negative");
    }
  }

  public static SuiteConfig defaults() {
    return new SuiteConfig(
        "conformance suite",          // label
        "http://localhost:3000/indy", // endpoint
        Duration.ofSeconds(5),        // expectTimeout
        Duration.ofSeconds(1)         // silenceWindow
    );
  }

  /// Reads `didwire.suite.label`, `didwire.suite.endpoint`, `didwire.suite.expect-millis` and
  /// `didwire.suite.silence-millis`.
  public static SuiteConfig from(Properties properties) {
    SuiteConfig defaults = defaults();
    String expect = properties.getProperty(PREFIX + "expect-millis");
    String silence = properties.getProperty(PREFIX + "silence-millis");
    return new SuiteConfig(
        properties.getProperty(PREFIX + "label", defaults.label()),
        properties.getProperty(PREFIX + "endpoint", defaults.endpoint()),
        expect == null ? defaults.expectTimeout() : Duration.ofMillis(Long.parseLong(expect.trim())),
        silence == null ? defaults.silenceWindow() : Duration.ofMillis(Long.parseLong(silence.trim()))
    );
  }
}
