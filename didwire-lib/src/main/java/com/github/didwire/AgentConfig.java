// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import lombok.With;
import org.jetbrains.annotations.Nullable;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Immutable agent configuration. Start from [#defaults()] and adjust with the withers.
@With
public record AgentConfig(
    // Identity
    String agentName,
    String walletPassphrase,
    boolean ephemeral,

    // Endpoint, a null host resolves to the local host address
    @Nullable String hostname,
    @Nullable Integer port,

    // Processing loop
    Duration pollInterval
) {
  public static final String PREFIX = "didwire.";

  public AgentConfig {
    Objects.requireNonNull(agentName, "agentName cannot be null");
    Objects.requireNonNull(walletPassphrase, "walletPassphrase cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
    if (port != null && (port < 1 || port > 65535)) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
  }

  public static AgentConfig defaults() {
    return new AgentConfig(
        "didwire",              // agentName
        "didwire",              // walletPassphrase
        false,                  // ephemeral
        null,                   // hostname
        null,                   // port
        Duration.ofMillis(100)  // pollInterval
    );
  }

  /// Reads `didwire.name`, `didwire.passphrase`, `didwire.ephemeral`, `didwire.host`, `didwire.port` and
  /// `didwire.poll-millis`, falling back to [#defaults()].
  public static AgentConfig from(Properties properties) {
    AgentConfig defaults = defaults();
    String port = properties.getProperty(PREFIX + "port");
    String poll = properties.getProperty(PREFIX + "poll-millis");
    try {
      return new AgentConfig(
          properties.getProperty(PREFIX + "name", defaults.agentName()),
          properties.getProperty(PREFIX + "passphrase", defaults.walletPassphrase()),
          Boolean.parseBoolean(properties.getProperty(PREFIX + "ephemeral", Boolean.toString(defaults.ephemeral()))),
          properties.getProperty(PREFIX + "host", defaults.hostname()),
          port == null ? defaults.port() : Integer.valueOf(port.trim()),
          poll == null ? defaults.pollInterval() : Duration.ofMillis(Long.parseLong(poll.trim()))
      );
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad numeric " + PREFIX + "* property: " + e.getMessage(), e);
    }
  }

  /// The wallet name derived from the agent name.
  public String walletName() {
    return agentName + (ephemeral ? "-ephemeral_wallet" : "-wallet");
  }

  /// `http://<host>[:<port>]/indy`, where peers post wire messages.
  public String endpoint() {
    return baseUrl() + "/indy";
  }

  /// `http://<host>[:<port>]/offer`, where the agent publishes invitations.
  public String offerEndpoint() {
    return baseUrl() + "/offer";
  }

  private String baseUrl() {
    return "http://" + resolvedHost() + (port == null ? "" : ":" + port);
  }

  public String resolvedHost() {
    if (hostname != null) {
      return hostname;
    }
    try {
      return InetAddress.getLocalHost().getHostAddress();
    } catch (UnknownHostException e) {
      LOGGER.warning(() -> "Cannot resolve local host, using loopback: " + e.getMessage());
      return InetAddress.getLoopbackAddress().getHostAddress();
    }
  }
}
