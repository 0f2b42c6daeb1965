// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentConfigTest {

  @Test
  void endpointsFollowHostAndPort() {
    AgentConfig config = AgentConfig.defaults().withHostname("agent.example").withPort(8094);
    assertThat(config.endpoint()).isEqualTo("http://agent.example:8094/indy");
    assertThat(config.offerEndpoint()).isEqualTo("http://agent.example:8094/offer");
    assertThat(config.withPort(null).endpoint()).isEqualTo("http://agent.example/indy");
  }

  @Test
  void walletNameMarksEphemeralWallets() {
    AgentConfig config = AgentConfig.defaults().withAgentName("alice");
    assertThat(config.walletName()).isEqualTo("alice-wallet");
    assertThat(config.withEphemeral(true).walletName()).isEqualTo("alice-ephemeral_wallet");
  }

  @Test
  void readsProperties() {
    Properties properties = new Properties();
    properties.setProperty("didwire.name", "bob");
    properties.setProperty("didwire.host", "10.0.0.2");
    properties.setProperty("didwire.port", "9000");
    properties.setProperty("didwire.ephemeral", "true");
    properties.setProperty("didwire.poll-millis", "25");

    AgentConfig config = AgentConfig.from(properties);

    assertThat(config.agentName()).isEqualTo("bob");
    assertThat(config.endpoint()).isEqualTo("http://10.0.0.2:9000/indy");
    assertThat(config.ephemeral()).isTrue();
    assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(25));
    assertThat(config.walletPassphrase()).isEqualTo(AgentConfig.defaults().walletPassphrase());
  }

  @Test
  void rejectsBadNumbers() {
    Properties properties = new Properties();
    properties.setProperty("didwire.port", "eighty");
    assertThatThrownBy(() -> AgentConfig.from(properties)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AgentConfig.defaults().withPort(70000)).isInstanceOf(IllegalArgumentException.class);
  }
}
