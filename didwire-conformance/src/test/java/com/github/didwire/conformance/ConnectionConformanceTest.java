// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import com.github.didwire.Agent;
import com.github.didwire.AgentConfig;
import com.github.didwire.connection.Connection;
import com.github.didwire.connection.ConnectionAdminModule;
import com.github.didwire.connection.Invitation;
import com.github.didwire.crypto.InMemoryWalletRegistry;
import com.github.didwire.crypto.LocalWallet;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

import static com.github.didwire.DidwireLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Runs the connection procedures against an in-process agent over the loopback network.
class ConnectionConformanceTest {
  static final Duration WAIT = Duration.ofSeconds(5);
  static final String SUITE_ENDPOINT = "http://suite.test/indy";

  final SuiteConfig suiteConfig = SuiteConfig.defaults()
      .withEndpoint(SUITE_ENDPOINT)
      .withSilenceWindow(Duration.ofMillis(300));
  final LoopbackNetwork network = new LoopbackNetwork();
  final ConformanceTransport inbound = new ConformanceTransport();
  final LocalWallet suiteWallet = new LocalWallet("suite");
  Agent agent;

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(level);
    LOGGER.addHandler(handler);
    LOGGER.setLevel(level);
    LOGGER.setUseParentHandlers(false);
  }

  @BeforeEach
  void setup() {
    AgentConfig config = AgentConfig.defaults()
        .withAgentName("under-test")
        .withHostname("agent.test")
        .withEphemeral(true)
        .withPollInterval(Duration.ofMillis(20));
    agent = new Agent(config, new InMemoryWalletRegistry(), network);
    network.register(config.endpoint(), agent::deliver);
    network.register(SUITE_ENDPOINT, inbound::deliver);
    agent.start();
  }

  @AfterEach
  void tearDown() {
    agent.close();
  }

  /// Drives the agent's invitation handling through its admin family.
  class AdminInviteExchange implements InviteExchange {
    @Override
    public String inviteFromAgent() {
      agent.deliver(ConnectionAdminModule.sendInviteMessage());
      return awaitAdmin(ConnectionAdminModule.INVITE_GENERATED).getString(ConnectionAdminModule.INVITE);
    }

    @Override
    public void inviteToAgent(String url) {
      agent.deliver(ConnectionAdminModule.receiveInviteMessage(url));
    }
  }

  Message awaitAdmin(String type) {
    long deadline = System.nanoTime() + WAIT.toNanos();
    try {
      while (System.nanoTime() < deadline) {
        Optional<String> next = agent.state().nextAdminMessage(Duration.ofNanos(deadline - System.nanoTime()));
        if (next.isPresent()) {
          Message message = MessageSerializer.deserialize(next.get());
          if (type.equals(message.type())) {
            return message;
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    throw new AssertionError("No " + type + " within " + WAIT);
  }

  ConnectionConformance conformance(InviteExchange exchange) {
    return new ConnectionConformance(suiteConfig, suiteWallet, inbound, network, exchange, Clock.systemUTC());
  }

  @Test
  void connectionStartedByAgent() {
    Connection connection = conformance(new AdminInviteExchange()).connectionStartedByAgent();

    Message established = awaitAdmin(ConnectionAdminModule.CONNECTION_ESTABLISHED);
    assertThat(established.getString("their_did")).isEqualTo(connection.myDid());
    assertThat(established.getString("my_did")).isEqualTo(connection.theirDid());
    assertThat(connection.theirEndpoint()).isEqualTo("http://agent.test/indy");
  }

  @Test
  void connectionStartedBySuite() {
    Connection connection = conformance(new AdminInviteExchange()).connectionStartedBySuite();

    Message established = awaitAdmin(ConnectionAdminModule.CONNECTION_ESTABLISHED);
    assertThat(established.getString("their_did")).isEqualTo(connection.myDid());
    assertThat(established.getString("label")).isEqualTo(suiteConfig.label());
    assertThat(agent.state().wallet().pairwiseInfo(connection.myDid()).myDid()).isEqualTo(connection.theirDid());
  }

  @Test
  void badConnectionRequestIsIgnored() {
    conformance(new AdminInviteExchange()).badConnectionRequestIsIgnored();

    assertThat(agent.state().wallet().listPairwise()).isEmpty();
  }

  @Test
  void agentThatNeverRespondsFails() {
    Invitation deaf = Invitation.create("deaf", suiteWallet.createKey(), "http://deaf.test/indy");
    network.register(deaf.serviceEndpoint(), bytes -> {
    });
    InviteExchange exchange = new InviteExchange() {
      @Override
      public String inviteFromAgent() {
        return deaf.toUrl();
      }

      @Override
      public void inviteToAgent(String url) {
      }
    };
    SuiteConfig impatient = suiteConfig.withExpectTimeout(Duration.ofMillis(200));

    assertThatThrownBy(() -> new ConnectionConformance(impatient, suiteWallet, inbound, network, exchange,
        Clock.systemUTC()).connectionStartedByAgent())
        .isInstanceOf(ConformanceFailure.class);
  }

  @Test
  void agentThatAnswersABadRequestFails() {
    Invitation chatty = Invitation.create("chatty", suiteWallet.createKey(), "http://chatty.test/indy");
    network.register(chatty.serviceEndpoint(),
        bytes -> inbound.deliver("{\"@type\":\"whatever\"}".getBytes(StandardCharsets.UTF_8)));
    InviteExchange exchange = new InviteExchange() {
      @Override
      public String inviteFromAgent() {
        return chatty.toUrl();
      }

      @Override
      public void inviteToAgent(String url) {
      }
    };

    assertThatThrownBy(() -> conformance(exchange).badConnectionRequestIsIgnored())
        .isInstanceOf(ConformanceFailure.class);
  }
}
