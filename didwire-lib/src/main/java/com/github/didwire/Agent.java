// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.admin.AdminModule;
import com.github.didwire.basicmessage.BasicMessageModule;
import com.github.didwire.connection.ConnectionAdminModule;
import com.github.didwire.connection.ConnectionModule;
import com.github.didwire.crypto.WalletRegistry;
import com.github.didwire.crypto.WalletUnavailableException;
import com.github.didwire.envelope.UnpackResult;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageContext;
import com.github.didwire.msg.MessageSerializer;
import com.github.didwire.network.Transport;
import com.github.didwire.trustping.TrustPingModule;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.didwire.DidwireLogger.LOGGER;

/// An agent: one thread takes wire bytes off the inbound queue in arrival order, unpacks them, routes them to a
/// family module and sends any reply back over the sender's connection. A message that fails at any step is
/// logged and dropped and the loop moves on.
public class Agent implements AutoCloseable {
  private final AgentState state;
  private final ConnectionModule connections;
  private final BasicMessageModule basicMessages;
  private final TrustPingModule trustPing;

  private volatile boolean running;
  private Thread loop;

  public Agent(AgentConfig config, WalletRegistry wallets, Transport transport, Clock clock) {
    this.state = new AgentState(config, wallets, transport, clock);
    this.connections = new ConnectionModule(state);
    this.basicMessages = new BasicMessageModule(state);
    this.trustPing = new TrustPingModule(state);
    FamilyRouter router = state.router();
    router.register(new AdminModule(state));
    router.register(connections);
    router.register(new ConnectionAdminModule(state, connections));
    router.register(basicMessages);
    router.register(trustPing);
  }

  public Agent(AgentConfig config, WalletRegistry wallets, Transport transport) {
    this(config, wallets, transport, Clock.systemUTC());
  }

  public AgentState state() {
    return state;
  }

  public ConnectionModule connections() {
    return connections;
  }

  public BasicMessageModule basicMessages() {
    return basicMessages;
  }

  public TrustPingModule trustPing() {
    return trustPing;
  }

  /// Queues wire bytes for processing. Safe to call from any thread.
  public void deliver(byte[] wireBytes) {
    state.inbound().add(wireBytes);
  }

  /// Queues a locally built message as plaintext, the way admin requests arrive.
  public void deliver(Message message) {
    deliver(MessageSerializer.serialize(message));
  }

  /// Connects the configured wallet and starts the processing thread.
  ///
  /// @throws WalletUnavailableException when the wallet cannot be opened
  public Agent start() {
    if (running) return this;
    if (!state.initialized()) {
      state.connectWallet();
    }
    running = true;
    loop = new Thread(this::processLoop, "didwire-agent-" + state.config().agentName());
    loop.setDaemon(true);
    loop.start();
    LOGGER.info(() -> "Agent " + state.config().agentName() + " listening at " + state.config().endpoint());
    return this;
  }

  private void processLoop() {
    final long pollNanos = state.config().pollInterval().toNanos();
    while (running) {
      try {
        byte[] wireBytes = state.inbound().poll(pollNanos, TimeUnit.NANOSECONDS);
        if (wireBytes != null) {
          handleIncoming(wireBytes);
        }
      } catch (InterruptedException e) {
        if (running) {
          LOGGER.warning("Agent loop interrupted while running");
        }
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  /// Processes one inbound message on the calling thread.
  public ProcessingOutcome handleIncoming(byte[] wireBytes) {
    final UnpackResult unpacked;
    try {
      unpacked = state.envelope().unpack(wireBytes);
    } catch (WalletUnavailableException e) {
      LOGGER.warning(() -> "Dropping message, " + e.getMessage());
      return new ProcessingOutcome.Dropped(e.kind(), e.getMessage());
    }
    if (unpacked instanceof UnpackResult.Rejected rejected) {
      return new ProcessingOutcome.Dropped(rejected.kind(), rejected.detail());
    }
    Message message = ((UnpackResult.Unpacked) unpacked).message();
    LOGGER.finer(() -> "Processing " + message.type() + " " + message.id());
    try {
      RouteResult routed = state.router().route(message);
      if (routed instanceof RouteResult.Unroutable unroutable) {
        return new ProcessingOutcome.Dropped(unroutable.kind(), "no handler for " + unroutable.type()
            + " in " + unroutable.scope());
      }
      Optional<Message> reply = ((RouteResult.Handled) routed).reply();
      return new ProcessingOutcome.Processed(message.type(), reply.flatMap(r -> sendReply(message, r)));
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, "Handler failed for " + message.type() + ": " + excerpt(message), e);
      return new ProcessingOutcome.Failed(message.type(), e);
    }
  }

  private Optional<Integer> sendReply(Message message, Message reply) {
    String theirDid = message.context().map(MessageContext::fromDid).orElse(null);
    if (theirDid == null) {
      LOGGER.warning(() -> "Dropping reply " + reply.type() + " to a sender with no known DID");
      return Optional.empty();
    }
    return Optional.of(state.sendToDid(theirDid, reply));
  }

  private static String excerpt(Message message) {
    String text = MessageSerializer.serializeToString(message);
    return text.length() > 128 ? text.substring(0, 128) + "..." : text;
  }

  @Override
  public void close() {
    running = false;
    Thread current = loop;
    if (current != null) {
      current.interrupt();
      try {
        current.join(1000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    LOGGER.info(() -> "Agent " + state.config().agentName() + " stopped");
  }
}
