// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.crypto.InMemoryWalletRegistry;
import com.github.didwire.crypto.WalletRegistry;
import com.github.didwire.network.AgentHttpEndpoint;
import com.github.didwire.network.HttpTransport;
import com.github.didwire.network.Transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// An [Agent] listening for wire messages over HTTP. Admin triggers are plaintext messages posted to the same
/// endpoint. Admin output is handed to whoever drains [AgentState#nextAdminMessage].
public class AgentServer implements AutoCloseable {
  private static final String PORT = AgentConfig.PREFIX + "port";

  private final Agent agent;
  private final AgentHttpEndpoint endpoint;

  public AgentServer(AgentConfig config, WalletRegistry wallets, Transport transport, int bindPort) throws IOException {
    this.agent = new Agent(config, wallets, transport);
    this.endpoint = new AgentHttpEndpoint(new InetSocketAddress(bindPort), agent::deliver);
  }

  public AgentServer start() {
    agent.start();
    endpoint.start();
    LOGGER.info(() -> "Agent " + agent.state().config().agentName() + " reachable at "
        + agent.state().config().endpoint());
    return this;
  }

  public Agent agent() {
    return agent;
  }

  public int port() {
    return endpoint.port();
  }

  @Override
  public void close() {
    endpoint.close();
    agent.close();
  }

  /// Runs an agent configured from `didwire.*` system properties and prints admin messages to stdout.
  public static void main(String[] args) {
    if (args.length > 0 && ("-h".equals(args[0]) || "--help".equals(args[0]))) {
      printHelp();
      return;
    }
    AgentConfig config = AgentConfig.from(System.getProperties());
    if (config.port() == null) {
      System.err.println("Missing required property -D" + PORT);
      printHelp();
      return;
    }
    try (AgentServer server = new AgentServer(config, new InMemoryWalletRegistry(), new HttpTransport(),
        config.port()).start()) {
      //noinspection InfiniteLoopStatement
      while (true) {
        Optional<String> admin = server.agent().state().nextAdminMessage(Duration.ofSeconds(1));
        admin.ifPresent(System.out::println);
      }
    } catch (IOException e) {
      System.err.println("Could not start agent: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void printHelp() {
    System.out.println("Usage: java -D" + PORT + "=8080 [options] " + AgentServer.class.getName());
    System.out.println("  -D" + AgentConfig.PREFIX + "name=didwire        Agent name and wallet prefix");
    System.out.println("  -D" + AgentConfig.PREFIX + "passphrase=didwire  Wallet passphrase");
    System.out.println("  -D" + AgentConfig.PREFIX + "ephemeral=false     Start from an empty wallet");
    System.out.println("  -D" + AgentConfig.PREFIX + "host=<local>        Host named in the endpoint");
    System.out.println("  -D" + PORT + "=8080              Port to listen on");
  }
}
