// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.crypto.LocalIdentity;
import com.github.didwire.crypto.PairwiseInfo;
import com.github.didwire.crypto.Wallet;
import com.github.didwire.crypto.WalletCreation;
import com.github.didwire.crypto.WalletRegistry;
import com.github.didwire.crypto.WalletUnavailableException;
import com.github.didwire.envelope.SecureEnvelope;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageSerializer;
import com.github.didwire.network.Transport;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Everything one agent owns: configuration, the open wallet, the router, the inbound queue, the admin queue and
/// the outbound transport. Modules are given the state when they are constructed. Mutation happens on the
/// processing thread, apart from the two queues which are thread safe.
public class AgentState {
  private final AgentConfig config;
  private final WalletRegistry wallets;
  private final Transport transport;
  private final Clock clock;
  private final FamilyRouter router = new FamilyRouter();
  private final LinkedBlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
  private final LinkedBlockingQueue<String> adminOutbound = new LinkedBlockingQueue<>();

  private volatile Wallet wallet;
  private volatile boolean initialized;
  private String owner;
  private LocalIdentity endpointIdentity;
  private String agentAdminKey;
  private String adminKey;

  public AgentState(AgentConfig config, WalletRegistry wallets, Transport transport, Clock clock) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.wallets = Objects.requireNonNull(wallets, "wallets cannot be null");
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  public AgentConfig config() {
    return config;
  }

  public Transport transport() {
    return transport;
  }

  public Clock clock() {
    return clock;
  }

  public FamilyRouter router() {
    return router;
  }

  LinkedBlockingQueue<byte[]> inbound() {
    return inbound;
  }

  public boolean initialized() {
    return initialized;
  }

  public Optional<String> owner() {
    return Optional.ofNullable(owner);
  }

  /// @throws WalletUnavailableException when no wallet is connected
  public Wallet wallet() {
    Wallet current = wallet;
    if (current == null || !current.isOpen()) {
      throw new WalletUnavailableException("No wallet is open");
    }
    return current;
  }

  public SecureEnvelope envelope() {
    Wallet current = wallet();
    return new SecureEnvelope(current, current);
  }

  /// @throws WalletUnavailableException when no wallet is connected
  public LocalIdentity endpointIdentity() {
    if (endpointIdentity == null) {
      throw new WalletUnavailableException("Agent is not initialized");
    }
    return endpointIdentity;
  }

  // ---------------------------------------------------------------- wallet lifecycle

  public void connectWallet() {
    connectWallet(config.agentName(), config.walletPassphrase(), config.ephemeral());
  }

  /// Creates the wallet when needed and opens it. An ephemeral wallet is deleted first so that it starts empty.
  ///
  /// @throws WalletUnavailableException when the wallet cannot be opened
  public void connectWallet(String agentName, String passphrase, boolean ephemeral) {
    if (wallet != null) {
      disconnectWallet();
    }
    String walletName = config.withAgentName(agentName).withEphemeral(ephemeral).walletName();
    if (ephemeral && wallets.delete(walletName, passphrase)) {
      LOGGER.fine(() -> "Deleted previous ephemeral wallet " + walletName);
    }
    WalletCreation creation = wallets.create(walletName, passphrase);
    if (creation instanceof WalletCreation.Failed failed) {
      LOGGER.log(Level.WARNING, "Could not create wallet " + walletName, failed.cause());
    }
    Wallet opened = wallets.open(walletName, passphrase);
    wallet = opened;
    owner = agentName;
    endpointIdentity = opened.createLocalIdentity();
    initialized = true;
    LOGGER.info(() -> String.format("Agent %s connected to wallet %s with endpoint DID %s",
        agentName, walletName, endpointIdentity.did()));
  }

  public void disconnectWallet() {
    Wallet current = wallet;
    wallet = null;
    if (current != null) {
      current.close();
    }
    owner = null;
    endpointIdentity = null;
    initialized = false;
    LOGGER.info("Agent disconnected from wallet");
  }

  // ---------------------------------------------------------------- outbound

  /// Packs the message for `theirVerkey` and posts it to `endpoint`. With no `myVerkey` the envelope is anonymous.
  ///
  /// @return the status the far end answered with
  public int sendToEndpoint(String theirVerkey, String endpoint, Message message, @Nullable String myVerkey) {
    byte[] wire = envelope().pack(message, theirVerkey, myVerkey);
    LOGGER.fine(() -> String.format("Sending %s to %s", message.type(), endpoint));
    return transport.send(endpoint, wire);
  }

  /// Sends over an established pairwise relationship, authenticated with our key for it.
  ///
  /// @throws IllegalArgumentException when there is no relationship with the DID
  public int sendToDid(String theirDid, Message message) {
    Wallet current = wallet();
    PairwiseInfo pairwise = current.pairwiseInfo(theirDid);
    String myVerkey = current.localKeyForDid(pairwise.myDid());
    return sendToEndpoint(pairwise.theirVerkey(), pairwise.theirEndpoint(), message, myVerkey);
  }

  // ---------------------------------------------------------------- admin channel

  /// Creates the key the agent packs admin messages with and remembers the key of the admin client.
  ///
  /// @return the agent admin key
  public String setupAdmin(String adminKey) {
    this.agentAdminKey = wallet().createKey();
    this.adminKey = adminKey;
    LOGGER.fine(() -> "Admin channel keyed to " + adminKey);
    return agentAdminKey;
  }

  /// Queues a message for the admin client, packed to its key when the admin channel is set up.
  public void sendAdminMessage(Message message) {
    String text;
    if (agentAdminKey != null && adminKey != null) {
      byte[] packed = envelope().pack(message, adminKey, agentAdminKey);
      text = new String(packed, StandardCharsets.UTF_8);
    } else {
      text = MessageSerializer.serializeToString(message);
    }
    LOGGER.finer(() -> "Queued admin message " + message.type());
    adminOutbound.add(text);
  }

  /// Takes the next admin message, waiting at most `timeout`.
  public Optional<String> nextAdminMessage(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(adminOutbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
  }
}
