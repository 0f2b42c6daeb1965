// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import com.github.didwire.connection.Connection;
import com.github.didwire.connection.ConnectionRequest;
import com.github.didwire.connection.Connections;
import com.github.didwire.connection.DidDoc;
import com.github.didwire.connection.HandshakeOutcome;
import com.github.didwire.connection.Invitation;
import com.github.didwire.connection.InviteeRole;
import com.github.didwire.connection.InviterRole;
import com.github.didwire.crypto.LocalIdentity;
import com.github.didwire.crypto.Wallet;
import com.github.didwire.envelope.SecureEnvelope;
import com.github.didwire.envelope.UnpackResult;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.network.Transport;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Drives the `connections/1.0` handshake against an agent under test. The suite plays the opposite role with its
/// own wallet and only talks to the agent through wire bytes and the [InviteExchange].
public class ConnectionConformance {
  private final SuiteConfig config;
  private final Wallet wallet;
  private final ConformanceTransport inbound;
  private final Transport network;
  private final InviteExchange agent;
  private final Clock clock;

  public ConnectionConformance(SuiteConfig config, Wallet wallet, ConformanceTransport inbound, Transport network,
                               InviteExchange agent, Clock clock) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.wallet = Objects.requireNonNull(wallet, "wallet cannot be null");
    this.inbound = Objects.requireNonNull(inbound, "inbound cannot be null");
    this.network = Objects.requireNonNull(network, "network cannot be null");
    this.agent = Objects.requireNonNull(agent, "agent cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /// The agent invites and the suite accepts. Passes when the agent's response verifies.
  public Connection connectionStartedByAgent() {
    InviteeRole invitee = new InviteeRole(wallet, clock, config.label(), config.endpoint());
    invitee.receiveInvite(agent.inviteFromAgent());
    int status = invitee.sendRequest(network);
    if (status != Transport.ACCEPTED) {
      throw new ConformanceFailure("Agent answered connection request with " + status);
    }
    Message response = unpack(inbound.expectMessage(config.expectTimeout()));
    HandshakeOutcome outcome = invitee.handleResponse(response);
    if (outcome instanceof HandshakeOutcome.Verified verified) {
      LOGGER.info(() -> "Connection started by agent established with " + verified.connection().theirDid());
      return verified.connection();
    }
    throw new ConformanceFailure("Connection response rejected: " + outcome);
  }

  /// The suite invites and the agent accepts. Passes when the agent's request validates and our response is
  /// accepted for delivery.
  public Connection connectionStartedBySuite() {
    InviterRole inviter = new InviterRole(wallet, clock, config.label(), config.endpoint());
    inviter.issueInvite();
    agent.inviteToAgent(inviter.inviteUrl());
    Message request = unpack(inbound.expectMessage(config.expectTimeout()));
    HandshakeOutcome outcome = inviter.handleRequest(request);
    if (!(outcome instanceof HandshakeOutcome.Responded responded)) {
      throw new ConformanceFailure("Connection request rejected: " + outcome);
    }
    int status = network.send(responded.response().endpoint(), responded.response().bytes());
    if (status != Transport.ACCEPTED) {
      throw new ConformanceFailure("Agent answered connection response with " + status);
    }
    LOGGER.info(() -> "Connection started by suite established with " + responded.connection().theirDid());
    return responded.connection();
  }

  /// A request whose `connection` has no DIDDoc must get no answer at all.
  public void badConnectionRequestIsIgnored() {
    Invitation invitation = Invitation.fromUrl(agent.inviteFromAgent());
    LocalIdentity me = wallet.createLocalIdentity();
    Message request = new ConnectionRequest(MessageIds.next(), config.label(), me.did(),
        new DidDoc(me.did(), me.verkey(), config.endpoint())).toMessage();
    Map<String, Object> connection = request.getMap(Connections.CONNECTION);
    connection.remove(Connections.DID_DOC);

    byte[] packed = new SecureEnvelope(wallet, wallet).pack(request, invitation.recipientKeys(), me.verkey());
    int status = network.send(invitation.serviceEndpoint(), packed);
    if (status != Transport.ACCEPTED) {
      throw new ConformanceFailure("Agent answered connection request with " + status);
    }
    inbound.expectSilence(config.silenceWindow());
    LOGGER.info("Bad connection request was ignored");
  }

  private Message unpack(byte[] bytes) {
    UnpackResult result = new SecureEnvelope(wallet, wallet).unpack(bytes);
    if (result instanceof UnpackResult.Unpacked unpacked) {
      return unpacked.message();
    }
    throw new ConformanceFailure("Suite could not unpack agent message: " + result);
  }
}
