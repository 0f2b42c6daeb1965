// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.AgentState;
import com.github.didwire.TypeRouter;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageContext;
import com.github.didwire.network.Transport;
import com.github.didwire.network.TransportException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Runs the agent's side of `connections/1.0`. Each invitation the agent issues gets its own [InviterRole], found
/// again by the invitation key the request was encrypted to. Each invitation the agent accepts gets an
/// [InviteeRole], found again by the `@id` of the request it sent.
public class ConnectionModule extends TypeRouter {
  public static final String INVITATION_RECORD = "invitation";

  private final AgentState state;
  private final Map<String, InviterRole> inviters = new HashMap<>();
  private final Map<String, InviteeRole> invitees = new HashMap<>();

  public ConnectionModule(AgentState state) {
    super(Connections.FAMILY_ID);
    this.state = state;
    register("request", this::request);
    register("response", this::response);
  }

  /// Issues a new invitation to this agent's endpoint and returns its URL.
  public String sendInvite() {
    InviterRole inviter = new InviterRole(state.wallet(), state.clock(), state.config().agentName(),
        state.config().endpoint());
    inviter.issueInvite();
    String url = inviter.inviteUrl();
    inviters.put(inviter.invitationKey(), inviter);
    state.wallet().putRecord(INVITATION_RECORD, inviter.invitationKey(), url);
    LOGGER.info(() -> "Generated invitation " + inviter.invitation().id());
    return url;
  }

  /// Accepts an invitation and sends the connection request.
  ///
  /// @return the request `@id`, which the response must carry
  /// @throws InvalidHandshakeMessageException when the URL carries no valid invitation
  public String receiveInvite(String url) {
    InviteeRole invitee = new InviteeRole(state.wallet(), state.clock(), state.config().agentName(),
        state.config().endpoint());
    Invitation invitation = invitee.receiveInvite(url);
    String failure = null;
    try {
      int status = invitee.sendRequest(state.transport());
      if (status != Transport.ACCEPTED) {
        failure = "request to " + invitation.serviceEndpoint() + " answered " + status;
      }
    } catch (TransportException e) {
      LOGGER.log(Level.WARNING, "Connection request to " + invitation.serviceEndpoint() + " was not delivered", e);
      failure = "request to " + invitation.serviceEndpoint() + " failed: " + e.getMessage();
    }
    invitees.put(invitee.requestId(), invitee);
    if (failure != null) {
      ConnectionAdminModule.handshakeFailed(state, invitee.requestId(), failure);
    }
    return invitee.requestId();
  }

  private Optional<Message> request(Message message) {
    String toKey = message.context().map(MessageContext::toKey).orElse(null);
    InviterRole inviter = toKey == null ? null : inviters.get(toKey);
    if (inviter == null) {
      LOGGER.warning(() -> "Ignoring connection request " + message.id() + " not sent to an open invitation key");
      return Optional.empty();
    }
    HandshakeOutcome outcome = inviter.handleRequest(message);
    if (outcome instanceof HandshakeOutcome.Responded responded) {
      inviters.remove(toKey);
      int status = state.transport().send(responded.response().endpoint(), responded.response().bytes());
      if (status != Transport.ACCEPTED) {
        LOGGER.warning(() -> "Connection response to " + responded.response().endpoint() + " answered " + status);
      }
      established(responded.connection());
    }
    return Optional.empty();
  }

  private Optional<Message> response(Message message) {
    InviteeRole invitee = invitees.get(message.id());
    if (invitee == null) {
      invitee = inviteeFor(message.context().map(MessageContext::toKey).orElse(null));
    }
    if (invitee == null) {
      LOGGER.warning(() -> "Connection response " + message.id() + " does not answer a request we sent");
      return Optional.empty();
    }
    String requestId = invitee.requestId();
    HandshakeOutcome outcome = invitee.handleResponse(message);
    if (outcome instanceof HandshakeOutcome.Verified verified) {
      invitees.remove(requestId);
      established(verified.connection());
    } else if (outcome instanceof HandshakeOutcome.Failed failed) {
      ConnectionAdminModule.handshakeFailed(state, requestId, failed.kind() + ": " + failed.detail());
    }
    return Optional.empty();
  }

  /// The invitee whose request was sent from `toKey`, for a response that names the wrong request.
  private InviteeRole inviteeFor(String toKey) {
    if (toKey == null) {
      return null;
    }
    return invitees.values().stream()
        .filter(invitee -> toKey.equals(invitee.myVerkey()))
        .findFirst()
        .orElse(null);
  }

  private void established(Connection connection) {
    state.wallet().createPairwise(connection.toPairwise());
    LOGGER.info(() -> "Connection established " + connection.myDid() + " <-> " + connection.theirDid());
    ConnectionAdminModule.connectionEstablished(state, connection);
  }
}
