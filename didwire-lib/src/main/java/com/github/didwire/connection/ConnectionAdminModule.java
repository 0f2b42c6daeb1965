// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.AgentState;
import com.github.didwire.TypeRouter;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageType;

import java.util.Map;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// `admin_connections/1.0`: lets the admin client start handshakes and tells it how they end.
public class ConnectionAdminModule extends TypeRouter {
  public static final String FAMILY_ID = MessageType.familyId("admin_connections", "1.0");
  public static final String SEND_INVITE = FAMILY_ID + "/send_invite";
  public static final String INVITE_GENERATED = FAMILY_ID + "/invite_generated";
  public static final String RECEIVE_INVITE = FAMILY_ID + "/receive_invite";
  public static final String CONNECTION_ESTABLISHED = FAMILY_ID + "/connection_established";
  public static final String HANDSHAKE_FAILED = FAMILY_ID + "/handshake_failed";

  public static final String INVITE = "invite";

  private final AgentState state;
  private final ConnectionModule connections;

  public ConnectionAdminModule(AgentState state, ConnectionModule connections) {
    super(FAMILY_ID);
    this.state = state;
    this.connections = connections;
    register("send_invite", this::sendInvite);
    register("receive_invite", this::receiveInvite);
  }

  public static Message sendInviteMessage() {
    return Message.ofType(SEND_INVITE).put(Message.ID, MessageIds.next());
  }

  public static Message receiveInviteMessage(String url) {
    return Message.ofType(RECEIVE_INVITE).put(Message.ID, MessageIds.next()).put(INVITE, url);
  }

  private Optional<Message> sendInvite(Message message) {
    String url = connections.sendInvite();
    state.sendAdminMessage(Message.ofType(INVITE_GENERATED)
        .put(Message.ID, MessageIds.next())
        .put(INVITE, url));
    return Optional.empty();
  }

  private Optional<Message> receiveInvite(Message message) {
    String url = message.getString(INVITE);
    try {
      connections.receiveInvite(url);
    } catch (InvalidHandshakeMessageException e) {
      LOGGER.warning(() -> "Admin supplied an unusable invitation: " + e.getMessage());
      handshakeFailed(state, message.id(), e.getMessage());
    }
    return Optional.empty();
  }

  static void connectionEstablished(AgentState state, Connection connection) {
    state.sendAdminMessage(Message.ofType(CONNECTION_ESTABLISHED)
        .put(Message.ID, MessageIds.next())
        .put("my_did", connection.myDid())
        .put("their_did", connection.theirDid())
        .put("their_endpoint", connection.theirEndpoint())
        .put("label", connection.theirLabel()));
  }

  static void handshakeFailed(AgentState state, String thread, String detail) {
    state.sendAdminMessage(Message.ofType(HANDSHAKE_FAILED)
        .put(Message.ID, MessageIds.next())
        .put(Message.THREAD, Map.of("thid", String.valueOf(thread)))
        .put("detail", detail));
  }
}
