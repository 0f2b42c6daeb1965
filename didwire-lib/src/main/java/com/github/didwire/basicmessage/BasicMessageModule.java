// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.basicmessage;

import com.github.didwire.AgentState;
import com.github.didwire.TypeRouter;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageContext;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageSerializer;
import com.github.didwire.msg.MessageType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// `basicmessage/1.0`: keeps text messages from connected peers and reports them on the admin queue.
public class BasicMessageModule extends TypeRouter {
  public static final String ADMIN_FAMILY_ID = MessageType.familyId("admin_basicmessage", "1.0");
  public static final String MESSAGE_RECEIVED = ADMIN_FAMILY_ID + "/message_received";

  static final String RECORD_PREFIX = "basicmessage:";

  private final AgentState state;

  public BasicMessageModule(AgentState state) {
    super(BasicMessage.FAMILY_ID);
    this.state = state;
    register("message", this::receive);
  }

  /// Sends a basic message over an established connection.
  public int send(String theirDid, String content) {
    BasicMessage message = BasicMessage.create(content, state.clock());
    state.wallet().putRecord(RECORD_PREFIX + theirDid, message.id(), record("me", message));
    return state.sendToDid(theirDid, message.toMessage());
  }

  /// Messages exchanged with a peer keyed by `@id`, as JSON.
  public Map<String, String> history(String theirDid) {
    return state.wallet().records(RECORD_PREFIX + theirDid);
  }

  private Optional<Message> receive(Message message) {
    String from = message.context().map(MessageContext::fromDid).orElse(null);
    if (from == null) {
      LOGGER.warning(() -> "Dropping basic message " + message.id() + " from an unknown sender");
      return Optional.empty();
    }
    BasicMessage basic = BasicMessage.fromMessage(message);
    state.wallet().putRecord(RECORD_PREFIX + from, basic.id(), record(from, basic));
    state.sendAdminMessage(Message.ofType(MESSAGE_RECEIVED)
        .put(Message.ID, MessageIds.next())
        .put("from", from)
        .put("message", basic.toMessage().fields()));
    return Optional.empty();
  }

  private static String record(String from, BasicMessage message) {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("from", from);
    value.put(BasicMessage.SENT_TIME, message.sentTime().toString());
    value.put(BasicMessage.CONTENT, message.content());
    return MessageSerializer.toJson(value);
  }
}
