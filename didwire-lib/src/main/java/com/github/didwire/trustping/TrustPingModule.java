// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.trustping;

import com.github.didwire.AgentState;
import com.github.didwire.TypeRouter;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageType;

import java.util.Map;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// `trust_ping/1.0`: answers a ping with a response threaded to it.
public class TrustPingModule extends TypeRouter {
  public static final String FAMILY_ID = MessageType.familyId("trust_ping", "1.0");
  public static final String PING = FAMILY_ID + "/ping";
  public static final String PING_RESPONSE = FAMILY_ID + "/ping_response";

  private final AgentState state;

  public TrustPingModule(AgentState state) {
    super(FAMILY_ID);
    this.state = state;
    register("ping", this::answerPing);
    register("ping_response", this::pingResponse);
  }

  public static Message pingMessage() {
    return Message.ofType(PING).put(Message.ID, MessageIds.next());
  }

  /// Pings a connected peer.
  public int ping(String theirDid) {
    return state.sendToDid(theirDid, pingMessage());
  }

  private Optional<Message> answerPing(Message message) {
    return Optional.of(Message.ofType(PING_RESPONSE)
        .put(Message.ID, MessageIds.next())
        .put(Message.THREAD, Map.of("thid", String.valueOf(message.id()))));
  }

  private Optional<Message> pingResponse(Message message) {
    LOGGER.fine(() -> "Ping answered: " + message.get(Message.THREAD));
    return Optional.empty();
  }
}
