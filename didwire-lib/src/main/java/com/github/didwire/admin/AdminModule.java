// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.admin;

import com.github.didwire.AgentState;
import com.github.didwire.TypeRouter;
import com.github.didwire.connection.ConnectionModule;
import com.github.didwire.crypto.PairwiseInfo;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// `admin/1.0`: reports agent state to the admin client.
public class AdminModule extends TypeRouter {
  public static final String FAMILY_ID = MessageType.familyId("admin", "1.0");
  public static final String STATE_REQUEST = FAMILY_ID + "/state_request";
  public static final String STATE = FAMILY_ID + "/state";

  private final AgentState state;

  public AdminModule(AgentState state) {
    super(FAMILY_ID);
    this.state = state;
    register("state_request", this::stateRequest);
  }

  public static Message stateRequestMessage() {
    return Message.ofType(STATE_REQUEST).put(Message.ID, MessageIds.next());
  }

  private Optional<Message> stateRequest(Message message) {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("initialized", state.initialized());
    if (state.initialized()) {
      content.put("agent_name", state.owner().orElse(null));
      content.put("endpoint", state.config().endpoint());
      content.put("endpoint_did", state.endpointIdentity().did());
      content.put("invitations", new ArrayList<>(state.wallet().records(ConnectionModule.INVITATION_RECORD).values()));
      List<Map<String, Object>> pairwise = new ArrayList<>();
      for (PairwiseInfo info : state.wallet().listPairwise()) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("their_did", info.theirDid());
        entry.put("my_did", info.myDid());
        entry.put("their_endpoint", info.theirEndpoint());
        entry.put("label", info.label());
        pairwise.add(entry);
      }
      content.put("pairwise_connections", pairwise);
    }
    state.sendAdminMessage(Message.ofType(STATE)
        .put(Message.ID, MessageIds.next())
        .put(Message.THREAD, Map.of("thid", String.valueOf(message.id())))
        .put("content", content));
    return Optional.empty();
  }
}
