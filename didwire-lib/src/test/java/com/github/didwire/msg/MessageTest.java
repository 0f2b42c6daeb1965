// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTest {
  static final String TYPE = "did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/connections/1.0/request";

  @Test
  void parsesTypeUri() {
    MessageType type = MessageType.parse(TYPE);
    assertThat(type.baseDid()).isEqualTo(MessageType.BASE_DID);
    assertThat(type.family()).isEqualTo("connections");
    assertThat(type.version()).isEqualTo("1.0");
    assertThat(type.name()).isEqualTo("request");
    assertThat(type.familyId()).isEqualTo(MessageType.familyId("connections", "1.0"));
    assertThat(type.uri()).isEqualTo(TYPE);
  }

  @Test
  void rejectsTypesThatAreNotUris() {
    assertThatThrownBy(() -> MessageType.parse("connections/request")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MessageType.parse(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void contextIsAttachedOnceAndIgnoredByEquality() {
    Message message = Message.ofType(TYPE).put(Message.ID, "abc");
    Message copy = Message.ofType(TYPE).put(Message.ID, "abc");
    assertThat(message.context()).isEmpty();

    message.attachContext(new MessageContext("did", null, "key", "to"));

    assertThat(message.context()).hasValueSatisfying(c -> assertThat(c.senderAuthenticated()).isTrue());
    assertThat(message).isEqualTo(copy);
    assertThatThrownBy(() -> message.attachContext(MessageContext.PLAINTEXT))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void typedGettersReturnNullForOtherTypes() {
    Message message = Message.ofType(TYPE).put("n", 1);
    assertThat(message.getString("n")).isNull();
    assertThat(message.getMap("n")).isNull();
    assertThat(message.getList("missing")).isNull();
    assertThat(message.id()).isNull();
  }

  @Test
  void idsAreUniqueVersionSevenUuids() {
    String first = MessageIds.next();
    String second = MessageIds.next();
    assertThat(first).isNotEqualTo(second);
    assertThat(UUID.fromString(first).version()).isEqualTo(7);
  }
}
