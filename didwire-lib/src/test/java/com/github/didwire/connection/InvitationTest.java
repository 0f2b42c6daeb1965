// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageSerializer;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvitationTest {

  @Test
  void urlCarriesTheInvitation() {
    Invitation invitation = new Invitation("inv-1", "L", List.of("V1"), "http://inviter/ep");

    String url = invitation.toUrl();

    assertThat(url).startsWith("http://inviter/ep?c_i=");
    assertThat(Invitation.fromUrl(url)).isEqualTo(invitation);
  }

  @Test
  void messageHasTheWireShape() {
    Message message = new Invitation("inv-1", "L", List.of("V1"), "http://inviter/ep").toMessage();
    assertThat(message.fields().keySet())
        .containsExactly("@type", "label", "recipientKeys", "serviceEndpoint", "@id");
    assertThat(message.type()).isEqualTo(Connections.INVITATION);
  }

  @Test
  void acceptsUnpaddedBlobsAndOtherParameters() {
    Invitation invitation = new Invitation("inv-2", "L", List.of("V1"), "http://inviter/ep");
    String blob = Base64.getUrlEncoder().withoutPadding()
        .encodeToString(MessageSerializer.serialize(invitation.toMessage()));

    assertThat(Invitation.fromUrl("http://other/x?foo=bar&c_i=" + blob)).isEqualTo(invitation);
  }

  @Test
  void rejectsIncompleteInvitations() {
    assertThatThrownBy(() -> Invitation.fromUrl("http://inviter/ep"))
        .isInstanceOf(InvalidHandshakeMessageException.class);
    assertThatThrownBy(() -> Invitation.fromUrl("http://inviter/ep?c_i=!!!"))
        .isInstanceOf(InvalidHandshakeMessageException.class);

    Message noKeys = new Invitation("inv-3", "L", List.of("V1"), "http://inviter/ep").toMessage()
        .put(Connections.RECIPIENT_KEYS, List.of());
    assertThatThrownBy(() -> Invitation.fromMessage(noKeys)).isInstanceOf(InvalidHandshakeMessageException.class);

    Message noEndpoint = new Invitation("inv-4", "L", List.of("V1"), "http://inviter/ep").toMessage();
    noEndpoint.remove(Connections.SERVICE_ENDPOINT);
    assertThatThrownBy(() -> Invitation.fromMessage(noEndpoint)).isInstanceOf(InvalidHandshakeMessageException.class);
  }
}
