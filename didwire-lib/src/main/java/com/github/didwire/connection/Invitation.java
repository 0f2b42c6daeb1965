// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageSerializer;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static com.github.didwire.connection.Connections.*;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireString;

/// An invitation to connect. It travels out of band as `<serviceEndpoint>?c_i=<base64url(JSON)>`.
public record Invitation(String id, String label, List<String> recipientKeys, String serviceEndpoint) {
  public static final String QUERY_PARAMETER = "c_i";

  public Invitation {
    recipientKeys = List.copyOf(recipientKeys);
  }

  public static Invitation create(String label, String verkey, String serviceEndpoint) {
    return new Invitation(MessageIds.next(), label, List.of(verkey), serviceEndpoint);
  }

  public Message toMessage() {
    return Message.ofType(INVITATION)
        .put(LABEL, label)
        .put(RECIPIENT_KEYS, recipientKeys)
        .put(SERVICE_ENDPOINT, serviceEndpoint)
        .put(Message.ID, id);
  }

  public String toUrl() {
    String blob = Base64.getUrlEncoder().encodeToString(MessageSerializer.serialize(toMessage()));
    return serviceEndpoint + "?" + QUERY_PARAMETER + "=" + blob;
  }

  /// @throws InvalidHandshakeMessageException when the message is not a complete invitation
  public static Invitation fromMessage(Message message) {
    if (!INVITATION.equals(message.type())) {
      throw new InvalidHandshakeMessageException("Not an invitation: " + message.type());
    }
    String id = requireString(message.get(Message.ID), "invitation @id");
    String label = requireString(message.get(LABEL), "invitation label");
    List<Object> keys = message.getList(RECIPIENT_KEYS);
    if (keys == null || keys.isEmpty()) {
      throw new InvalidHandshakeMessageException("Invitation has no recipientKeys");
    }
    List<String> recipientKeys = new ArrayList<>();
    for (Object key : keys) {
      recipientKeys.add(requireString(key, "invitation recipient key"));
    }
    String endpoint = requireString(message.get(SERVICE_ENDPOINT), "invitation serviceEndpoint");
    return new Invitation(id, label, recipientKeys, endpoint);
  }

  /// Reads the invitation carried in the `c_i` query parameter of an invitation URL.
  ///
  /// @throws InvalidHandshakeMessageException when the URL carries no readable invitation
  public static Invitation fromUrl(String url) {
    final String query;
    try {
      query = URI.create(url.trim()).getRawQuery();
    } catch (IllegalArgumentException e) {
      throw new InvalidHandshakeMessageException("Not an invitation URL: " + url, e);
    }
    if (query == null) {
      throw new InvalidHandshakeMessageException("Invitation URL has no query: " + url);
    }
    for (String parameter : query.split("&")) {
      int eq = parameter.indexOf('=');
      if (eq > 0 && parameter.substring(0, eq).equals(QUERY_PARAMETER)) {
        String blob = URLDecoder.decode(parameter.substring(eq + 1), StandardCharsets.UTF_8);
        try {
          return fromMessage(MessageSerializer.deserialize(Base64.getUrlDecoder().decode(blob)));
        } catch (InvalidHandshakeMessageException e) {
          throw e;
        } catch (IllegalArgumentException e) {
          throw new InvalidHandshakeMessageException("Unreadable invitation in " + url, e);
        }
      }
    }
    throw new InvalidHandshakeMessageException("Invitation URL has no " + QUERY_PARAMETER + " parameter: " + url);
  }
}
