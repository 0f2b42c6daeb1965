// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.msg.Message;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.didwire.connection.Connections.*;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireMap;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireString;

/// `{@type, @id, label, connection: {DID, DIDDoc}}` sent by the invitee to the invitation key.
public record ConnectionRequest(String id, String label, String did, DidDoc didDoc) {

  public Message toMessage() {
    Map<String, Object> connection = new LinkedHashMap<>();
    connection.put(DID, did);
    connection.put(DID_DOC, didDoc.toMap());
    return Message.ofType(REQUEST)
        .put(Message.ID, id)
        .put(LABEL, label)
        .put(CONNECTION, connection);
  }

  /// @throws InvalidHandshakeMessageException when a field is missing or the DIDDoc does not match the DID
  public static ConnectionRequest fromMessage(Message message) {
    if (!REQUEST.equals(message.type())) {
      throw new InvalidHandshakeMessageException("Not a connection request: " + message.type());
    }
    String id = requireString(message.get(Message.ID), "request @id");
    String label = requireString(message.get(LABEL), "request label");
    Map<String, Object> connection = requireMap(message.get(CONNECTION), "request connection");
    String did = requireString(connection.get(DID), "request connection.DID");
    DidDoc didDoc = DidDoc.parse(connection.get(DID_DOC), did);
    return new ConnectionRequest(id, label, did, didDoc);
  }
}
