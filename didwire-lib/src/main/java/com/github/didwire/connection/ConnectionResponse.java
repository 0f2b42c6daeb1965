// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.envelope.SignedField;
import com.github.didwire.msg.Message;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.didwire.connection.Connections.*;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireMap;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireString;

/// `{@type, @id, connection~sig}` sent by the inviter. The clear `connection` only exists before signing and
/// after verification.
public record ConnectionResponse(String id, String did, DidDoc didDoc) {
  public static final String CONNECTION_SIG = CONNECTION + Message.SIG_SUFFIX;

  /// The unsigned response, threaded to the request by its `@id`.
  public Message toMessage() {
    Map<String, Object> connection = new LinkedHashMap<>();
    connection.put(DID, did);
    connection.put(DID_DOC, didDoc.toMap());
    return Message.ofType(RESPONSE)
        .put(Message.ID, id)
        .put(CONNECTION, connection);
  }

  /// Checks the shape that can be checked before trusting anything: the type, the thread and a complete
  /// `connection~sig`.
  ///
  /// @return the declared signer
  /// @throws InvalidHandshakeMessageException when the shape is wrong
  public static String validatePreSignature(Message message, String expectedId) {
    if (!RESPONSE.equals(message.type())) {
      throw new InvalidHandshakeMessageException("Not a connection response: " + message.type());
    }
    Map<String, Object> sig = message.getMap(CONNECTION_SIG);
    if (!SignedField.isComplete(sig)) {
      throw new InvalidHandshakeMessageException("Response has no complete " + CONNECTION_SIG);
    }
    checkThread(message, expectedId);
    return (String) sig.get(SignedField.SIGNER);
  }

  /// Full validation of a response whose `connection` has been restored from the verified signature.
  ///
  /// @throws InvalidHandshakeMessageException when a field is missing or inconsistent
  public static ConnectionResponse fromVerifiedMessage(Message message, String expectedId) {
    checkThread(message, expectedId);
    Map<String, Object> connection = requireMap(message.get(CONNECTION), "response connection");
    String did = requireString(connection.get(DID), "response connection.DID");
    DidDoc didDoc = DidDoc.parse(connection.get(DID_DOC), did);
    return new ConnectionResponse(message.id(), did, didDoc);
  }

  private static void checkThread(Message message, String expectedId) {
    if (!expectedId.equals(message.id())) {
      throw new InvalidHandshakeMessageException(
          "Response @id " + message.id() + " does not match request @id " + expectedId);
    }
  }
}
