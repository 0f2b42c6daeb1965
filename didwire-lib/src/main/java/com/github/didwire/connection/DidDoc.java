// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.crypto.Base58;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.didwire.connection.InvalidHandshakeMessageException.requireMap;
import static com.github.didwire.connection.InvalidHandshakeMessageException.requireString;

/// The document binding a DID to its verkey and service endpoint:
///
/// ```
/// { "@context": "https://w3id.org/did/v1",
///   "id": DID,
///   "publicKey": [{ "id": DID#keys-1, "type": "Ed25519VerificationKey2018", "controller": DID,
///                   "publicKeyBase58": verkey }],
///   "service":   [{ "id": DID;indy, "type": "IndyAgent", "recipientKeys": [verkey], "routingKeys": [],
///                   "serviceEndpoint": endpoint }] }
/// ```
public record DidDoc(String did, String verkey, String endpoint) {
  public static final String CONTEXT = "https://w3id.org/did/v1";
  public static final String KEY_TYPE = "Ed25519VerificationKey2018";
  public static final String SERVICE_TYPE = "IndyAgent";
  public static final int VERKEY_LENGTH = 32;

  public Map<String, Object> toMap() {
    Map<String, Object> publicKey = new LinkedHashMap<>();
    publicKey.put("id", did + "#keys-1");
    publicKey.put("type", KEY_TYPE);
    publicKey.put("controller", did);
    publicKey.put("publicKeyBase58", verkey);

    Map<String, Object> service = new LinkedHashMap<>();
    service.put("id", did + ";indy");
    service.put("type", SERVICE_TYPE);
    service.put("recipientKeys", List.of(verkey));
    service.put("routingKeys", List.of());
    service.put("serviceEndpoint", endpoint);

    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("@context", CONTEXT);
    doc.put("id", did);
    doc.put("publicKey", List.of(publicKey));
    doc.put("service", List.of(service));
    return doc;
  }

  /// Reads a DIDDoc and checks that it is about `expectedDid`, that its key is a base58 Ed25519 key controlled by
  /// that DID and that its service lists the key and an endpoint.
  ///
  /// @throws InvalidHandshakeMessageException when any of that does not hold
  public static DidDoc parse(Object value, String expectedDid) {
    Map<String, Object> doc = requireMap(value, "DIDDoc");
    String id = requireString(doc.get("id"), "DIDDoc id");
    if (!id.equals(expectedDid)) {
      throw new InvalidHandshakeMessageException("DIDDoc is about " + id + " not " + expectedDid);
    }
    Map<String, Object> publicKey = requireMap(first(doc.get("publicKey"), "DIDDoc publicKey"), "DIDDoc publicKey");
    String verkey = requireVerkey(requireString(publicKey.get("publicKeyBase58"), "DIDDoc publicKeyBase58"));
    String controller = requireString(publicKey.get("controller"), "DIDDoc key controller");
    if (!controller.equals(expectedDid)) {
      throw new InvalidHandshakeMessageException("DIDDoc key is controlled by " + controller + " not " + expectedDid);
    }
    Map<String, Object> service = requireMap(first(doc.get("service"), "DIDDoc service"), "DIDDoc service");
    if (!(service.get("recipientKeys") instanceof List<?> keys) || !keys.contains(verkey)) {
      throw new InvalidHandshakeMessageException("DIDDoc service does not list key " + verkey);
    }
    String endpoint = requireString(service.get("serviceEndpoint"), "DIDDoc serviceEndpoint");
    return new DidDoc(id, verkey, endpoint);
  }

  private static String requireVerkey(String verkey) {
    final byte[] raw;
    try {
      raw = Base58.decode(verkey);
    } catch (IllegalArgumentException e) {
      throw new InvalidHandshakeMessageException("DIDDoc key " + verkey + " is not base58", e);
    }
    if (raw.length != VERKEY_LENGTH) {
      throw new InvalidHandshakeMessageException("DIDDoc key " + verkey + " is " + raw.length + " bytes not "
          + VERKEY_LENGTH);
    }
    return verkey;
  }

  private static Object first(Object value, String what) {
    if (value instanceof List<?> list && !list.isEmpty()) {
      return list.get(0);
    }
    throw new InvalidHandshakeMessageException("Missing " + what);
  }
}
