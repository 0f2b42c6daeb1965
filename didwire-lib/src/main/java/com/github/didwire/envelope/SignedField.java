// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A detached signature over a timestamped JSON payload as carried in a `<name>~sig` message field.
///
/// `sigData` is base64url of an 8 byte big-endian unix time followed by the UTF-8 JSON of the payload.
/// `signature` is base64url of the signer's signature over exactly those bytes.
public record SignedField(String type, String signer, String sigData, String signature) {

  public static final String SIGNATURE_TYPE = "did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/signature/1.0/ed25519Sha512_single";

  public static final String TYPE = "@type";
  public static final String SIGNER = "signer";
  public static final String SIG_DATA = "sig_data";
  public static final String SIGNATURE = "signature";

  public SignedField {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(signer, "signer cannot be null");
    Objects.requireNonNull(sigData, "sigData cannot be null");
    Objects.requireNonNull(signature, "signature cannot be null");
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(TYPE, type);
    map.put(SIGNER, signer);
    map.put(SIG_DATA, sigData);
    map.put(SIGNATURE, signature);
    return map;
  }

  /// @throws MalformedSignedFieldException when a member is missing or is not a string
  public static SignedField fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new MalformedSignedFieldException("Signed field is absent");
    }
    return new SignedField(member(map, TYPE), member(map, SIGNER), member(map, SIG_DATA), member(map, SIGNATURE));
  }

  /// True when all four members are present as strings.
  public static boolean isComplete(Map<String, Object> map) {
    return map != null
        && map.get(TYPE) instanceof String
        && map.get(SIGNER) instanceof String
        && map.get(SIG_DATA) instanceof String
        && map.get(SIGNATURE) instanceof String;
  }

  private static String member(Map<String, Object> map, String key) {
    if (map.get(key) instanceof String s) {
      return s;
    }
    throw new MalformedSignedFieldException("Signed field missing " + key);
  }
}
