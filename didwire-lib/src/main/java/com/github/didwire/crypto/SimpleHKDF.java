// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/// RFC 5869 HKDF with HMAC-SHA256. JDK 17 has no key derivation API so the two steps are written out here.
final class SimpleHKDF {
  private static final String HMAC = "HmacSHA256";

  private SimpleHKDF() {
  }

  static byte[] derive(byte[] ikm, byte[] salt, String info, int length) throws GeneralSecurityException {
    return expand(extract(salt, ikm), info.getBytes(StandardCharsets.UTF_8), length);
  }

  static byte[] extract(byte[] salt, byte[] ikm) throws GeneralSecurityException {
    if (salt == null || salt.length == 0) {
      salt = new byte[32]; // zero filled per the RFC
    }
    Mac mac = Mac.getInstance(HMAC);
    mac.init(new SecretKeySpec(salt, HMAC));
    return mac.doFinal(ikm);
  }

  static byte[] expand(byte[] prk, byte[] info, int length) throws GeneralSecurityException {
    if (length > 255 * 32) {
      throw new IllegalArgumentException("HKDF output too long: " + length);
    }
    Mac mac = Mac.getInstance(HMAC);
    mac.init(new SecretKeySpec(prk, HMAC));

    byte[] result = new byte[length];
    byte[] t = new byte[0];
    int offset = 0;
    for (int i = 1; offset < length; i++) {
      mac.update(t);
      if (info != null) {
        mac.update(info);
      }
      mac.update((byte) i);
      t = mac.doFinal();
      int chunkLength = Math.min(t.length, length - offset);
      System.arraycopy(t, 0, result, offset, chunkLength);
      offset += chunkLength;
    }
    return result;
  }
}
