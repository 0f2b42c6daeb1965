// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

import static com.github.didwire.DidwireLogger.LOGGER;

/// AES-256-GCM with a random nonce. A sealed box is laid out as:
///
/// ```
/// nonce:      12 bytes
/// ciphertext: N bytes
/// auth_tag:   16 bytes
/// ```
final class Aead {
  static final int GCM_NONCE_LENGTH = 12;
  static final int GCM_TAG_LENGTH = 16;
  static final int GCM_TAG_LENGTH_BITS = 128;
  static final int KEY_SIZE = 32;

  private static final ThreadLocal<SecureRandom> RANDOM = ThreadLocal.withInitial(SecureRandom::new);
  private static final ThreadLocal<Cipher> CIPHER = ThreadLocal.withInitial(() -> {
    try {
      return Cipher.getInstance("AES/GCM/NoPadding");
    } catch (GeneralSecurityException e) {
      throw new RuntimeException("Required crypto algorithm unavailable", e);
    }
  });

  private Aead() {
  }

  static byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    RANDOM.get().nextBytes(bytes);
    return bytes;
  }

  static byte[] seal(byte[] key, byte[] plaintext, byte[] aad) {
    try {
      byte[] nonce = randomBytes(GCM_NONCE_LENGTH);
      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.ENCRYPT_MODE,
          new SecretKeySpec(key, "AES"),
          new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
      if (aad != null) {
        cipher.updateAAD(aad);
      }
      byte[] encrypted = cipher.doFinal(plaintext);
      return ByteBuffer.allocate(nonce.length + encrypted.length)
          .put(nonce)
          .put(encrypted)
          .array();
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Encryption failed", e);
    }
  }

  /// @throws SecurityException when the box is truncated, tampered with or sealed under another key
  static byte[] open(byte[] key, byte[] sealed, byte[] aad) {
    if (sealed.length < GCM_NONCE_LENGTH + GCM_TAG_LENGTH) {
      throw new SecurityException("Sealed box too short: " + sealed.length);
    }
    try {
      // grab the nonce
      ByteBuffer input = ByteBuffer.wrap(sealed);
      byte[] nonce = new byte[GCM_NONCE_LENGTH];
      input.get(nonce);

      // grab the encrypted payload with its tag
      byte[] encrypted = new byte[input.remaining()];
      input.get(encrypted);

      Cipher cipher = CIPHER.get();
      cipher.init(Cipher.DECRYPT_MODE,
          new SecretKeySpec(key, "AES"),
          new GCMParameterSpec(GCM_TAG_LENGTH_BITS, nonce));
      if (aad != null) {
        cipher.updateAAD(aad);
      }
      return cipher.doFinal(encrypted);
    } catch (GeneralSecurityException e) {
      LOGGER.finest(() -> "Decryption failed: " + e);
      throw new SecurityException("Decryption failed", e);
    }
  }
}
