// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import javax.crypto.KeyAgreement;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.NamedParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;
import java.util.Arrays;

/// Raw key encodings and the Ed25519 to X25519 conversion that lets one verkey both sign and receive envelopes.
///
/// An Ed25519 public key is the little-endian `y` coordinate of an Edwards point with the sign of `x` in the top
/// bit. The birational map `u = (1 + y) / (1 - y) mod p` gives the Montgomery `u` coordinate used by X25519. The
/// X25519 private scalar is the first half of `SHA-512(seed)`, the same scalar Ed25519 signs with, so Diffie-Hellman
/// over the converted keys agrees on both sides.
final class Keys {
  static final int RAW_KEY_LENGTH = 32;

  // DER SubjectPublicKeyInfo prefixes in front of the 32 raw key bytes
  private static final byte[] ED25519_SPKI_PREFIX = hex("302a300506032b6570032100");
  private static final byte[] X25519_SPKI_PREFIX = hex("302a300506032b656e032100");

  private static final BigInteger P = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

  private Keys() {
  }

  static KeyPair generateEd25519() throws GeneralSecurityException {
    return KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
  }

  static KeyPair generateX25519() throws GeneralSecurityException {
    return KeyPairGenerator.getInstance("X25519").generateKeyPair();
  }

  /// The 32 raw bytes of an Ed25519 or X25519 public key.
  static byte[] raw(PublicKey key) {
    byte[] encoded = key.getEncoded();
    return Arrays.copyOfRange(encoded, encoded.length - RAW_KEY_LENGTH, encoded.length);
  }

  static PublicKey ed25519Public(byte[] raw) throws GeneralSecurityException {
    checkLength(raw);
    return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(concat(ED25519_SPKI_PREFIX, raw)));
  }

  static PublicKey x25519Public(byte[] raw) throws GeneralSecurityException {
    checkLength(raw);
    return KeyFactory.getInstance("X25519").generatePublic(new X509EncodedKeySpec(concat(X25519_SPKI_PREFIX, raw)));
  }

  /// Converts a raw Ed25519 public key into the X25519 public key of the same keypair.
  static PublicKey ed25519ToX25519Public(byte[] edRaw) throws GeneralSecurityException {
    checkLength(edRaw);
    byte[] bigEndian = new byte[RAW_KEY_LENGTH];
    for (int i = 0; i < RAW_KEY_LENGTH; i++) {
      bigEndian[i] = edRaw[RAW_KEY_LENGTH - 1 - i];
    }
    bigEndian[0] &= 0x7f; // drop the sign bit of x
    BigInteger y = new BigInteger(1, bigEndian);
    if (y.compareTo(P) >= 0 || y.equals(BigInteger.ONE)) {
      throw new GeneralSecurityException("Not a usable Ed25519 public key");
    }
    BigInteger u = BigInteger.ONE.add(y)
        .multiply(BigInteger.ONE.subtract(y).mod(P).modInverse(P))
        .mod(P);
    return KeyFactory.getInstance("X25519").generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, u));
  }

  /// Converts an Ed25519 private key into the X25519 private key of the same keypair.
  static PrivateKey ed25519ToX25519Private(PrivateKey edPrivate) throws GeneralSecurityException {
    if (!(edPrivate instanceof EdECPrivateKey edec)) {
      throw new GeneralSecurityException("Not an Ed25519 private key: " + edPrivate.getAlgorithm());
    }
    byte[] seed = edec.getBytes()
        .orElseThrow(() -> new GeneralSecurityException("Ed25519 private key has no extractable seed"));
    byte[] hash = MessageDigest.getInstance("SHA-512").digest(seed);
    // XDH clamps the scalar itself
    byte[] scalar = Arrays.copyOf(hash, RAW_KEY_LENGTH);
    return KeyFactory.getInstance("X25519").generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, scalar));
  }

  static byte[] agree(PrivateKey mine, PublicKey theirs) throws GeneralSecurityException {
    KeyAgreement agreement = KeyAgreement.getInstance("X25519");
    agreement.init(mine);
    agreement.doPhase(theirs, true);
    return agreement.generateSecret();
  }

  static byte[] concat(byte[]... parts) {
    int length = 0;
    for (byte[] part : parts) {
      length += part.length;
    }
    byte[] result = new byte[length];
    int offset = 0;
    for (byte[] part : parts) {
      System.arraycopy(part, 0, result, offset, part.length);
      offset += part.length;
    }
    return result;
  }

  private static void checkLength(byte[] raw) throws GeneralSecurityException {
    if (raw.length != RAW_KEY_LENGTH) {
      throw new GeneralSecurityException("Raw key must be " + RAW_KEY_LENGTH + " bytes but was " + raw.length);
    }
  }

  private static byte[] hex(String hex) {
    byte[] bytes = new byte[hex.length() / 2];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) Integer.parseInt(hex.substring(2 * i, 2 * i + 2), 16);
    }
    return bytes;
  }
}
