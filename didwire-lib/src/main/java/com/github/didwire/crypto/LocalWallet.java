// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.didwire.DidwireLogger.LOGGER;

/// ## Reference wallet
///
/// An in-memory [Wallet] built on the JDK providers: Ed25519 keys named by their base58 verkey, X25519 key agreement
/// over the same keys, HKDF-SHA256 and AES-256-GCM. Nothing is persisted; a wallet lives as long as its
/// [InMemoryWalletRegistry].
///
/// # Envelope
///
/// ```
/// {
///   "protected":  b64url(JSON header),
///   "iv":         b64url(12 byte nonce),
///   "ciphertext": b64url(AES-GCM(cek, plaintext, aad = protected)),
///   "tag":        b64url(16 byte tag)
/// }
///
/// header = {
///   "enc": "aes256gcm", "typ": "JWM/1.0", "alg": "Authcrypt" | "Anoncrypt",
///   "recipients": [{
///     "encrypted_key": b64url(sealed cek),
///     "header": { "kid": recipient verkey, "epk": b64url(ephemeral X25519 key), "sender": b64url | null }
///   }]
/// }
/// ```
///
/// For each recipient a fresh ephemeral X25519 key is agreed with the recipient. Anoncrypt seals the content key
/// under `HKDF(ephemeral secret)`. Authcrypt also mixes in the static secret between sender and recipient, so only
/// the holder of the sender key could have sealed it, and carries the sender verkey sealed under a key derived from
/// the ephemeral secret alone so the recipient can find out who to agree with.
public class LocalWallet implements Wallet {
  static final String ENC = "aes256gcm";
  static final String TYP = "JWM/1.0";
  static final String AUTHCRYPT = "Authcrypt";
  static final String ANONCRYPT = "Anoncrypt";

  private static final String CEK_INFO = "didwire envelope cek";
  private static final String SENDER_INFO = "didwire envelope sender";
  private static final int DID_BYTES = 16;

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Base64.Encoder B64 = Base64.getUrlEncoder();
  private static final Base64.Decoder B64D = Base64.getUrlDecoder();

  private final String name;
  private volatile boolean open = true;

  private final Map<String, KeyPair> keys = new ConcurrentHashMap<>();
  private final Map<String, String> myDids = new ConcurrentHashMap<>();
  private final Map<String, String> theirDids = new ConcurrentHashMap<>();
  private final Map<String, PairwiseInfo> pairwise = new ConcurrentHashMap<>();
  private final Map<String, Map<String, String>> records = new ConcurrentHashMap<>();

  public LocalWallet(String name) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    LOGGER.fine(() -> "Closing wallet " + name);
    open = false;
  }

  /// Reopening hands the same contents back, as a persisted wallet would.
  LocalWallet reopen() {
    open = true;
    return this;
  }

  private void checkOpen() {
    if (!open) {
      throw new WalletUnavailableException("Wallet " + name + " is not open");
    }
  }

  // ---------------------------------------------------------------- keys and signatures

  @Override
  public String createKey() {
    checkOpen();
    try {
      KeyPair keyPair = Keys.generateEd25519();
      String verkey = Base58.encode(Keys.raw(keyPair.getPublic()));
      keys.put(verkey, keyPair);
      LOGGER.finest(() -> name + " created key " + verkey);
      return verkey;
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Ed25519 key generation failed", e);
    }
  }

  @Override
  public LocalIdentity createLocalIdentity() {
    String verkey = createKey();
    String did = Base58.encode(Arrays.copyOf(Base58.decode(verkey), DID_BYTES));
    myDids.put(did, verkey);
    LOGGER.fine(() -> name + " created local identity " + did);
    return new LocalIdentity(did, verkey);
  }

  @Override
  public byte[] sign(String signerVerkey, byte[] data) {
    checkOpen();
    KeyPair keyPair = keys.get(signerVerkey);
    if (keyPair == null) {
      throw new IllegalArgumentException("No signing key in wallet " + name + " for " + signerVerkey);
    }
    try {
      Signature signature = Signature.getInstance("Ed25519");
      signature.initSign(keyPair.getPrivate());
      signature.update(data);
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new SecurityException("Signing failed", e);
    }
  }

  @Override
  public boolean verify(String verkey, byte[] data, byte[] signature) {
    try {
      PublicKey publicKey = Keys.ed25519Public(Base58.decode(verkey));
      Signature verifier = Signature.getInstance("Ed25519");
      verifier.initVerify(publicKey);
      verifier.update(data);
      return verifier.verify(signature);
    } catch (GeneralSecurityException | RuntimeException e) {
      // a key or signature that cannot even be decoded simply does not verify
      LOGGER.finer(() -> "Verification with " + verkey + " failed: " + e);
      return false;
    }
  }

  // ---------------------------------------------------------------- envelopes

  @Override
  public byte[] packEnvelope(List<String> recipientVerkeys, @Nullable String senderVerkey, byte[] plaintext) {
    checkOpen();
    if (recipientVerkeys.isEmpty()) {
      throw new IllegalArgumentException("At least one recipient is required");
    }
    final boolean authcrypt = senderVerkey != null;
    try {
      PrivateKey senderX = null;
      if (authcrypt) {
        KeyPair senderKeys = keys.get(senderVerkey);
        if (senderKeys == null) {
          throw new IllegalArgumentException("No sender key in wallet " + name + " for " + senderVerkey);
        }
        senderX = Keys.ed25519ToX25519Private(senderKeys.getPrivate());
      }

      byte[] cek = Aead.randomBytes(Aead.KEY_SIZE);
      ArrayNode recipients = MAPPER.createArrayNode();
      for (String recipient : recipientVerkeys) {
        PublicKey recipientX = Keys.ed25519ToX25519Public(Base58.decode(recipient));
        KeyPair ephemeral = Keys.generateX25519();
        byte[] epk = Keys.raw(ephemeral.getPublic());
        byte[] salt = Keys.concat(epk, Keys.raw(recipientX));
        byte[] ephemeralSecret = Keys.agree(ephemeral.getPrivate(), recipientX);

        byte[] ikm = ephemeralSecret;
        String sealedSender = null;
        if (authcrypt) {
          ikm = Keys.concat(ephemeralSecret, Keys.agree(senderX, recipientX));
          byte[] senderKey = SimpleHKDF.derive(ephemeralSecret, salt, SENDER_INFO, Aead.KEY_SIZE);
          sealedSender = B64.encodeToString(Aead.seal(senderKey, senderVerkey.getBytes(StandardCharsets.UTF_8), epk));
        }
        byte[] kek = SimpleHKDF.derive(ikm, salt, CEK_INFO, Aead.KEY_SIZE);
        byte[] encryptedKey = Aead.seal(kek, cek, recipient.getBytes(StandardCharsets.UTF_8));

        ObjectNode header = MAPPER.createObjectNode()
            .put("kid", recipient)
            .put("epk", B64.encodeToString(epk))
            .put("sender", sealedSender);
        recipients.addObject()
            .put("encrypted_key", B64.encodeToString(encryptedKey))
            .set("header", header);
      }

      ObjectNode protectedHeader = MAPPER.createObjectNode()
          .put("enc", ENC)
          .put("typ", TYP)
          .put("alg", authcrypt ? AUTHCRYPT : ANONCRYPT);
      protectedHeader.set("recipients", recipients);
      String protectedB64 = B64.encodeToString(MAPPER.writeValueAsBytes(protectedHeader));

      byte[] sealed = Aead.seal(cek, plaintext, protectedB64.getBytes(StandardCharsets.US_ASCII));
      int tagStart = sealed.length - Aead.GCM_TAG_LENGTH;
      ObjectNode envelope = MAPPER.createObjectNode()
          .put("protected", protectedB64)
          .put("iv", B64.encodeToString(Arrays.copyOfRange(sealed, 0, Aead.GCM_NONCE_LENGTH)))
          .put("ciphertext", B64.encodeToString(Arrays.copyOfRange(sealed, Aead.GCM_NONCE_LENGTH, tagStart)))
          .put("tag", B64.encodeToString(Arrays.copyOfRange(sealed, tagStart, sealed.length)));
      LOGGER.finest(() -> String.format("%s packed %d bytes %s for %s", name, plaintext.length,
          authcrypt ? AUTHCRYPT : ANONCRYPT, recipientVerkeys));
      return MAPPER.writeValueAsBytes(envelope);
    } catch (GeneralSecurityException | IOException e) {
      throw new SecurityException("Packing envelope failed", e);
    }
  }

  @Override
  public UnpackedEnvelope unpackEnvelope(byte[] envelope) {
    checkOpen();
    try {
      JsonNode root = MAPPER.readTree(envelope);
      if (root == null || !root.isObject()) {
        throw new SecurityException("Envelope is not a JSON object");
      }
      String protectedB64 = requiredText(root, "protected");
      JsonNode header = MAPPER.readTree(B64D.decode(protectedB64));
      if (!ENC.equals(header.path("enc").asText()) || !TYP.equals(header.path("typ").asText())) {
        throw new SecurityException("Unsupported envelope " + header.path("enc").asText() + "/" + header.path("typ").asText());
      }
      String alg = header.path("alg").asText();
      if (!AUTHCRYPT.equals(alg) && !ANONCRYPT.equals(alg)) {
        throw new SecurityException("Unsupported envelope alg " + alg);
      }

      JsonNode recipient = null;
      for (JsonNode candidate : header.path("recipients")) {
        if (keys.containsKey(candidate.path("header").path("kid").asText())) {
          recipient = candidate;
          break;
        }
      }
      if (recipient == null) {
        throw new SecurityException("Envelope has no recipient key held by wallet " + name);
      }

      String kid = recipient.path("header").path("kid").asText();
      PrivateKey recipientX = Keys.ed25519ToX25519Private(keys.get(kid).getPrivate());
      byte[] epk = B64D.decode(requiredText(recipient.path("header"), "epk"));
      byte[] salt = Keys.concat(epk, Keys.raw(Keys.ed25519ToX25519Public(Base58.decode(kid))));
      byte[] ephemeralSecret = Keys.agree(recipientX, Keys.x25519Public(epk));

      byte[] ikm = ephemeralSecret;
      String senderVerkey = null;
      JsonNode sealedSender = recipient.path("header").path("sender");
      if (AUTHCRYPT.equals(alg)) {
        if (!sealedSender.isTextual()) {
          throw new SecurityException("Authcrypt envelope without a sender");
        }
        byte[] senderKey = SimpleHKDF.derive(ephemeralSecret, salt, SENDER_INFO, Aead.KEY_SIZE);
        senderVerkey = new String(Aead.open(senderKey, B64D.decode(sealedSender.asText()), epk), StandardCharsets.UTF_8);
        PublicKey senderX = Keys.ed25519ToX25519Public(Base58.decode(senderVerkey));
        ikm = Keys.concat(ephemeralSecret, Keys.agree(recipientX, senderX));
      } else if (!sealedSender.isMissingNode() && !sealedSender.isNull()) {
        throw new SecurityException("Anoncrypt envelope must not name a sender");
      }

      byte[] kek = SimpleHKDF.derive(ikm, salt, CEK_INFO, Aead.KEY_SIZE);
      byte[] cek = Aead.open(kek, B64D.decode(requiredText(recipient, "encrypted_key")), kid.getBytes(StandardCharsets.UTF_8));

      byte[] sealed = Keys.concat(
          B64D.decode(requiredText(root, "iv")),
          B64D.decode(requiredText(root, "ciphertext")),
          B64D.decode(requiredText(root, "tag")));
      byte[] plaintext = Aead.open(cek, sealed, protectedB64.getBytes(StandardCharsets.US_ASCII));

      final String from = senderVerkey;
      LOGGER.finest(() -> String.format("%s unpacked %d bytes %s for %s from %s", name, plaintext.length, alg, kid, from));
      return new UnpackedEnvelope(new String(plaintext, StandardCharsets.UTF_8), kid, Optional.ofNullable(senderVerkey));
    } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
      throw new SecurityException("Unpacking envelope failed: " + e.getMessage(), e);
    }
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual()) {
      throw new SecurityException("Envelope field missing: " + field);
    }
    return value.asText();
  }

  // ---------------------------------------------------------------- identity store

  @Override
  public Optional<String> verkeyToDid(String verkey) {
    checkOpen();
    return findDid(myDids, verkey).or(() -> findDid(theirDids, verkey));
  }

  private static Optional<String> findDid(Map<String, String> dids, String verkey) {
    return dids.entrySet().stream()
        .filter(e -> e.getValue().equals(verkey))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  @Override
  public String localKeyForDid(String did) {
    checkOpen();
    String verkey = myDids.get(did);
    if (verkey == null) {
      throw new IllegalArgumentException("Not a local DID in wallet " + name + ": " + did);
    }
    return verkey;
  }

  @Override
  public PairwiseInfo pairwiseInfo(String theirDid) {
    checkOpen();
    PairwiseInfo info = pairwise.get(theirDid);
    if (info == null) {
      throw new IllegalArgumentException("No pairwise relationship with " + theirDid);
    }
    return info;
  }

  @Override
  public void storeTheirDid(String did, String verkey) {
    checkOpen();
    theirDids.put(did, verkey);
  }

  @Override
  public void createPairwise(PairwiseInfo info) {
    checkOpen();
    if (!myDids.containsKey(info.myDid())) {
      throw new IllegalArgumentException("Pairwise must use a local DID: " + info.myDid());
    }
    theirDids.put(info.theirDid(), info.theirVerkey());
    pairwise.put(info.theirDid(), info);
    LOGGER.fine(() -> name + " stored pairwise " + info.myDid() + " <-> " + info.theirDid());
  }

  @Override
  public List<PairwiseInfo> listPairwise() {
    checkOpen();
    return List.copyOf(new ArrayList<>(pairwise.values()));
  }

  @Override
  public void putRecord(String type, String id, String value) {
    checkOpen();
    records.computeIfAbsent(type, k -> new ConcurrentHashMap<>()).put(id, value);
  }

  @Override
  public Map<String, String> records(String type) {
    checkOpen();
    return new LinkedHashMap<>(records.getOrDefault(type, Map.of()));
  }
}
