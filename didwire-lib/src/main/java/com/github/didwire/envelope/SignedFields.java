// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

import com.github.didwire.crypto.CryptoProvider;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageSerializer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Signs and verifies detached signatures over JSON values. Signing reads the wall clock through the given
/// [Clock]. Verification is a pure function of the field and does not look at the clock.
public class SignedFields {
  static final int TIMESTAMP_LENGTH = Long.BYTES;

  private static final Base64.Encoder B64 = Base64.getUrlEncoder();
  private static final Base64.Decoder B64D = Base64.getUrlDecoder();

  private final CryptoProvider crypto;
  private final Clock clock;

  public SignedFields(CryptoProvider crypto, Clock clock) {
    this.crypto = Objects.requireNonNull(crypto, "crypto cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  public SignedFields(CryptoProvider crypto) {
    this(crypto, Clock.systemUTC());
  }

  public SignedField sign(Object payload, String signerVerkey) {
    byte[] json = MessageSerializer.canonicalJson(payload);
    byte[] sigData = ByteBuffer.allocate(TIMESTAMP_LENGTH + json.length)
        .putLong(clock.instant().getEpochSecond())
        .put(json)
        .array();
    byte[] signature = crypto.sign(signerVerkey, sigData);
    LOGGER.finest(() -> "Signed " + json.length + " bytes of JSON with " + signerVerkey);
    return new SignedField(SignedField.SIGNATURE_TYPE, signerVerkey, B64.encodeToString(sigData), B64.encodeToString(signature));
  }

  /// @throws MalformedSignedFieldException when the signature verifies but the signed bytes are not JSON
  public VerifiedField verify(SignedField field) {
    final byte[] sigData;
    final byte[] signature;
    try {
      sigData = B64D.decode(field.sigData());
      signature = B64D.decode(field.signature());
    } catch (IllegalArgumentException e) {
      LOGGER.fine(() -> "Signed field from " + field.signer() + " is not base64url: " + e.getMessage());
      return VerifiedField.unverified(field.signer());
    }
    if (sigData.length < TIMESTAMP_LENGTH || !crypto.verify(field.signer(), sigData, signature)) {
      LOGGER.fine(() -> "Signed field did not verify against " + field.signer());
      return VerifiedField.unverified(field.signer());
    }
    long seconds = ByteBuffer.wrap(sigData, 0, TIMESTAMP_LENGTH).getLong();
    byte[] json = Arrays.copyOfRange(sigData, TIMESTAMP_LENGTH, sigData.length);
    try {
      Object payload = MessageSerializer.parseJsonValue(json);
      return new VerifiedField(Optional.ofNullable(payload), true, field.signer(),
          Optional.of(Instant.ofEpochSecond(seconds)));
    } catch (IOException e) {
      throw new MalformedSignedFieldException("Signed data of " + field.signer() + " is not JSON", e);
    }
  }

  /// Replaces `name` in the message with `name~sig` signed by `signerVerkey`.
  public Message signField(Message message, String name, String signerVerkey) {
    if (!message.containsKey(name)) {
      throw new IllegalArgumentException("Message has no field " + name + " to sign");
    }
    SignedField signed = sign(message.get(name), signerVerkey);
    message.remove(name);
    message.put(name + Message.SIG_SUFFIX, signed.toMap());
    return message;
  }

  /// Verifies `name~sig` and, when it verifies, restores `name` from the signed payload.
  ///
  /// @throws MalformedSignedFieldException when the message has no complete `name~sig`
  public VerifiedField verifyField(Message message, String name) {
    VerifiedField verified = verify(SignedField.fromMap(message.getMap(name + Message.SIG_SUFFIX)));
    if (verified.verified()) {
      message.put(name, verified.payload().orElse(null));
    }
    return verified;
  }
}
