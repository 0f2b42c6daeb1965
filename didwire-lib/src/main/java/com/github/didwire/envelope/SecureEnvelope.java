// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.envelope;

import com.github.didwire.ErrorKind;
import com.github.didwire.crypto.CryptoProvider;
import com.github.didwire.crypto.IdentityStore;
import com.github.didwire.crypto.UnpackedEnvelope;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageContext;
import com.github.didwire.msg.MessageSerializer;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Turns wire bytes into a [Message] with its [MessageContext], and messages into wire bytes.
///
/// Inbound bytes are first tried as a plaintext message, which is how administrative messages arrive. Anything
/// else is handed to the crypto provider as an envelope. Bytes that are neither are rejected with
/// [ErrorKind#MALFORMED_WIRE_BYTES]; nothing is thrown.
public class SecureEnvelope {
  private static final int EXCERPT_LENGTH = 64;

  private final CryptoProvider crypto;
  private final IdentityStore identities;

  public SecureEnvelope(CryptoProvider crypto, IdentityStore identities) {
    this.crypto = Objects.requireNonNull(crypto, "crypto cannot be null");
    this.identities = Objects.requireNonNull(identities, "identities cannot be null");
  }

  public UnpackResult unpack(byte[] wireBytes) {
    Optional<Message> plaintext = tryPlaintext(wireBytes);
    if (plaintext.isPresent()) {
      Message message = plaintext.get().attachContext(MessageContext.PLAINTEXT);
      LOGGER.finer(() -> "Unpacked plaintext " + message.type());
      return new UnpackResult.Unpacked(message);
    }
    try {
      UnpackedEnvelope envelope = crypto.unpackEnvelope(wireBytes);
      Message message = MessageSerializer.deserialize(envelope.message());
      if (message.type() == null) {
        return reject(wireBytes, "Envelope content has no @type", null);
      }
      String fromKey = envelope.senderVerkey().orElse(null);
      String fromDid = fromKey == null ? null : identities.verkeyToDid(fromKey).orElse(null);
      String toDid = identities.verkeyToDid(envelope.recipientVerkey()).orElse(null);
      message.attachContext(new MessageContext(fromDid, toDid, fromKey, envelope.recipientVerkey()));
      LOGGER.finer(() -> String.format("Unpacked %s to %s from %s", message.type(), envelope.recipientVerkey(), fromKey));
      return new UnpackResult.Unpacked(message);
    } catch (SecurityException | IllegalArgumentException e) {
      return reject(wireBytes, e.getMessage(), e);
    }
  }

  /// Packs `message` for the recipients; a null sender gives an anonymous envelope.
  public byte[] pack(Message message, List<String> recipientVerkeys, @Nullable String senderVerkey) {
    LOGGER.finer(() -> String.format("Packing %s for %s from %s", message.type(), recipientVerkeys, senderVerkey));
    return crypto.packEnvelope(recipientVerkeys, senderVerkey, MessageSerializer.serialize(message));
  }

  public byte[] pack(Message message, String recipientVerkey, @Nullable String senderVerkey) {
    return pack(message, List.of(recipientVerkey), senderVerkey);
  }

  private static Optional<Message> tryPlaintext(byte[] wireBytes) {
    try {
      String text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(wireBytes))
          .toString();
      Message message = MessageSerializer.deserialize(text);
      return message.type() == null ? Optional.empty() : Optional.of(message);
    } catch (CharacterCodingException | IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private static UnpackResult reject(byte[] wireBytes, String detail, @Nullable Throwable cause) {
    String excerpt = excerpt(wireBytes);
    LOGGER.warning(() -> "Dropping unreadable wire bytes (" + detail + "): " + excerpt);
    return new UnpackResult.Rejected(ErrorKind.MALFORMED_WIRE_BYTES, detail, cause);
  }

  static String excerpt(byte[] bytes) {
    String text = new String(bytes, 0, Math.min(bytes.length, EXCERPT_LENGTH), StandardCharsets.UTF_8);
    return bytes.length > EXCERPT_LENGTH ? text + "..." : text;
  }
}
