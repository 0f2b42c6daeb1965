// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.ErrorKind;
import com.github.didwire.crypto.LocalIdentity;
import com.github.didwire.crypto.Wallet;
import com.github.didwire.envelope.SecureEnvelope;
import com.github.didwire.envelope.SignedFields;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageContext;

import java.time.Clock;
import java.util.Objects;

import static com.github.didwire.DidwireLogger.LOGGER;

/// The side of the handshake that issues the invitation.
///
/// The invitation carries a fresh key that is used for exactly one request. A request that is incomplete or
/// inconsistent gets no answer at all, so its sender learns nothing. Such a request does not use up
/// the invitation either.
public class InviterRole {
  public enum State {IDLE, INVITE_ISSUED, AWAITING_REQUEST, REQUEST_VALIDATED, RESPONSE_SENT}

  private final Wallet wallet;
  private final SignedFields signedFields;
  private final SecureEnvelope envelope;
  private final String label;
  private final String endpoint;

  private State state = State.IDLE;
  private Invitation invitation;

  public InviterRole(Wallet wallet, Clock clock, String label, String endpoint) {
    this.wallet = Objects.requireNonNull(wallet, "wallet cannot be null");
    this.signedFields = new SignedFields(wallet, clock);
    this.envelope = new SecureEnvelope(wallet, wallet);
    this.label = label;
    this.endpoint = endpoint;
  }

  public State state() {
    return state;
  }

  public Invitation invitation() {
    if (invitation == null) {
      throw new IllegalStateException("No invitation issued");
    }
    return invitation;
  }

  /// The single-use key requests must be addressed to.
  public String invitationKey() {
    return invitation().recipientKeys().get(0);
  }

  public Invitation issueInvite() {
    if (state != State.IDLE) {
      throw new IllegalStateException("Invitation already issued, state " + state);
    }
    invitation = Invitation.create(label, wallet.createKey(), endpoint);
    state = State.INVITE_ISSUED;
    LOGGER.fine(() -> "Issued invitation " + invitation.id() + " with key " + invitationKey());
    return invitation;
  }

  /// The out-of-band form of the invitation. Once handed out the role waits for a request.
  public String inviteUrl() {
    String url = invitation().toUrl();
    if (state == State.INVITE_ISSUED) {
      state = State.AWAITING_REQUEST;
    }
    return url;
  }

  public HandshakeOutcome handleRequest(Message message) {
    if (state != State.INVITE_ISSUED && state != State.AWAITING_REQUEST) {
      return ignore(message, "invitation key already used, state " + state);
    }
    final ConnectionRequest request;
    try {
      request = ConnectionRequest.fromMessage(message);
    } catch (InvalidHandshakeMessageException e) {
      return ignore(message, e.getMessage());
    }
    MessageContext context = message.context().orElse(MessageContext.PLAINTEXT);
    if (context.senderAuthenticated() && !context.fromKey().equals(request.didDoc().verkey())) {
      return ignore(message, "sender key " + context.fromKey() + " is not the DIDDoc key " + request.didDoc().verkey());
    }
    State previous = state;
    state = State.REQUEST_VALIDATED;
    LOGGER.fine(() -> "Validated connection request " + request.id() + " from " + request.did());

    LocalIdentity me = wallet.createLocalIdentity();
    Message response = new ConnectionResponse(request.id(), me.did(), new DidDoc(me.did(), me.verkey(), endpoint))
        .toMessage();
    signedFields.signField(response, Connections.CONNECTION, invitationKey());
    final byte[] packed;
    try {
      packed = envelope.pack(response, request.didDoc().verkey(), me.verkey());
    } catch (SecurityException | IllegalArgumentException e) {
      // the invitation stays open
      state = previous;
      return ignore(message, "cannot answer DIDDoc key " + request.didDoc().verkey() + ": " + e.getMessage());
    }
    wallet.storeTheirDid(request.did(), request.didDoc().verkey());

    state = State.RESPONSE_SENT;
    Connection connection = new Connection(me.did(), me.verkey(), request.did(), request.didDoc().verkey(),
        request.didDoc().endpoint(), request.label());
    LOGGER.fine(() -> "Responding to " + request.did() + " at " + request.didDoc().endpoint() + " as " + me.did());
    return new HandshakeOutcome.Responded(connection, new OutboundMessage(request.didDoc().endpoint(), packed));
  }

  private static HandshakeOutcome ignore(Message message, String detail) {
    LOGGER.warning(() -> "Ignoring connection request " + message.id() + ": " + detail);
    return new HandshakeOutcome.Ignored(ErrorKind.INVALID_HANDSHAKE_MESSAGE, detail);
  }
}
