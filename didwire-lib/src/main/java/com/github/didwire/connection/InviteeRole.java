// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.ErrorKind;
import com.github.didwire.crypto.LocalIdentity;
import com.github.didwire.crypto.Wallet;
import com.github.didwire.envelope.MalformedSignedFieldException;
import com.github.didwire.envelope.SecureEnvelope;
import com.github.didwire.envelope.SignedFields;
import com.github.didwire.envelope.VerifiedField;
import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.network.Transport;

import java.time.Clock;
import java.util.Objects;

import static com.github.didwire.DidwireLogger.LOGGER;

/// The side of the handshake that accepts an invitation.
///
/// A response is checked in three steps. Its shape and thread are checked first, then the signature over
/// `connection` by a key the invitation named, then the restored `connection` itself. Any failure leaves the role
/// awaiting a response.
public class InviteeRole {
  public enum State {IDLE, INVITE_PARSED, REQUEST_SENT, AWAITING_RESPONSE, RESPONSE_VERIFIED}

  private final Wallet wallet;
  private final SignedFields signedFields;
  private final SecureEnvelope envelope;
  private final String label;
  private final String endpoint;

  private State state = State.IDLE;
  private Invitation invitation;
  private LocalIdentity me;
  private String requestId;

  public InviteeRole(Wallet wallet, Clock clock, String label, String endpoint) {
    this.wallet = Objects.requireNonNull(wallet, "wallet cannot be null");
    this.signedFields = new SignedFields(wallet, clock);
    this.envelope = new SecureEnvelope(wallet, wallet);
    this.label = label;
    this.endpoint = endpoint;
  }

  public State state() {
    return state;
  }

  public String requestId() {
    return requestId;
  }

  /// The key the request was sent from, which the response is encrypted to. Null until a request is built.
  public String myVerkey() {
    return me == null ? null : me.verkey();
  }

  /// @throws InvalidHandshakeMessageException when the URL carries no valid invitation
  public Invitation receiveInvite(String url) {
    return receiveInvite(Invitation.fromUrl(url));
  }

  public Invitation receiveInvite(Invitation invitation) {
    if (state != State.IDLE) {
      throw new IllegalStateException("Invitation already received, state " + state);
    }
    this.invitation = invitation;
    state = State.INVITE_PARSED;
    LOGGER.fine(() -> "Received invitation " + invitation.id() + " from " + invitation.label());
    return invitation;
  }

  /// Builds the request for a fresh local identity, packed with that identity's key to the invitation keys.
  public OutboundMessage buildRequest(String id) {
    if (state != State.INVITE_PARSED) {
      throw new IllegalStateException("No invitation to answer, state " + state);
    }
    me = wallet.createLocalIdentity();
    requestId = id;
    Message request = new ConnectionRequest(id, label, me.did(), new DidDoc(me.did(), me.verkey(), endpoint))
        .toMessage();
    byte[] packed = envelope.pack(request, invitation.recipientKeys(), me.verkey());
    state = State.REQUEST_SENT;
    LOGGER.fine(() -> "Built connection request " + id + " as " + me.did());
    return new OutboundMessage(invitation.serviceEndpoint(), packed);
  }

  /// Builds and delivers the request. The role awaits a response once the far end has accepted it.
  ///
  /// @return the delivery status
  /// @throws TransportException when the request could not be delivered at all
  public int sendRequest(Transport transport) {
    OutboundMessage request = buildRequest(MessageIds.next());
    int status = transport.send(request.endpoint(), request.bytes());
    if (status == Transport.ACCEPTED) {
      state = State.AWAITING_RESPONSE;
    } else {
      LOGGER.warning(() -> "Connection request " + requestId + " was not accepted: " + status);
    }
    return status;
  }

  public HandshakeOutcome handleResponse(Message message) {
    if (state != State.REQUEST_SENT && state != State.AWAITING_RESPONSE) {
      return fail(ErrorKind.INVALID_HANDSHAKE_MESSAGE, "not awaiting a response, state " + state);
    }
    final String signer;
    try {
      signer = ConnectionResponse.validatePreSignature(message, requestId);
    } catch (InvalidHandshakeMessageException e) {
      return fail(e.kind(), e.getMessage());
    }
    if (!invitation.recipientKeys().contains(signer)) {
      return fail(ErrorKind.SIGNATURE_VERIFICATION_FAILED, "signer " + signer + " is not an invitation key");
    }
    final VerifiedField verified;
    try {
      verified = signedFields.verifyField(message, Connections.CONNECTION);
    } catch (MalformedSignedFieldException e) {
      return fail(ErrorKind.INVALID_HANDSHAKE_MESSAGE, e.getMessage());
    }
    if (!verified.verified()) {
      return fail(ErrorKind.SIGNATURE_VERIFICATION_FAILED, "connection~sig does not verify against " + signer);
    }
    final ConnectionResponse response;
    try {
      response = ConnectionResponse.fromVerifiedMessage(message, requestId);
    } catch (InvalidHandshakeMessageException e) {
      return fail(e.kind(), e.getMessage());
    }
    wallet.storeTheirDid(response.did(), response.didDoc().verkey());
    state = State.RESPONSE_VERIFIED;
    LOGGER.fine(() -> "Verified connection response " + requestId + " from " + response.did());
    return new HandshakeOutcome.Verified(new Connection(me.did(), me.verkey(), response.did(),
        response.didDoc().verkey(), response.didDoc().endpoint(), invitation.label()));
  }

  private HandshakeOutcome fail(ErrorKind kind, String detail) {
    if (state == State.REQUEST_SENT) {
      state = State.AWAITING_RESPONSE;
    }
    LOGGER.warning(() -> "Connection response for " + requestId + " rejected (" + kind + "): " + detail);
    return new HandshakeOutcome.Failed(kind, detail);
  }
}
