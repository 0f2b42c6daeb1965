// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.ErrorKind;
import com.github.didwire.LoggerConfig;
import com.github.didwire.crypto.Base58;
import com.github.didwire.crypto.LocalWallet;
import com.github.didwire.envelope.SecureEnvelope;
import com.github.didwire.envelope.SignedField;
import com.github.didwire.envelope.SignedFields;
import com.github.didwire.envelope.UnpackResult;
import com.github.didwire.msg.Message;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeTest {
  static final String INVITER_ENDPOINT = "http://inviter/ep";
  static final String INVITEE_ENDPOINT = "http://invitee/ep";

  LocalWallet inviterWallet;
  LocalWallet inviteeWallet;
  InviterRole inviter;
  InviteeRole invitee;

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  @BeforeEach
  void setup() {
    inviterWallet = new LocalWallet("inviter");
    inviteeWallet = new LocalWallet("invitee");
    inviter = new InviterRole(inviterWallet, Clock.systemUTC(), "L", INVITER_ENDPOINT);
    invitee = new InviteeRole(inviteeWallet, Clock.systemUTC(), "invitee", INVITEE_ENDPOINT);
  }

  static Message unpack(LocalWallet wallet, byte[] bytes) {
    UnpackResult result = new SecureEnvelope(wallet, wallet).unpack(bytes);
    assertThat(result).isInstanceOf(UnpackResult.Unpacked.class);
    return ((UnpackResult.Unpacked) result).message();
  }

  /// Runs the handshake up to the response and returns it unpacked by the invitee.
  Message requestAndRespond(String requestId) {
    Invitation invitation = inviter.issueInvite();
    invitee.receiveInvite(inviter.inviteUrl());
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.INVITE_PARSED);
    assertThat(invitation.recipientKeys()).containsExactly(inviter.invitationKey());

    OutboundMessage request = invitee.buildRequest(requestId);
    assertThat(request.endpoint()).isEqualTo(INVITER_ENDPOINT);
    HandshakeOutcome outcome = inviter.handleRequest(unpack(inviterWallet, request.bytes()));
    assertThat(outcome).isInstanceOf(HandshakeOutcome.Responded.class);
    OutboundMessage response = ((HandshakeOutcome.Responded) outcome).response();
    assertThat(response.endpoint()).isEqualTo(INVITEE_ENDPOINT);
    return unpack(inviteeWallet, response.bytes());
  }

  @Test
  void happyPath() {
    Message response = requestAndRespond("abc");

    assertThat(inviter.state()).isEqualTo(InviterRole.State.RESPONSE_SENT);
    assertThat(response.id()).isEqualTo("abc");
    assertThat(response.containsKey(Connections.CONNECTION)).isFalse();
    assertThat(response.getMap(ConnectionResponse.CONNECTION_SIG)).containsEntry("signer", inviter.invitationKey());

    HandshakeOutcome outcome = invitee.handleResponse(response);

    assertThat(outcome).isInstanceOfSatisfying(HandshakeOutcome.Verified.class, v -> {
      assertThat(inviterWallet.localKeyForDid(v.connection().theirDid())).isEqualTo(v.connection().theirVerkey());
      assertThat(v.connection().theirEndpoint()).isEqualTo(INVITER_ENDPOINT);
      assertThat(v.connection().theirLabel()).isEqualTo("L");
    });
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.RESPONSE_VERIFIED);
    assertThat(response.getMap(Connections.CONNECTION)).containsKeys(Connections.DID, Connections.DID_DOC);
  }

  @Test
  void requestWithoutDidDocIsIgnored() {
    inviter.issueInvite();
    String url = inviter.inviteUrl();
    Invitation invitation = Invitation.fromUrl(url);
    var me = inviteeWallet.createLocalIdentity();
    Message request = new ConnectionRequest("abc", "invitee", me.did(), new DidDoc(me.did(), me.verkey(), INVITEE_ENDPOINT))
        .toMessage();
    request.getMap(Connections.CONNECTION).remove(Connections.DID_DOC);
    byte[] packed = new SecureEnvelope(inviteeWallet, inviteeWallet).pack(request, invitation.recipientKeys(), me.verkey());

    HandshakeOutcome outcome = inviter.handleRequest(unpack(inviterWallet, packed));

    assertThat(outcome).isInstanceOfSatisfying(HandshakeOutcome.Ignored.class,
        i -> assertThat(i.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(inviter.state()).isEqualTo(InviterRole.State.AWAITING_REQUEST);
  }

  /// Packs an anonymous request whose DIDDoc names `verkey`, as anyone holding the invitation URL could.
  byte[] anonymousRequestWithKey(String verkey) {
    var me = inviteeWallet.createLocalIdentity();
    Message request = new ConnectionRequest("bad", "stranger", me.did(), new DidDoc(me.did(), verkey, INVITEE_ENDPOINT))
        .toMessage();
    return new SecureEnvelope(inviteeWallet, inviteeWallet).pack(request, inviter.invitation().recipientKeys(), null);
  }

  void assertInvitationStillAnswers(String url) {
    invitee.receiveInvite(url);
    OutboundMessage request = invitee.buildRequest("abc");
    assertThat(inviter.handleRequest(unpack(inviterWallet, request.bytes())))
        .isInstanceOf(HandshakeOutcome.Responded.class);
    assertThat(inviter.state()).isEqualTo(InviterRole.State.RESPONSE_SENT);
  }

  @Test
  void undecodableDidDocKeyDoesNotUseUpTheInvitation() {
    inviter.issueInvite();
    String url = inviter.inviteUrl();

    HandshakeOutcome outcome = inviter.handleRequest(unpack(inviterWallet, anonymousRequestWithKey("0OIl-not-base58")));

    assertThat(outcome).isInstanceOfSatisfying(HandshakeOutcome.Ignored.class,
        i -> assertThat(i.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(inviter.state()).isEqualTo(InviterRole.State.AWAITING_REQUEST);
    assertInvitationStillAnswers(url);
  }

  @Test
  void shortDidDocKeyIsIgnored() {
    inviter.issueInvite();
    String url = inviter.inviteUrl();

    HandshakeOutcome outcome = inviter.handleRequest(unpack(inviterWallet,
        anonymousRequestWithKey(Base58.encode(new byte[]{1, 2, 3}))));

    assertThat(outcome).isInstanceOf(HandshakeOutcome.Ignored.class);
    assertThat(inviter.state()).isEqualTo(InviterRole.State.AWAITING_REQUEST);
    assertInvitationStillAnswers(url);
  }

  @Test
  void didDocKeyThatCannotBeEncryptedToIsIgnored() {
    inviter.issueInvite();
    String url = inviter.inviteUrl();
    // y = 1 is the identity point, there is no X25519 key to encrypt to
    byte[] identity = new byte[32];
    identity[0] = 1;

    HandshakeOutcome outcome = inviter.handleRequest(unpack(inviterWallet,
        anonymousRequestWithKey(Base58.encode(identity))));

    assertThat(outcome).isInstanceOfSatisfying(HandshakeOutcome.Ignored.class,
        i -> assertThat(i.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(inviter.state()).isEqualTo(InviterRole.State.AWAITING_REQUEST);
    assertInvitationStillAnswers(url);
  }

  @Test
  void senderMustOwnTheDidDocKey() {
    inviter.issueInvite();
    invitee.receiveInvite(inviter.inviteUrl());
    var me = inviteeWallet.createLocalIdentity();
    var other = inviteeWallet.createLocalIdentity();
    Message request = new ConnectionRequest("abc", "invitee", me.did(), new DidDoc(me.did(), me.verkey(), INVITEE_ENDPOINT))
        .toMessage();
    byte[] packed = new SecureEnvelope(inviteeWallet, inviteeWallet).pack(request, inviter.invitationKey(), other.verkey());

    assertThat(inviter.handleRequest(unpack(inviterWallet, packed))).isInstanceOf(HandshakeOutcome.Ignored.class);
  }

  @Test
  void invitationKeyIsSingleUse() {
    requestAndRespond("abc");
    InviteeRole second = new InviteeRole(inviteeWallet, Clock.systemUTC(), "second", INVITEE_ENDPOINT);
    second.receiveInvite(inviter.invitation());

    OutboundMessage request = second.buildRequest("def");

    assertThat(inviter.handleRequest(unpack(inviterWallet, request.bytes())))
        .isInstanceOf(HandshakeOutcome.Ignored.class);
  }

  @Test
  void mismatchedIdDoesNotAdvance() {
    Message response = requestAndRespond("abc");
    response.put(Message.ID, "xyz");

    HandshakeOutcome outcome = invitee.handleResponse(response);

    assertThat(outcome).isInstanceOfSatisfying(HandshakeOutcome.Failed.class,
        f -> assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.AWAITING_RESPONSE);
  }

  @Test
  void missingSignatureIsStructurallyInvalid() {
    Message response = requestAndRespond("abc");
    response.remove(ConnectionResponse.CONNECTION_SIG);

    assertThat(invitee.handleResponse(response)).isInstanceOfSatisfying(HandshakeOutcome.Failed.class,
        f -> assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.AWAITING_RESPONSE);
  }

  @Test
  void badSignatureFailsVerification() {
    Message response = requestAndRespond("abc");
    SignedField sig = SignedField.fromMap(response.getMap(ConnectionResponse.CONNECTION_SIG));
    String forged = inviterWallet.createKey();
    byte[] signature = inviterWallet.sign(forged, Base64.getUrlDecoder().decode(sig.sigData()));
    response.put(ConnectionResponse.CONNECTION_SIG, new SignedField(sig.type(), sig.signer(), sig.sigData(),
        Base64.getUrlEncoder().encodeToString(signature)).toMap());

    assertThat(invitee.handleResponse(response)).isInstanceOfSatisfying(HandshakeOutcome.Failed.class,
        f -> assertThat(f.kind()).isEqualTo(ErrorKind.SIGNATURE_VERIFICATION_FAILED));
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.AWAITING_RESPONSE);
  }

  @Test
  void signerMustBeAnInvitationKey() {
    Message response = requestAndRespond("abc");
    String stranger = inviterWallet.createKey();
    Map<String, Object> payload = Map.of("DID", "x");
    SignedField resigned = new SignedFields(inviterWallet).sign(payload, stranger);
    response.put(ConnectionResponse.CONNECTION_SIG, resigned.toMap());

    assertThat(invitee.handleResponse(response)).isInstanceOfSatisfying(HandshakeOutcome.Failed.class,
        f -> assertThat(f.kind()).isEqualTo(ErrorKind.SIGNATURE_VERIFICATION_FAILED));
  }

  @Test
  void verifiedButInconsistentConnectionIsInvalid() {
    Message response = requestAndRespond("abc");
    Map<String, Object> payload = Map.of("DID", "not-the-doc-did", "DIDDoc",
        new DidDoc("someone-else", "k", "http://x").toMap());
    SignedField resigned = new SignedFields(inviterWallet)
        .sign(payload, inviter.invitationKey());
    response.put(ConnectionResponse.CONNECTION_SIG, resigned.toMap());

    assertThat(invitee.handleResponse(response)).isInstanceOfSatisfying(HandshakeOutcome.Failed.class,
        f -> assertThat(f.kind()).isEqualTo(ErrorKind.INVALID_HANDSHAKE_MESSAGE));
    assertThat(invitee.state()).isEqualTo(InviteeRole.State.AWAITING_RESPONSE);
  }
}
