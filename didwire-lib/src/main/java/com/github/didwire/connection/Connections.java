// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.connection;

import com.github.didwire.msg.MessageType;

/// Names of the `connections/1.0` family.
public final class Connections {
  public static final String FAMILY_ID = MessageType.familyId("connections", "1.0");
  public static final String INVITATION = FAMILY_ID + "/invitation";
  public static final String REQUEST = FAMILY_ID + "/request";
  public static final String RESPONSE = FAMILY_ID + "/response";

  public static final String LABEL = "label";
  public static final String RECIPIENT_KEYS = "recipientKeys";
  public static final String SERVICE_ENDPOINT = "serviceEndpoint";
  public static final String CONNECTION = "connection";
  public static final String DID = "DID";
  public static final String DID_DOC = "DIDDoc";

  private Connections() {
  }
}
