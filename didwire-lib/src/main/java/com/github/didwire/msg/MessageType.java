// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A parsed `@type` of the form `<base-did>;spec/<family>/<version>/<name>`.
public record MessageType(String baseDid, String family, String version, String name) {

  public static final String BASE_DID = "did:sov:BzCbsNYhMrjHiqZDTUASHg";

  private static final Pattern TYPE = Pattern.compile("^(.+);spec/([^/]+)/([^/]+)/([^/]+)$");

  public static MessageType parse(String type) {
    if (type == null) {
      throw new IllegalArgumentException("Message type cannot be null");
    }
    Matcher matcher = TYPE.matcher(type);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Not a message type URI: " + type);
    }
    return new MessageType(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4));
  }

  /// The family identifier for a family under the common base DID, e.g. `...;spec/connections/1.0`.
  public static String familyId(String family, String version) {
    return BASE_DID + ";spec/" + family + "/" + version;
  }

  /// The family identifier, which is the `@type` prefix up to and including the version.
  public String familyId() {
    return baseDid + ";spec/" + family + "/" + version;
  }

  public String uri() {
    return familyId() + "/" + name;
  }

  @Override
  public String toString() {
    return uri();
  }
}
