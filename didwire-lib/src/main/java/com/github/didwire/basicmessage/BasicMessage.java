// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.basicmessage;

import com.github.didwire.msg.Message;
import com.github.didwire.msg.MessageIds;
import com.github.didwire.msg.MessageType;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/// `{@type, @id, ~l10n: {locale: "en"}, sent_time, content}`.
public record BasicMessage(String id, Instant sentTime, String content) {
  public static final String FAMILY_ID = MessageType.familyId("basicmessage", "1.0");
  public static final String MESSAGE = FAMILY_ID + "/message";

  static final String SENT_TIME = "sent_time";
  static final String CONTENT = "content";

  public static BasicMessage create(String content, Clock clock) {
    return new BasicMessage(MessageIds.next(), clock.instant(), content);
  }

  public Message toMessage() {
    return Message.ofType(MESSAGE)
        .put(Message.ID, id)
        .put(Message.L10N, Map.of("locale", "en"))
        .put(SENT_TIME, sentTime.toString())
        .put(CONTENT, content);
  }

  /// @throws IllegalArgumentException when a field is missing or the time does not parse
  public static BasicMessage fromMessage(Message message) {
    if (!MESSAGE.equals(message.type())) {
      throw new IllegalArgumentException("Not a basic message: " + message.type());
    }
    String sentTime = message.getString(SENT_TIME);
    String content = message.getString(CONTENT);
    if (sentTime == null || content == null) {
      throw new IllegalArgumentException("Basic message needs sent_time and content");
    }
    try {
      return new BasicMessage(message.id(), Instant.parse(sentTime), content);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Bad sent_time " + sentTime, e);
    }
  }
}
