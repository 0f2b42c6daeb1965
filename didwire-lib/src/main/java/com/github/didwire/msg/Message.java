// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A protocol message: an ordered, key-unique mapping of JSON compatible values that always carries a `@type`
/// discriminator. The [MessageContext] is not part of the mapping. It is attached once by the secure envelope when
/// the message is unpacked and is absent on messages that were built locally.
///
/// Values are the types Jackson produces for untyped JSON: `String`, `Integer`, `Long`, `Double`, `Boolean`,
/// `null`, `List` and `Map<String, Object>`.
public final class Message {
  public static final String TYPE = "@type";
  public static final String ID = "@id";
  public static final String L10N = "~l10n";
  public static final String THREAD = "~thread";
  public static final String SIG_SUFFIX = "~sig";

  private final LinkedHashMap<String, Object> fields;
  private MessageContext context;

  public Message(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields cannot be null");
    this.fields = new LinkedHashMap<>(fields);
  }

  public static Message ofType(String type) {
    Message message = new Message(Map.of());
    message.put(TYPE, type);
    return message;
  }

  /// The `@type` or null when the mapping has none.
  public String type() {
    return fields.get(TYPE) instanceof String s ? s : null;
  }

  public String id() {
    return fields.get(ID) instanceof String s ? s : null;
  }

  public boolean containsKey(String key) {
    return fields.containsKey(key);
  }

  public Object get(String key) {
    return fields.get(key);
  }

  public String getString(String key) {
    return fields.get(key) instanceof String s ? s : null;
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> getMap(String key) {
    return fields.get(key) instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
  }

  @SuppressWarnings("unchecked")
  public List<Object> getList(String key) {
    return fields.get(key) instanceof List<?> l ? (List<Object>) l : null;
  }

  public Message put(String key, Object value) {
    fields.put(key, value);
    return this;
  }

  public Object remove(String key) {
    return fields.remove(key);
  }

  /// A read-only view in insertion order.
  public Map<String, Object> fields() {
    return Collections.unmodifiableMap(fields);
  }

  public Optional<MessageContext> context() {
    return Optional.ofNullable(context);
  }

  /// Attaches the unpack context. A message is unpacked once so a second attachment is a bug.
  public Message attachContext(MessageContext context) {
    Objects.requireNonNull(context, "context cannot be null");
    if (this.context != null) {
      throw new IllegalStateException("Context already attached to " + type());
    }
    this.context = context;
    return this;
  }

  public String prettyPrint() {
    return MessageSerializer.prettyPrint(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Message other)) return false;
    return fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "Message" + fields;
  }
}
