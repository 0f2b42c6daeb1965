// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.msg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

/// Lossless conversion between [Message] and wire text. Parsing keeps the key order of the JSON document so that
/// `deserialize(serialize(m))` equals `m`.
public final class MessageSerializer {

  static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /// Sorted keys, used where two parties must agree on the bytes of a value, such as a signed field payload.
  static final ObjectMapper CANONICAL = new ObjectMapper()
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {
  };

  private MessageSerializer() {
  }

  public static byte[] serialize(Message message) {
    try {
      return MAPPER.writeValueAsBytes(message.fields());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Message is not JSON serializable: " + message.type(), e);
    }
  }

  public static String serializeToString(Message message) {
    return new String(serialize(message), StandardCharsets.UTF_8);
  }

  /// @throws IllegalArgumentException when the bytes are not a single JSON object
  public static Message deserialize(byte[] bytes) {
    try {
      LinkedHashMap<String, Object> fields = MAPPER.readValue(bytes, FIELDS);
      if (fields == null) {
        throw new IllegalArgumentException("JSON null is not a message");
      }
      return new Message(fields);
    } catch (IOException e) {
      throw new IllegalArgumentException("Not a JSON object: " + e.getMessage(), e);
    }
  }

  public static Message deserialize(String text) {
    return deserialize(text.getBytes(StandardCharsets.UTF_8));
  }

  /// Canonical JSON of any JSON compatible value.
  public static byte[] canonicalJson(Object value) {
    try {
      return CANONICAL.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable", e);
    }
  }

  /// Parses any JSON document into the untyped Java representation used by [Message] values.
  public static Object parseJsonValue(byte[] json) throws IOException {
    return MAPPER.readValue(json, Object.class);
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON serializable", e);
    }
  }

  static String prettyPrint(Message message) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(message.fields());
    } catch (JsonProcessingException e) {
      return message.toString();
    }
  }
}
