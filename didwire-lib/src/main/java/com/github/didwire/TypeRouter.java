// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.github.didwire.DidwireLogger.LOGGER;

/// A [Module] that dispatches on the exact `@type`. Family modules extend it and register one handler per
/// message name in their constructor.
public abstract class TypeRouter implements Module {
  private final String familyId;
  private final Map<String, MessageHandler> handlers = new LinkedHashMap<>();

  protected TypeRouter(String familyId) {
    this.familyId = familyId;
  }

  @Override
  public final String familyId() {
    return familyId;
  }

  /// Registers a handler for `<familyId>/<name>`.
  protected final void register(String name, MessageHandler handler) {
    registerType(familyId + "/" + name, handler);
  }

  /// @throws IllegalArgumentException when the type already has a handler
  protected final void registerType(String type, MessageHandler handler) {
    if (handlers.putIfAbsent(type, handler) != null) {
      throw new IllegalArgumentException("Handler already registered for " + type);
    }
    LOGGER.finest(() -> "Registered handler for " + type);
  }

  @Override
  public Optional<Message> route(Message message) {
    MessageHandler handler = handlers.get(message.type());
    if (handler == null) {
      throw new UnroutableMessageException(message.type(), familyId);
    }
    return handler.handle(message);
  }
}
