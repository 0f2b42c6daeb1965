// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Top level of the two level router. A message goes to the module whose family identifier is the longest prefix
/// of its `@type` that ends on a path boundary, so `.../connections/1.0` never claims `.../connections/1.01/...`.
/// The module then dispatches on the exact type.
public class FamilyRouter {
  public static final String TOP_LEVEL = "family-router";

  private final Map<String, Module> modules = new ConcurrentHashMap<>();

  /// @throws IllegalArgumentException when the family already has a module
  public void register(Module module) {
    register(module.familyId(), module);
  }

  /// @throws IllegalArgumentException when the family already has a module
  public void register(String familyId, Module module) {
    if (familyId == null || familyId.isBlank()) {
      throw new IllegalArgumentException("Family identifier cannot be blank");
    }
    if (modules.putIfAbsent(familyId, module) != null) {
      throw new IllegalArgumentException("Module already registered for " + familyId);
    }
    LOGGER.fine(() -> "Registered module " + module.getClass().getSimpleName() + " for " + familyId);
  }

  public Map<String, Module> modules() {
    return Collections.unmodifiableMap(modules);
  }

  /// The module that would receive a message of this type.
  public Optional<Module> moduleFor(String type) {
    if (type == null) {
      return Optional.empty();
    }
    String best = null;
    for (String familyId : modules.keySet()) {
      if (matches(familyId, type) && (best == null || familyId.length() > best.length())) {
        best = familyId;
      }
    }
    return Optional.ofNullable(best).map(modules::get);
  }

  public RouteResult route(Message message) {
    String type = message.type();
    Optional<Module> module = moduleFor(type);
    if (module.isEmpty()) {
      LOGGER.warning(() -> "Unroutable message, no family registered for " + type);
      return new RouteResult.Unroutable(type, TOP_LEVEL);
    }
    try {
      return new RouteResult.Handled(module.get().route(message));
    } catch (UnroutableMessageException e) {
      LOGGER.warning(() -> "Unroutable message: " + e.getMessage());
      return new RouteResult.Unroutable(type, e.scope());
    }
  }

  static boolean matches(String familyId, String type) {
    return type.startsWith(familyId)
        && (type.length() == familyId.length() || type.charAt(familyId.length()) == '/');
  }
}
