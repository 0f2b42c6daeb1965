// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import com.github.didwire.network.Transport;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import static com.github.didwire.DidwireLogger.LOGGER;

/// An in-process network that hands bytes straight to whoever registered the endpoint URL. Delivery answers 202;
/// an unknown endpoint answers 404.
public class LoopbackNetwork implements Transport {
  public static final int NOT_FOUND = 404;

  private final Map<String, Consumer<byte[]>> endpoints = new ConcurrentHashMap<>();

  public void register(String endpoint, Consumer<byte[]> receiver) {
    if (endpoints.putIfAbsent(endpoint, receiver) != null) {
      throw new IllegalArgumentException("Endpoint already registered: " + endpoint);
    }
  }

  @Override
  public int send(String endpoint, byte[] bytes) {
    Consumer<byte[]> receiver = endpoints.get(endpoint);
    if (receiver == null) {
      LOGGER.warning(() -> "No loopback endpoint " + endpoint);
      return NOT_FOUND;
    }
    LOGGER.finest(() -> "Loopback " + bytes.length + " bytes to " + endpoint);
    receiver.accept(bytes);
    return ACCEPTED;
  }
}
