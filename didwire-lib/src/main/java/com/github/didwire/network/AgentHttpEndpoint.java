// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.network;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Receives wire messages over HTTP. A POST to `/indy` hands the body to the inbound consumer and answers 202
/// before the message is processed. Anything else is 405.
public class AgentHttpEndpoint implements AutoCloseable {
  public static final String PATH = "/indy";

  private final HttpServer server;
  private final ExecutorService executor;
  private final AtomicBoolean closed = new AtomicBoolean();

  public AgentHttpEndpoint(InetSocketAddress address, Consumer<byte[]> inbound) throws IOException {
    this.server = HttpServer.create(address, 0);
    this.executor = Executors.newFixedThreadPool(2, r -> {
      Thread thread = new Thread(r, "didwire-http-" + address.getPort());
      thread.setDaemon(true);
      return thread;
    });
    server.createContext(PATH, exchange -> receive(exchange, inbound));
    server.setExecutor(executor);
  }

  private static void receive(HttpExchange exchange, Consumer<byte[]> inbound) throws IOException {
    try {
      if (!"POST".equals(exchange.getRequestMethod())) {
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      byte[] body;
      try (InputStream in = exchange.getRequestBody()) {
        body = in.readAllBytes();
      }
      LOGGER.finer(() -> "Received " + body.length + " bytes from " + exchange.getRemoteAddress());
      inbound.accept(body);
      exchange.sendResponseHeaders(Transport.ACCEPTED, -1);
    } finally {
      exchange.close();
    }
  }

  public AgentHttpEndpoint start() {
    server.start();
    LOGGER.info(() -> "Listening for wire messages on " + server.getAddress() + PATH);
    return this;
  }

  public int port() {
    return server.getAddress().getPort();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    server.stop(0);
    executor.shutdownNow();
  }
}
