// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.network;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Posts wire bytes with the JDK [HttpClient].
public class HttpTransport implements Transport {
  private final HttpClient client;
  private final Duration timeout;

  public HttpTransport(Duration timeout) {
    this.timeout = timeout;
    this.client = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .build();
  }

  public HttpTransport() {
    this(Duration.ofSeconds(10));
  }

  @Override
  public int send(String endpoint, byte[] bytes) {
    HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint))
        .timeout(timeout)
        .header("Content-Type", MEDIA_TYPE)
        .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
        .build();
    try {
      HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
      int status = response.statusCode();
      if (status != ACCEPTED) {
        LOGGER.warning(() -> String.format("Delivery of %d bytes to %s answered %d", bytes.length, endpoint, status));
      } else {
        LOGGER.finer(() -> String.format("Delivered %d bytes to %s", bytes.length, endpoint));
      }
      return status;
    } catch (IOException e) {
      throw new TransportException("Cannot deliver to " + endpoint, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted delivering to " + endpoint, e);
    }
  }
}
