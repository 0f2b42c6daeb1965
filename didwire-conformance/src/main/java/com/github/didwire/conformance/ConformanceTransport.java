// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.github.didwire.DidwireLogger.LOGGER;

/// The suite's inbound mailbox. Whatever delivers to the suite endpoint calls [#deliver(byte[])]; the procedures
/// wait on it with a timeout.
public class ConformanceTransport {
  private final LinkedBlockingQueue<byte[]> mailbox = new LinkedBlockingQueue<>();

  public void deliver(byte[] bytes) {
    mailbox.add(bytes);
  }

  /// Waits for the next message for at most `timeout`. Interruption ends the wait as a timeout with the interrupt
  /// flag restored.
  public AwaitResult awaitMessage(Duration timeout) {
    long start = System.nanoTime();
    try {
      byte[] bytes = mailbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
      if (bytes != null) {
        LOGGER.finer(() -> "Suite received " + bytes.length + " bytes");
        return new AwaitResult.Received(bytes);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    Duration waited = Duration.ofNanos(System.nanoTime() - start);
    LOGGER.fine(() -> "Nothing received within " + timeout.toMillis() + "ms");
    return new AwaitResult.TimedOut(waited);
  }

  /// @throws ConformanceFailure when nothing arrives in time
  public byte[] expectMessage(Duration timeout) {
    AwaitResult result = awaitMessage(timeout);
    if (result instanceof AwaitResult.Received received) {
      return received.bytes();
    }
    throw new ConformanceFailure("Expected a message within " + timeout.toMillis() + "ms but none arrived");
  }

  /// @throws ConformanceFailure when anything arrives within the window
  public void expectSilence(Duration window) {
    AwaitResult result = awaitMessage(window);
    if (result instanceof AwaitResult.Received received) {
      throw new ConformanceFailure("Expected silence for " + window.toMillis() + "ms but received "
          + received.bytes().length + " bytes");
    }
  }

  public int pending() {
    return mailbox.size();
  }
}
