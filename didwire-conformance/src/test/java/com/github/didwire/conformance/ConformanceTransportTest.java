// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.conformance;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

import static com.github.didwire.DidwireLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConformanceTransportTest {
  // scheduling slack allowed past the requested timeout
  static final Duration EPSILON = Duration.ofMillis(500);

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(level);
    LOGGER.addHandler(handler);
    LOGGER.setLevel(level);
    LOGGER.setUseParentHandlers(false);
  }

  @Property(tries = 10)
  void emptyMailboxTimesOutWithinBounds(@ForAll @IntRange(min = 10, max = 150) int millis) {
    ConformanceTransport transport = new ConformanceTransport();
    Duration timeout = Duration.ofMillis(millis);

    long start = System.nanoTime();
    AwaitResult result = transport.awaitMessage(timeout);
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

    assertThat(result).isInstanceOf(AwaitResult.TimedOut.class);
    assertThat(((AwaitResult.TimedOut) result).waited()).isGreaterThanOrEqualTo(timeout);
    assertThat(elapsed).isLessThanOrEqualTo(timeout.plus(EPSILON));
  }

  @Test
  void queuedMessageIsReturnedAtOnce() {
    ConformanceTransport transport = new ConformanceTransport();
    transport.deliver(new byte[]{1, 2, 3});

    long start = System.nanoTime();
    AwaitResult result = transport.awaitMessage(Duration.ofSeconds(10));

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    assertThat(result).isInstanceOfSatisfying(AwaitResult.Received.class,
        r -> assertThat(r.bytes()).containsExactly(1, 2, 3));
    assertThat(transport.pending()).isZero();
  }

  @Test
  void lateArrivalEndsTheWait() {
    ConformanceTransport transport = new ConformanceTransport();
    ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    try {
      scheduler.schedule(() -> transport.deliver(new byte[]{42}), 100, TimeUnit.MILLISECONDS);

      byte[] bytes = transport.expectMessage(Duration.ofSeconds(5));

      assertThat(bytes).containsExactly(42);
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Test
  void messagesComeOutInArrivalOrder() {
    ConformanceTransport transport = new ConformanceTransport();
    transport.deliver(new byte[]{1});
    transport.deliver(new byte[]{2});

    assertThat(transport.expectMessage(Duration.ZERO)).containsExactly(1);
    assertThat(transport.expectMessage(Duration.ZERO)).containsExactly(2);
  }

  @Test
  void missingMessageIsAFailure() {
    ConformanceTransport transport = new ConformanceTransport();

    assertThatThrownBy(() -> transport.expectMessage(Duration.ofMillis(50)))
        .isInstanceOf(ConformanceFailure.class)
        .hasMessageContaining("50ms");
  }

  @Test
  void silenceIsAPass() {
    ConformanceTransport transport = new ConformanceTransport();

    transport.expectSilence(Duration.ofMillis(50));

    assertThat(transport.pending()).isZero();
  }

  @Test
  void anyAnswerBreaksTheSilence() {
    ConformanceTransport transport = new ConformanceTransport();
    transport.deliver(new byte[]{7});

    assertThatThrownBy(() -> transport.expectSilence(Duration.ofMillis(50)))
        .isInstanceOf(ConformanceFailure.class);
  }

  @Test
  void interruptedWaitIsATimeout() {
    ConformanceTransport transport = new ConformanceTransport();
    Thread.currentThread().interrupt();
    try {
      assertThat(transport.awaitMessage(Duration.ofSeconds(5))).isInstanceOf(AwaitResult.TimedOut.class);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      //noinspection ResultOfMethodCallIgnored
      Thread.interrupted();
    }
  }
}
