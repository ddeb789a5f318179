package io.pitwall.telemetry.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.pitwall.telemetry.testing.MutableClock;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RateLimitedListenerTest {
  private final MutableClock clock = new MutableClock(1_000L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<String> delivered = new ArrayList<>();

  @Test
  void dropsEventsInsideMinimumInterval() {
    RateLimitedListener<String> listener = new RateLimitedListener<>(delivered::add, 4, clock, metrics);

    listener.accept("a");
    clock.advance(100L);
    listener.accept("b");
    clock.advance(150L);
    listener.accept("c");

    assertEquals(List.of("a", "c"), delivered);
    assertEquals(250L, listener.minIntervalMillis());
    assertEquals(1, metrics.count("gate.throttled"));
  }

  @Test
  void firstEventAlwaysPasses() {
    RateLimitedListener<String> listener =
        new RateLimitedListener<>(delivered::add, 1, new MutableClock(0L), metrics);

    listener.accept("first");

    assertEquals(List.of("first"), delivered);
  }

  @Test
  void rejectsNonPositiveRate() {
    assertThrows(IllegalArgumentException.class,
        () -> new RateLimitedListener<String>(delivered::add, 0, clock, metrics));
  }
}
