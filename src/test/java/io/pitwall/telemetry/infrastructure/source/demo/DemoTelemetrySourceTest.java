package io.pitwall.telemetry.infrastructure.source.demo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.testing.ManualTicker;
import io.pitwall.telemetry.testing.MutableClock;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DemoTelemetrySourceTest {
  private final ManualTicker ticker = new ManualTicker();
  private final MutableClock clock = new MutableClock(5_000L);
  private final List<TimingSnapshot> timing = new ArrayList<>();
  private final List<ThinFrame> frames = new ArrayList<>();

  @Test
  void emitsTimingEveryFifthTickAndFramesEverySecond() {
    DemoTelemetrySource source = source("seed-a", 6);
    source.connect("demo");

    ticker.tick(10);

    assertEquals(2, timing.size());
    assertEquals(5, frames.size());
    assertEquals(6, timing.get(0).entries().size());
    assertEquals(5_500L, timing.get(0).timestampMillis());
    assertEquals(SourceMode.DEMO, source.mode());
  }

  @Test
  void frameIdsAreSequentialPerSession() {
    DemoTelemetrySource source = source("seed-a", 4);
    source.connect("s9");

    ticker.tick(4);

    assertEquals(List.of("s9-demo-1", "s9-demo-2"), frames.stream().map(ThinFrame::frameId).toList());
  }

  @Test
  void sameSeedProducesIdenticalStreams() {
    DemoTelemetrySource first = source("fixed", 8);
    first.connect("demo");
    ticker.tick(20);
    List<TimingSnapshot> firstRun = List.copyOf(timing);
    first.disconnect();
    timing.clear();

    DemoTelemetrySource second = source("fixed", 8);
    second.connect("demo");
    ticker.tick(20);

    assertEquals(firstRun, timing);
  }

  @Test
  void differentSeedsDiverge() {
    DemoDataGenerator a = new DemoDataGenerator("demo", "one", 10);
    DemoDataGenerator b = new DemoDataGenerator("demo", "two", 10);
    a.advance(1_000L);
    b.advance(1_000L);

    assertFalse(a.generateTiming(1L).equals(b.generateTiming(1L)));
  }

  @Test
  void carCountDefaultsToSeededRange() {
    DemoDataGenerator generator = new DemoDataGenerator("demo", null, null);

    assertTrue(generator.carCount() >= DemoDataGenerator.MIN_CARS);
    assertTrue(generator.carCount() < DemoDataGenerator.MIN_CARS + DemoDataGenerator.CAR_SPREAD);
  }

  @Test
  void timingEntriesAreOrderedAndWithinLap() {
    DemoDataGenerator generator = new DemoDataGenerator("demo", "x", 12);
    for (int i = 0; i < 100; i++) {
      generator.advance(500L);
    }

    TimingSnapshot snapshot = generator.generateTiming(42L);

    for (int i = 0; i < snapshot.entries().size(); i++) {
      assertEquals(i + 1, snapshot.entries().get(i).position());
      double pct = snapshot.entries().get(i).lapDistPct();
      assertTrue(pct >= 0d && pct < 1d, "lapDistPct " + pct);
    }
    assertEquals("racing", snapshot.sessionState());
  }

  @Test
  void featuredCarRotatesEveryFiveSeconds() {
    DemoDataGenerator generator = new DemoDataGenerator("demo", "x", 3);
    assertEquals(0, generator.featuredIndex());

    generator.advance(DemoDataGenerator.FEATURE_ROTATION_MILLIS);
    assertEquals(1, generator.featuredIndex());

    generator.advance(2 * DemoDataGenerator.FEATURE_ROTATION_MILLIS);
    assertEquals(0, generator.featuredIndex());
  }

  @Test
  void disconnectStopsTicksAndClearsState() {
    DemoDataGenerator probe = new DemoDataGenerator("demo", "seed-a", 5);
    DemoTelemetrySource source = source("seed-a", 5);
    source.connect("demo");
    assertEquals(5, source.activeCarCount());
    assertEquals(probe.trackName(), source.trackName());

    source.disconnect();
    ticker.tick(10);

    assertFalse(source.isConnected());
    assertTrue(timing.isEmpty());
    assertEquals(0, source.activeCarCount());
    assertNull(source.trackName());
  }

  @Test
  void reconnectingToSameSessionKeepsSchedule() {
    DemoTelemetrySource source = source("seed-a", 5);
    source.connect("demo");
    source.connect("demo");

    assertEquals(1, ticker.activeCount());
  }

  @Test
  void rejectsCarCountOutsideRange() {
    assertThrows(IllegalArgumentException.class, () -> new DemoDataGenerator("demo", "x", 1));
    assertThrows(IllegalArgumentException.class, () -> new DemoDataGenerator("demo", "x", 100));
  }

  private DemoTelemetrySource source(String seed, Integer cars) {
    DemoTelemetrySource source = new DemoTelemetrySource(ticker, Duration.ofMillis(100), seed, cars, clock,
        new RecordingMetricsPort());
    source.onTiming(timing::add);
    source.onFrame(frames::add);
    return source;
  }
}
