package io.pitwall.telemetry.infrastructure.source.replay;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.testing.ManualTicker;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplayTelemetrySourceTest {
  private static final String SESSION = "replay-1";
  private static final long START = 1_000_000L;

  private final InMemoryHistoryStore store = new InMemoryHistoryStore();
  private final ManualTicker ticker = new ManualTicker();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<TimingSnapshot> timing = new ArrayList<>();
  private final List<ThinFrame> frames = new ArrayList<>();

  @BeforeEach
  void seedHistory() {
    for (int i = 0; i < 4; i++) {
      store.addTiming(SESSION, START + i * 500L);
    }
    for (int i = 0; i < 8; i++) {
      store.addFrame(SESSION, "f-" + i, START + i * 250L);
    }
  }

  @Test
  void replaysWholeWindowAtRealTimeThenStops() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);

    assertEquals(SourceMode.REPLAY, source.mode());
    assertEquals(Duration.ofMillis(100), ticker.lastInterval());
    ticker.tick(20);

    assertEquals(List.of(START, START + 500L, START + 1_000L, START + 1_500L),
        timing.stream().map(TimingSnapshot::timestampMillis).toList());
    assertEquals(8, frames.size());
    assertTrue(source.isConnected());

    ticker.tick(1);

    assertFalse(source.isConnected());
    assertEquals(0, ticker.activeCount());
  }

  @Test
  void timingIsEmittedOncePerBucket() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);

    ticker.tick(5);

    assertEquals(1, timing.size());
    assertEquals(START + 500L, source.currentTimeMillis());
  }

  @Test
  void fasterPlaybackAdvancesVirtualTimeFaster() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 5, Runnable::run);
    source.connect(SESSION);

    ticker.tick(2);

    assertEquals(START + 1_000L, source.currentTimeMillis());
    assertEquals(4, frames.size());
  }

  @Test
  void playbackRateCanChangeMidReplay() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);
    ticker.tick(1);

    source.setPlaybackRate(10);
    ticker.tick(1);

    assertEquals(START + 1_100L, source.currentTimeMillis());
    assertEquals(10, source.playbackRate().multiplier());
    assertThrows(IllegalArgumentException.class, () -> source.setPlaybackRate(3));
  }

  @Test
  void independentRunsEmitTimingAtIdenticalVirtualTimestamps() throws IOException {
    for (int i = 0; i < 40; i++) {
      store.addTiming("det-1", START + i * 500L + (i % 3) * 120L);
    }
    List<Long> first = replayTimestamps(new ManualTicker());
    List<Long> second = replayTimestamps(new ManualTicker());

    assertFalse(first.isEmpty());
    assertEquals(first, second);
  }

  private List<Long> replayTimestamps(ManualTicker runTicker) throws IOException {
    List<Long> emitted = new ArrayList<>();
    ReplayTelemetrySource source = new ReplayTelemetrySource(store, new ReplayWindow(START, START + 20_000L),
        PlaybackRate.of(5), runTicker, Duration.ofMillis(100), Runnable::run, metrics);
    source.onTiming(snapshot -> emitted.add(snapshot.timestampMillis()));
    source.connect("det-1");
    runTicker.tick(10);
    source.setPlaybackRate(10);
    runTicker.tick(10);
    source.setPlaybackRate(2);
    runTicker.tick(10);
    source.disconnect();
    return emitted;
  }

  @Test
  void seekForwardWithinFetchedRangeSkipsAhead() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);

    source.seek(START + 1_000L);
    ticker.tick(1);

    assertEquals(List.of(START + 1_000L), timing.stream().map(TimingSnapshot::timestampMillis).toList());
    assertEquals(1, store.timingFetches.size());
  }

  @Test
  void seekBackBeforePrunedDataRefetches() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);
    ticker.tick(10);
    timing.clear();

    source.seek(START);
    ticker.tick(1);

    assertEquals(2, store.timingFetches.size());
    assertEquals(List.of(START), timing.stream().map(TimingSnapshot::timestampMillis).toList());
  }

  @Test
  void seekIsClampedToWindow() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);

    source.seek(START + 99_000L);

    assertEquals(START + 2_000L, source.currentTimeMillis());
  }

  @Test
  void longWindowsAreFetchedInChunks() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(0L, 150_000L), 1, Runnable::run);
    source.connect(SESSION);

    ticker.tick(2);

    assertEquals(2, store.timingFetches.size());
    assertArrayEquals(new long[] {0L, 60_000L}, store.timingFetches.get(0));
    assertArrayEquals(new long[] {60_000L, 120_000L}, store.timingFetches.get(1));
    assertEquals(120_000L, source.fetchedToMillis());
  }

  @Test
  void failedBackgroundFetchIsRetriedOnLaterTick() throws IOException {
    store.failuresRemaining = 1;
    store.failFrom = 60_000L;
    ReplayTelemetrySource source = source(new ReplayWindow(0L, 150_000L), 1, Runnable::run);
    source.connect(SESSION);

    ticker.tick(1);
    assertEquals(1, metrics.count("replay.fetch.error"));
    assertEquals(60_000L, source.fetchedToMillis());

    ticker.tick(1);
    assertEquals(120_000L, source.fetchedToMillis());
  }

  @Test
  void staleFetchAfterSeekIsDiscarded() throws IOException {
    Deque<Runnable> pending = new ArrayDeque<>();
    ReplayTelemetrySource source = source(new ReplayWindow(0L, 200_000L), 1, pending::add);
    source.connect(SESSION);
    ticker.tick(1);
    assertEquals(1, pending.size());

    source.seek(150_000L);
    assertEquals(2, pending.size());

    pending.removeFirst().run();
    assertEquals(150_000L, source.fetchedToMillis());
    pending.removeFirst().run();
    assertEquals(200_000L, source.fetchedToMillis());
  }

  @Test
  void failedPrefetchLeavesSourceDisconnected() {
    store.failuresRemaining = 1;
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);

    assertThrows(IOException.class, () -> source.connect(SESSION));
    assertFalse(source.isConnected());
    assertEquals(0, ticker.activeCount());
  }

  @Test
  void disconnectStopsTicksAndIsIdempotent() throws IOException {
    ReplayTelemetrySource source = source(new ReplayWindow(START, START + 2_000L), 1, Runnable::run);
    source.connect(SESSION);

    source.disconnect();
    source.disconnect();
    ticker.tick(3);

    assertTrue(timing.isEmpty());
    assertEquals(0, ticker.activeCount());
  }

  @Test
  void windowAndRateAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> new ReplayWindow(10L, 10L));
    assertThrows(IllegalArgumentException.class, () -> PlaybackRate.of(4));
    assertEquals(5L, new ReplayWindow(5L, 20L).clamp(1L));
    assertEquals(START, ReplayTelemetrySource.bucketOf(START + 499L));
  }

  private ReplayTelemetrySource source(ReplayWindow window, int rate, Executor executor) {
    ReplayTelemetrySource source = new ReplayTelemetrySource(store, window, PlaybackRate.of(rate), ticker,
        Duration.ofMillis(100), executor, metrics);
    source.onTiming(timing::add);
    source.onFrame(frames::add);
    return source;
  }
}
