package io.pitwall.telemetry.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.events.GatePolicy;
import io.pitwall.telemetry.application.events.SubscriptionGate;
import io.pitwall.telemetry.application.events.SubscriptionRejectedException;
import io.pitwall.telemetry.application.events.SubscriptionRequest;
import io.pitwall.telemetry.application.events.ViewerRole;
import io.pitwall.telemetry.application.parity.FrameParityTracker;
import io.pitwall.telemetry.application.parity.ParitySettings;
import io.pitwall.telemetry.application.parity.ParitySnapshot;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.segment.DefaultSegmentMaps;
import io.pitwall.telemetry.application.segment.DetectorSettings;
import io.pitwall.telemetry.application.segment.SegmentSpeedDetector;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import io.pitwall.telemetry.domain.telemetry.SubStreams;
import io.pitwall.telemetry.domain.telemetry.TelemetrySample;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingEntry;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.testing.FakeTelemetrySource;
import io.pitwall.telemetry.testing.MutableClock;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryRuntimeTest {
  private static final String SESSION = "race-1";

  private final MutableClock clock = new MutableClock(1_000_000L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private EventBus bus;
  private TelemetryRuntime runtime;

  @BeforeEach
  void setUp() {
    bus = new EventBus(metrics);
    FrameParityTracker parity = new FrameParityTracker(ParitySettings.defaults(), metrics, clock);
    SegmentSpeedDetector detector =
        new SegmentSpeedDetector(DetectorSettings.defaults(), bus, clock, metrics);
    runtime = new TelemetryRuntime(parity, detector, bus,
        new SubscriptionGate(GatePolicy.defaults(), metrics), clock, metrics, RuntimeSettings.defaults());
  }

  @Test
  void novelSampleIsClassifiedForAck() {
    IngestOutcome outcome = runtime.ingest(sample("f-1", 0.1, 1_000L));

    assertTrue(outcome.classification().shouldAck());
    assertTrue(outcome.segmentResult().isEmpty());
    assertEquals(List.of(SESSION), runtime.sessionIds());
  }

  @Test
  void duplicateSampleNeverReachesDetector() {
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    runtime.ingest(sample("f-1", 0.01, 0L));
    runtime.ingest(sample("f-2", 0.02, 1_000L));
    runtime.ingest(sample("f-3", 0.26, 21_000L));

    IngestOutcome replayed = runtime.ingest(sample("f-3", 0.51, 41_000L));

    assertTrue(replayed.classification().isDuplicate());
    assertTrue(replayed.segmentResult().isEmpty());
    assertEquals(1, runtime.vehicleHistory(SESSION, "car1").size());
  }

  @Test
  void outOfOrderSampleNeverReachesDetector() {
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    runtime.ingest(sample("f-1", 0.01, 10_000L));
    runtime.ingest(sample("f-2", 0.02, 30_000L));

    IngestOutcome late = runtime.ingest(sample("f-3", 0.26, 5_000L));

    assertTrue(late.classification().isOutOfOrder());
    assertTrue(late.segmentResult().isEmpty());
    assertEquals(1, runtime.paritySnapshot(SESSION).orElseThrow().outOfOrder());
  }

  @Test
  void acknowledgeCountsAckedFrames() {
    runtime.acknowledge(SESSION, SubStreams.CONTROL_INPUT);

    assertEquals(1, runtime.paritySnapshot(SESSION).orElseThrow().stream(SubStreams.CONTROL_INPUT).acked());
  }

  @Test
  void attachedSourceFeedsParityBusAndDetector() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    List<TimingSnapshot> snapshots = new ArrayList<>();
    bus.subscribe(TimingSnapshot.class, snapshots::add);
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));

    AttachedSource attached = runtime.attach(source, SESSION);
    source.emit(timing(1_000L, entry("d1", 0.10, false, false), entry("d2", 0.60, false, false)));

    assertTrue(attached.isActive());
    assertEquals(SESSION, source.sessionId());
    assertEquals(1, snapshots.size());
    ParitySnapshot parity = runtime.paritySnapshot(SESSION).orElseThrow();
    assertEquals(1, parity.stream(SubStreams.COARSE_STATE).framesIn());
    assertEquals(0, parity.stream(SubStreams.COARSE_STATE).acked());
  }

  @Test
  void timingSnapshotsProduceSegmentUpdates() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    List<SegmentPaceUpdate> updates = new ArrayList<>();
    bus.subscribe(SegmentPaceUpdate.class, updates::add);
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    runtime.attach(source, SESSION);

    source.emit(timing(0L, entry("d1", 0.01, false, false)));
    source.emit(timing(1_000L, entry("d1", 0.02, false, false)));
    source.emit(timing(21_000L, entry("d1", 0.26, false, false)));

    assertEquals(1, updates.size());
    assertEquals("d1", updates.get(0).vehicleId());
    assertEquals(50d, updates.get(0).avgSpeed().value().getAsDouble(), 1e-9);
  }

  @Test
  void framesAreAckedOnceAndDuplicatesDropped() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    List<ThinFrame> frames = new ArrayList<>();
    bus.subscribe(ThinFrame.class, frames::add);
    runtime.attach(source, SESSION);

    ThinFrame frame = frame("fr-1", 5_000L);
    source.emit(frame);
    source.emit(frame);

    assertEquals(List.of(frame), frames);
    ParitySnapshot parity = runtime.paritySnapshot(SESSION).orElseThrow();
    assertEquals(2, parity.stream(SubStreams.HIGH_FIDELITY).framesIn());
    assertEquals(1, parity.stream(SubStreams.HIGH_FIDELITY).acked());
    assertEquals(1, parity.duplicates());
  }

  @Test
  void frameExitKeepsPitFlagsFromLatestTiming() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    List<SegmentPaceUpdate> updates = new ArrayList<>();
    bus.subscribe(SegmentPaceUpdate.class, updates::add);
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    runtime.attach(source, SESSION);

    source.emit(timing(0L, entry("d1", 0.01, true, false)));
    source.emit(timing(500L, entry("d1", 0.02, true, false)));
    source.emit(new ThinFrame(SESSION, "fr-9", 21_000L, 50d, 3, 8_000, 1, 0.26, 1, 0.5, 0d, "d1"));

    List<SegmentSpeedResult> history = runtime.vehicleHistory(SESSION, "d1");
    assertEquals(1, history.size());
    assertEquals(SegmentQuality.PIT, history.get(0).quality());
    assertTrue(updates.isEmpty());
  }

  @Test
  void frameForUnknownVehicleUsesClearConditions() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    runtime.attach(source, SESSION);

    source.emit(new ThinFrame(SESSION, "fr-1", 0L, 50d, 3, 8_000, 1, 0.01, 1, 0.5, 0d, "d9"));
    source.emit(new ThinFrame(SESSION, "fr-2", 1_000L, 50d, 3, 8_000, 1, 0.02, 1, 0.5, 0d, "d9"));
    source.emit(new ThinFrame(SESSION, "fr-3", 21_000L, 50d, 3, 8_000, 1, 0.26, 1, 0.5, 0d, "d9"));

    assertEquals(SegmentQuality.CLEAN, runtime.vehicleHistory(SESSION, "d9").get(0).quality());
  }

  @Test
  void failedConnectRemovesListenersAndRecordsError() {
    FakeTelemetrySource source = new FakeTelemetrySource();
    source.failConnectWith(new IOException("broker down"));

    IOException thrown = assertThrows(IOException.class, () -> runtime.attach(source, SESSION));

    assertEquals("broker down", thrown.getMessage());
    assertEquals(0, source.listenerCount());
    assertEquals("connect failed: broker down", runtime.paritySnapshot(SESSION).orElseThrow().lastError());
  }

  @Test
  void closingAttachedSourceDisconnectsOnce() throws IOException {
    FakeTelemetrySource source = new FakeTelemetrySource();
    AttachedSource attached = runtime.attach(source, SESSION);

    attached.close();
    attached.close();

    assertFalse(attached.isActive());
    assertEquals(0, source.listenerCount());
    assertEquals(1, source.disconnects());
    assertSame(source, attached.source());
  }

  @Test
  void unentitledRoleIsRejected() {
    SubscriptionRejectedException ex = assertThrows(SubscriptionRejectedException.class,
        () -> runtime.subscribe(new SubscriptionRequest(SESSION, ViewerRole.ANONYMOUS, 1),
            TimingSnapshot.class, snapshot -> { }));

    assertFalse(ex.decision().accepted());
  }

  @Test
  void subscribersOnlySeeTheirSession() {
    List<TimingSnapshot> seen = new ArrayList<>();
    runtime.subscribe(new SubscriptionRequest(SESSION, ViewerRole.TEAM, 10), TimingSnapshot.class, seen::add);

    bus.publish(new TimingSnapshot("other", List.of(), "racing", 0d, 0d, 0, null, null, 1L));
    bus.publish(new TimingSnapshot(SESSION, List.of(), "racing", 0d, 0d, 0, null, null, 2L));

    assertEquals(1, seen.size());
    assertEquals(SESSION, seen.get(0).sessionId());
  }

  @Test
  void subscribersAreRateLimitedToGrantedRate() {
    List<TimingSnapshot> seen = new ArrayList<>();
    Subscription subscription = runtime.subscribe(
        new SubscriptionRequest(SESSION, ViewerRole.LEAGUE, 50), TimingSnapshot.class, seen::add);

    bus.publish(new TimingSnapshot(SESSION, List.of(), "racing", 0d, 0d, 0, null, null, 1L));
    clock.advance(100L);
    bus.publish(new TimingSnapshot(SESSION, List.of(), "racing", 0d, 0d, 0, null, null, 2L));
    clock.advance(500L);
    bus.publish(new TimingSnapshot(SESSION, List.of(), "racing", 0d, 0d, 0, null, null, 3L));
    subscription.unsubscribe();
    clock.advance(1_000L);
    bus.publish(new TimingSnapshot(SESSION, List.of(), "racing", 0d, 0d, 0, null, null, 4L));

    assertEquals(List.of(1L, 3L), seen.stream().map(TimingSnapshot::timestampMillis).toList());
  }

  @Test
  void nearbyActiveCarMarksTrafficOverlap() {
    TimingEntry subject = entry("d1", 0.500, false, false);
    TimingEntry close = entry("d2", 0.503, false, false);
    TimingEntry retired = entry("d3", 0.501, false, true);

    TelemetrySample withTraffic = runtime.toSample(SESSION, 1L, subject, List.of(subject, close));
    TelemetrySample retiredOnly = runtime.toSample(SESSION, 1L, subject, List.of(subject, retired));

    assertTrue(withTraffic.trafficOverlap());
    assertFalse(retiredOnly.trafficOverlap());
  }

  @Test
  void trafficWindowWrapsAcrossStartFinish() {
    TimingEntry subject = entry("d1", 0.998, false, false);
    TimingEntry other = entry("d2", 0.001, false, false);

    assertTrue(runtime.toSample(SESSION, 1L, subject, List.of(subject, other)).trafficOverlap());
  }

  @Test
  void retiredCarIsTreatedAsOffSurface() {
    TimingEntry retired = entry("d1", 0.2, true, true);

    TelemetrySample sample = runtime.toSample(SESSION, 1L, retired, List.of(retired));

    assertFalse(sample.onRacingSurface());
    assertTrue(sample.inPitLane());
  }

  @Test
  void paceTrendsCoverEveryVehicleWithEnoughData() {
    runtime.setTrackMap(SESSION, DefaultSegmentMaps.equalSegments("t", "T", 4_000d, 4));
    double[] positions = {0.01, 0.02, 0.26, 0.51, 0.76};
    long[] times = {0L, 1_000L, 21_000L, 41_000L, 61_000L};
    for (int i = 0; i < positions.length; i++) {
      for (String car : List.of("b", "a")) {
        runtime.ingest(new TelemetrySample(SESSION, SubStreams.COARSE_STATE, car, null, times[i],
            positions[i], 1, false, true, false));
      }
    }

    List<PaceTrend> trends = runtime.paceTrends(SESSION);

    assertEquals(List.of("a", "b"), trends.stream().map(PaceTrend::vehicleId).toList());
    assertNotNull(runtime.analyzePaceTrend(SESSION, "a").orElse(null));
  }

  @Test
  void idleSessionsAndEndSession() {
    runtime.ingest(sample("f-1", 0.1, 1L));
    clock.advance(60_000L);
    runtime.acknowledge("fresh", SubStreams.CONTROL_INPUT);
    runtime.ingest(new TelemetrySample("fresh", SubStreams.CONTROL_INPUT, null, null, 1L, 0d, 0,
        false, true, false));

    assertEquals(List.of(SESSION), runtime.idleSessions(Duration.ofSeconds(30)));

    runtime.endSession(SESSION);

    assertTrue(runtime.paritySnapshot(SESSION).isEmpty());
    assertTrue(runtime.idleSessions(Duration.ZERO).contains("fresh"));
    assertFalse(runtime.idleSessions(Duration.ZERO).contains(SESSION));
  }

  private static TelemetrySample sample(String frameId, double position, long ts) {
    return new TelemetrySample(SESSION, SubStreams.COARSE_STATE, "car1", frameId, ts, position, 1,
        false, true, false);
  }

  private static TimingSnapshot timing(long ts, TimingEntry... entries) {
    return new TimingSnapshot(SESSION, List.of(entries), "racing", 0d, 0d, 10, null, null, ts);
  }

  private static TimingEntry entry(String driver, double pct, boolean inPit, boolean retired) {
    return new TimingEntry(driver, null, null, null, 1, 1, pct, 0d, 0d, 0d, null, null, null, inPit, retired);
  }

  private static ThinFrame frame(String id, long ts) {
    return new ThinFrame(SESSION, id, ts, 70d, 5, 9_000, 1, 0.3, 1, 0.9, 0d, "d1");
  }
}
