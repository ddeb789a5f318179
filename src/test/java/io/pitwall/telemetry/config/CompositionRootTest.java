package io.pitwall.telemetry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.application.pipeline.TelemetryRuntime;
import io.pitwall.telemetry.application.port.TelemetrySource;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import io.pitwall.telemetry.testing.MutableClock;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void demoWiringSharesOneRuntime() throws Exception {
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of()), new RecordingMetricsPort(), new MutableClock(1_000L))) {
      TelemetryRuntime runtime = root.telemetryRuntime();

      assertSame(runtime, root.telemetryRuntime());
      TelemetrySource source = root.telemetrySource();
      assertEquals(SourceMode.DEMO, source.mode());
    }
  }

  @Test
  void defaultTrackMapUsesConfiguredLength() throws Exception {
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of("trackId", "ring", "trackLengthMeters", "3000")), new RecordingMetricsPort(),
        new MutableClock(0L))) {
      TrackSegmentMap map = root.trackMap();

      assertEquals("ring", map.trackId());
      assertEquals(3000d, map.trackLengthMeters());
      assertTrue(map.segments().size() > 1);
    }
  }

  @Test
  void trackMapFileTakesPrecedence() throws Exception {
    Path oval = Path.of(CompositionRootTest.class.getResource("/tracks/test-oval.yaml").toURI());
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of("trackMap", oval.toString())), new RecordingMetricsPort(), new MutableClock(0L))) {
      assertEquals("test-oval", root.trackMap().trackId());
    }
  }

  @Test
  void paceConsumersSubscribeToTheBus() throws Exception {
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of()), new RecordingMetricsPort(), new MutableClock(0L))) {
      root.attachPaceConsumers();

      assertEquals(1, root.telemetryRuntime().bus().subscriberCount(SegmentPaceUpdate.class));
    }
  }

  private static PipelineConfig config(Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>(DefaultsForMode.asFlatMap("demo"));
    values.put("mode", "demo");
    values.putAll(overrides);
    return PipelineConfig.fromMap(values);
  }
}
