package io.pitwall.telemetry.config;

import io.pitwall.telemetry.application.events.GatePolicy;
import io.pitwall.telemetry.application.events.ViewerRole;
import io.pitwall.telemetry.application.parity.ParitySettings;
import io.pitwall.telemetry.application.pipeline.RuntimeSettings;
import io.pitwall.telemetry.application.segment.DetectorSettings;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.infrastructure.source.live.LiveTelemetrySource;
import io.pitwall.telemetry.infrastructure.source.replay.ReplayTelemetrySource;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each source mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI arguments.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the mode merged over the common defaults.
   *
   * @param mode {@code live}, {@code replay} or {@code demo}
   * @return unmodifiable flat map
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (SourceMode.fromString(mode)) {
      case LIVE -> buildLiveDefaults();
      case REPLAY -> buildReplayDefaults();
      case DEMO -> buildDemoDefaults();
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("dryRun", "false");
    map.put("durationSec", "0");
    map.put("trendIntervalSec", "10");

    map.put("trackId", "default");
    map.put("trackName", "Default Circuit");
    map.put("trackLengthMeters", "5000");
    map.put("trackMap", "");

    ParitySettings parity = ParitySettings.defaults();
    map.put("parity.identityWindow", Integer.toString(parity.identityWindowCapacity()));
    map.put("parity.outOfOrderToleranceMs", Long.toString(parity.outOfOrderToleranceMillis()));
    map.put("parity.errorMaxChars", Integer.toString(parity.errorMaxChars()));

    DetectorSettings detector = DetectorSettings.defaults();
    map.put("detector.minSegmentTimeMs", Long.toString(detector.minSegmentTimeMs()));
    map.put("detector.maxSegmentTimeMs", Long.toString(detector.maxSegmentTimeMs()));
    map.put("detector.minSpeedMs", Double.toString(detector.minSpeedMs()));
    map.put("detector.maxSpeedMs", Double.toString(detector.maxSpeedMs()));
    map.put("detector.historyCapacity", Integer.toString(detector.historyCapacity()));
    map.put("detector.minSamplesForTrend", Integer.toString(detector.minSamplesForTrend()));
    map.put("detector.trendSaturationSamples", Integer.toString(detector.trendSaturationSamples()));
    map.put("detector.tireSlopeThresholdMsPerLap", Double.toString(detector.tireSlopeThresholdMsPerLap()));
    map.put("detector.fuelBurnSlopeThresholdMsPerLap",
        Double.toString(detector.fuelBurnSlopeThresholdMsPerLap()));
    map.put("detector.cleanSummaryRatio", Double.toString(detector.cleanSummaryRatio()));

    map.put("runtime.trafficWindowPct", Double.toString(RuntimeSettings.defaults().trafficWindowPct()));

    GatePolicy gate = GatePolicy.defaults();
    for (ViewerRole role : ViewerRole.values()) {
      map.put("gate.maxRateHz." + role.name().toLowerCase(Locale.ROOT), Integer.toString(gate.maxRateHz(role)));
    }

    map.put("kafkaBootstrap", "");
    map.put("kafkaPaceTopic", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildLiveDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("kafkaTimingTopic", "pitwall.timing");
    map.put("kafkaFrameTopic", "pitwall.frames");
    map.put("updateRateHz", Integer.toString(LiveTelemetrySource.DEFAULT_UPDATE_RATE_HZ));
    return map;
  }

  private static Map<String, String> buildReplayDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("historyDir", defaultBaseDirectory().resolve("history").toString());
    map.put("replayStart", "");
    map.put("replayEnd", "");
    map.put("playbackRate", "1");
    map.put("tickIntervalMs", Long.toString(ReplayTelemetrySource.DEFAULT_TICK_INTERVAL.toMillis()));
    map.put("fetchThreads", "1");
    return map;
  }

  private static Map<String, String> buildDemoDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("sessionId", "demo");
    map.put("seed", "default");
    map.put("carCount", "");
    map.put("tickIntervalMs", "100");
    return map;
  }

  private static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".pitwall");
  }
}
