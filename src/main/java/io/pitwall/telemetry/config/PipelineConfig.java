package io.pitwall.telemetry.config;

import io.pitwall.telemetry.application.events.GatePolicy;
import io.pitwall.telemetry.application.events.ViewerRole;
import io.pitwall.telemetry.application.parity.ParitySettings;
import io.pitwall.telemetry.application.pipeline.RuntimeSettings;
import io.pitwall.telemetry.application.segment.DetectorSettings;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.infrastructure.metrics.MetricsSettings;
import io.pitwall.telemetry.validation.Net;
import io.pitwall.telemetry.validation.Numbers;
import io.pitwall.telemetry.validation.Strings;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed configuration for one {@code run} invocation.
 * <p><strong>Why:</strong> Converts the merged flat map into validated settings records once, so components
 * never parse strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param mode source mode
 * @param sessionId session to attach
 * @param dryRun validate and print the plan without connecting
 * @param verbose enable DEBUG logging
 * @param duration run length; zero means until the source stops or the process is interrupted
 * @param trendInterval interval between pace trend passes
 * @param track track selection
 * @param parity parity tracker settings
 * @param detector detector settings
 * @param runtime runtime settings
 * @param gate subscription gate policy
 * @param metrics metrics export settings
 * @param paceSink optional Kafka sink for pace events
 * @param live live inputs when {@code mode} is {@link SourceMode#LIVE}
 * @param replay replay inputs when {@code mode} is {@link SourceMode#REPLAY}
 * @param demo demo inputs when {@code mode} is {@link SourceMode#DEMO}
 * @since PITWALL 0.1.0
 */
public record PipelineConfig(
    SourceMode mode,
    String sessionId,
    boolean dryRun,
    boolean verbose,
    Duration duration,
    Duration trendInterval,
    TrackSettings track,
    ParitySettings parity,
    DetectorSettings detector,
    RuntimeSettings runtime,
    GatePolicy gate,
    MetricsSettings metrics,
    Optional<PaceSinkConfig> paceSink,
    Optional<LiveSourceConfig> live,
    Optional<ReplaySourceConfig> replay,
    Optional<DemoSourceConfig> demo) {

  public PipelineConfig {
    Objects.requireNonNull(mode, "mode");
    sessionId = Strings.sanitizeTopic("sessionId", sessionId);
    Objects.requireNonNull(duration, "duration");
    if (duration.isNegative()) {
      throw new IllegalArgumentException("durationSec must not be negative");
    }
    Objects.requireNonNull(trendInterval, "trendInterval");
    if (trendInterval.isNegative() || trendInterval.isZero()) {
      throw new IllegalArgumentException("trendIntervalSec must be positive");
    }
    Objects.requireNonNull(track, "track");
    Objects.requireNonNull(parity, "parity");
    Objects.requireNonNull(detector, "detector");
    Objects.requireNonNull(runtime, "runtime");
    Objects.requireNonNull(gate, "gate");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(paceSink, "paceSink");
    Objects.requireNonNull(live, "live");
    Objects.requireNonNull(replay, "replay");
    Objects.requireNonNull(demo, "demo");
    boolean inputsPresent = switch (mode) {
      case LIVE -> live.isPresent();
      case REPLAY -> replay.isPresent();
      case DEMO -> demo.isPresent();
    };
    if (!inputsPresent) {
      throw new IllegalArgumentException("missing " + mode.configName() + " source settings");
    }
  }

  /**
   * Builds typed configuration from an effective flat map.
   *
   * @param values merged configuration, as produced by {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException when any value is missing or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    SourceMode mode = SourceMode.fromString(ConfigValues.requiredString(values, "mode"));
    return new PipelineConfig(
        mode,
        ConfigValues.requiredString(values, "sessionId"),
        ConfigValues.booleanValue(values, "dryRun", false),
        ConfigValues.booleanValue(values, "verbose", false),
        Duration.ofSeconds(ConfigValues.longValue(values, "durationSec", 0L)),
        Duration.ofSeconds(Numbers.requireRange(
            "trendIntervalSec", ConfigValues.longValue(values, "trendIntervalSec", 10L), 1, 3_600)),
        TrackSettings.fromMap(values),
        paritySettings(values),
        detectorSettings(values),
        new RuntimeSettings(ConfigValues.doubleValue(
            values, "runtime.trafficWindowPct", RuntimeSettings.defaults().trafficWindowPct())),
        gatePolicy(values),
        MetricsSettings.fromValues(
            values.get("metricsExporter"), values.get("otelEndpoint"), values.get("otelResourceAttributes")),
        paceSink(values),
        mode == SourceMode.LIVE ? Optional.of(LiveSourceConfig.fromMap(values)) : Optional.empty(),
        mode == SourceMode.REPLAY ? Optional.of(ReplaySourceConfig.fromMap(values)) : Optional.empty(),
        mode == SourceMode.DEMO ? Optional.of(DemoSourceConfig.fromMap(values)) : Optional.empty());
  }

  private static ParitySettings paritySettings(Map<String, String> values) {
    ParitySettings defaults = ParitySettings.defaults();
    return new ParitySettings(
        ConfigValues.intValue(values, "parity.identityWindow", defaults.identityWindowCapacity()),
        ConfigValues.longValue(values, "parity.outOfOrderToleranceMs", defaults.outOfOrderToleranceMillis()),
        ConfigValues.intValue(values, "parity.errorMaxChars", defaults.errorMaxChars()));
  }

  private static DetectorSettings detectorSettings(Map<String, String> values) {
    DetectorSettings d = DetectorSettings.defaults();
    return new DetectorSettings(
        ConfigValues.longValue(values, "detector.minSegmentTimeMs", d.minSegmentTimeMs()),
        ConfigValues.longValue(values, "detector.maxSegmentTimeMs", d.maxSegmentTimeMs()),
        ConfigValues.doubleValue(values, "detector.minSpeedMs", d.minSpeedMs()),
        ConfigValues.doubleValue(values, "detector.maxSpeedMs", d.maxSpeedMs()),
        ConfigValues.intValue(values, "detector.historyCapacity", d.historyCapacity()),
        ConfigValues.intValue(values, "detector.minSamplesForTrend", d.minSamplesForTrend()),
        ConfigValues.intValue(values, "detector.trendSaturationSamples", d.trendSaturationSamples()),
        ConfigValues.doubleValue(values, "detector.tireSlopeThresholdMsPerLap", d.tireSlopeThresholdMsPerLap()),
        ConfigValues.doubleValue(
            values, "detector.fuelBurnSlopeThresholdMsPerLap", d.fuelBurnSlopeThresholdMsPerLap()),
        ConfigValues.doubleValue(values, "detector.cleanSummaryRatio", d.cleanSummaryRatio()));
  }

  private static GatePolicy gatePolicy(Map<String, String> values) {
    GatePolicy defaults = GatePolicy.defaults();
    Map<ViewerRole, Integer> rates = new EnumMap<>(ViewerRole.class);
    for (ViewerRole role : ViewerRole.values()) {
      String key = "gate.maxRateHz." + role.name().toLowerCase(Locale.ROOT);
      rates.put(role, ConfigValues.intValue(values, key, defaults.maxRateHz(role)));
    }
    return new GatePolicy(rates);
  }

  private static Optional<PaceSinkConfig> paceSink(Map<String, String> values) {
    Optional<String> topic = ConfigValues.optionalString(values, "kafkaPaceTopic");
    if (topic.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new PaceSinkConfig(
        Net.validateBootstrapServers(ConfigValues.requiredString(values, "kafkaBootstrap")),
        Strings.sanitizeTopic("kafkaPaceTopic", topic.get())));
  }

  /**
   * Kafka destination for pace updates and trends.
   *
   * @param kafkaBootstrap validated bootstrap list
   * @param topic destination topic
   */
  public record PaceSinkConfig(String kafkaBootstrap, String topic) {
    public PaceSinkConfig {
      Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
      Objects.requireNonNull(topic, "topic");
    }
  }
}
