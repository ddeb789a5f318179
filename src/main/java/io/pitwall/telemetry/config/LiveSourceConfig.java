package io.pitwall.telemetry.config;

import io.pitwall.telemetry.infrastructure.source.live.LiveTelemetrySource;
import io.pitwall.telemetry.validation.Net;
import io.pitwall.telemetry.validation.Numbers;
import io.pitwall.telemetry.validation.Strings;
import java.util.Map;

/**
 * Live mode inputs: relay topics on Kafka.
 *
 * @param kafkaBootstrap validated bootstrap list
 * @param timingTopic topic carrying timing snapshots
 * @param frameTopic topic carrying thin frames
 * @param updateRateHz requested update rate
 * @since PITWALL 0.1.0
 */
public record LiveSourceConfig(String kafkaBootstrap, String timingTopic, String frameTopic, int updateRateHz) {
  public LiveSourceConfig {
    kafkaBootstrap = Net.validateBootstrapServers(kafkaBootstrap);
    timingTopic = Strings.sanitizeTopic("kafkaTimingTopic", timingTopic);
    frameTopic = Strings.sanitizeTopic("kafkaFrameTopic", frameTopic);
    Numbers.requireRange("updateRateHz", updateRateHz, 1, 60);
  }

  static LiveSourceConfig fromMap(Map<String, String> values) {
    return new LiveSourceConfig(
        ConfigValues.requiredString(values, "kafkaBootstrap"),
        ConfigValues.string(values, "kafkaTimingTopic", "pitwall.timing"),
        ConfigValues.string(values, "kafkaFrameTopic", "pitwall.frames"),
        ConfigValues.intValue(values, "updateRateHz", LiveTelemetrySource.DEFAULT_UPDATE_RATE_HZ));
  }
}
