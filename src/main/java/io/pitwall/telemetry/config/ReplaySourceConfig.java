package io.pitwall.telemetry.config;

import io.pitwall.telemetry.infrastructure.source.replay.PlaybackRate;
import io.pitwall.telemetry.infrastructure.source.replay.ReplayWindow;
import io.pitwall.telemetry.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Replay mode inputs.
 *
 * @param historyDir base directory of the NDJSON history store
 * @param window recorded range to play
 * @param rate initial playback rate
 * @param tickInterval real-time interval between ticks
 * @param fetchThreads background fetch threads
 * @since PITWALL 0.1.0
 */
public record ReplaySourceConfig(
    Path historyDir, ReplayWindow window, PlaybackRate rate, Duration tickInterval, int fetchThreads) {
  public ReplaySourceConfig {
    historyDir = Objects.requireNonNull(historyDir, "historyDir").toAbsolutePath().normalize();
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(rate, "rate");
    Objects.requireNonNull(tickInterval, "tickInterval");
    Numbers.requireRange("tickIntervalMs", tickInterval.toMillis(), 10, 10_000);
    Numbers.requireRange("fetchThreads", fetchThreads, 1, 8);
  }

  static ReplaySourceConfig fromMap(Map<String, String> values) {
    return new ReplaySourceConfig(
        Path.of(ConfigValues.requiredString(values, "historyDir")),
        new ReplayWindow(
            ConfigValues.epochMillis(values, "replayStart"),
            ConfigValues.epochMillis(values, "replayEnd")),
        PlaybackRate.of(ConfigValues.intValue(values, "playbackRate", 1)),
        Duration.ofMillis(ConfigValues.longValue(values, "tickIntervalMs", 100L)),
        ConfigValues.intValue(values, "fetchThreads", 1));
  }
}
