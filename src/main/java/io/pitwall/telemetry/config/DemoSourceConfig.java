package io.pitwall.telemetry.config;

import io.pitwall.telemetry.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Demo mode inputs.
 *
 * @param seed seed text
 * @param carCount fixed field size, or {@code null} to derive it from the seed
 * @param tickInterval interval between simulation ticks
 * @since PITWALL 0.1.0
 */
public record DemoSourceConfig(String seed, Integer carCount, Duration tickInterval) {
  public DemoSourceConfig {
    seed = seed == null || seed.isBlank() ? "default" : seed.trim();
    if (carCount != null) {
      Numbers.requireRange("carCount", carCount, 2, 99);
    }
    Objects.requireNonNull(tickInterval, "tickInterval");
    Numbers.requireRange("tickIntervalMs", tickInterval.toMillis(), 10, 10_000);
  }

  static DemoSourceConfig fromMap(Map<String, String> values) {
    Integer cars = ConfigValues.optionalString(values, "carCount").isPresent()
        ? ConfigValues.intValue(values, "carCount", 0)
        : null;
    return new DemoSourceConfig(
        ConfigValues.string(values, "seed", "default"),
        cars,
        Duration.ofMillis(ConfigValues.longValue(values, "tickIntervalMs", 100L)));
  }
}
