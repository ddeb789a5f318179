package io.pitwall.telemetry.application.pipeline;

import io.pitwall.telemetry.validation.Numbers;

/**
 * Tunables for {@link TelemetryRuntime}.
 *
 * @param trafficWindowPct fractional lap distance within which two cars count as overlapping
 * @since PITWALL 0.1.0
 */
public record RuntimeSettings(double trafficWindowPct) {
  public RuntimeSettings {
    Numbers.requireRange("trafficWindowPct", trafficWindowPct, 0d, 0.5d);
  }

  /**
   * Default settings: a traffic window of 0.5% of a lap.
   *
   * @return defaults
   */
  public static RuntimeSettings defaults() {
    return new RuntimeSettings(0.005d);
  }
}
