package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.validation.Numbers;

/**
 * Thresholds used by {@link SegmentSpeedDetector} and {@link PaceTrendAnalyzer}.
 *
 * @param minSegmentTimeMs traversals faster than this are treated as a position teleport
 * @param maxSegmentTimeMs traversals slower than this are treated as a stop or session pause
 * @param minSpeedMs lowest physically sane derived speed (m/s)
 * @param maxSpeedMs highest physically sane derived speed (m/s)
 * @param historyCapacity completed results retained per vehicle
 * @param minSamplesForTrend clean samples required before a pace trend is produced
 * @param trendSaturationSamples sample count at which an average reaches confidence 1
 * @param tireSlopeThresholdMsPerLap slopes above this value are attributed to tire wear
 * @param fuelBurnSlopeThresholdMsPerLap slopes below the negated value are attributed to fuel burn
 * @param cleanSummaryRatio share of clean samples above which a trend is summarized as clean
 * @since PITWALL 0.1.0
 */
public record DetectorSettings(
    long minSegmentTimeMs,
    long maxSegmentTimeMs,
    double minSpeedMs,
    double maxSpeedMs,
    int historyCapacity,
    int minSamplesForTrend,
    int trendSaturationSamples,
    double tireSlopeThresholdMsPerLap,
    double fuelBurnSlopeThresholdMsPerLap,
    double cleanSummaryRatio) {

  public DetectorSettings {
    Numbers.requireRange("minSegmentTimeMs", minSegmentTimeMs, 0, 3_600_000);
    Numbers.requireRange("maxSegmentTimeMs", maxSegmentTimeMs, minSegmentTimeMs + 1, 86_400_000);
    Numbers.requireRange("minSpeedMs", minSpeedMs, 0d, 1_000d);
    Numbers.requireRange("maxSpeedMs", maxSpeedMs, minSpeedMs, 1_000d);
    Numbers.requireRange("historyCapacity", historyCapacity, 1, 100_000);
    Numbers.requireRange("minSamplesForTrend", minSamplesForTrend, 1, historyCapacity);
    Numbers.requireRange("trendSaturationSamples", trendSaturationSamples, 1, 100_000);
    Numbers.requireRange("tireSlopeThresholdMsPerLap", tireSlopeThresholdMsPerLap, 0d, 60_000d);
    Numbers.requireRange("fuelBurnSlopeThresholdMsPerLap", fuelBurnSlopeThresholdMsPerLap, 0d, 60_000d);
    Numbers.requireRange("cleanSummaryRatio", cleanSummaryRatio, 0d, 1d);
  }

  /**
   * Stock thresholds: 500ms..60s segment times, 0..100 m/s, 100 results, 3 samples for a trend.
   *
   * @return default settings
   */
  public static DetectorSettings defaults() {
    return new DetectorSettings(500L, 60_000L, 0d, 100d, 100, 3, 10, 0d, 10d, 0.7d);
  }
}
