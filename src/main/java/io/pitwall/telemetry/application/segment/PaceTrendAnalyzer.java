package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.DataSource;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.pace.DegradationType;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Aggregates a vehicle's clean segment history into pace averages and a
 * lap-over-lap slope.
 * <p><strong>Why:</strong> Single traversals are noisy; a least-squares slope of segment time against lap
 * separates tire wear (slowing) from fuel burn (speeding up).</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings; safe to share.</p>
 * <p><strong>Performance:</strong> O(n) over the retained history.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class PaceTrendAnalyzer {
  private final DetectorSettings settings;

  /**
   * Creates an analyzer.
   *
   * @param settings trend thresholds
   */
  public PaceTrendAnalyzer(DetectorSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Builds a trend from a history snapshot.
   *
   * @param sessionId owning session
   * @param vehicleId vehicle the history belongs to
   * @param history completed results, oldest first
   * @param nowMillis timestamp stamped on every produced value
   * @return trend, or empty when fewer than {@code minSamplesForTrend} clean samples exist
   */
  public Optional<PaceTrend> analyze(
      String sessionId, String vehicleId, List<SegmentSpeedResult> history, long nowMillis) {
    List<SegmentSpeedResult> clean = filter(history, r -> r.quality() == SegmentQuality.CLEAN);
    if (clean.size() < settings.minSamplesForTrend()) {
      return Optional.empty();
    }

    ConfidenceValue straightPace =
        averageSpeed(filter(clean, r -> r.segmentType().isStraight()), nowMillis);
    ConfidenceValue cornerPace =
        averageSpeed(filter(clean, r -> r.segmentType().isCornering()), nowMillis);
    ConfidenceValue overallPace = averageSpeed(clean, nowMillis);
    ConfidenceValue slope = paceSlope(clean, nowMillis);

    SegmentQuality summary = clean.size() > history.size() * settings.cleanSummaryRatio()
        ? SegmentQuality.CLEAN
        : SegmentQuality.TRAFFIC_AFFECTED;

    return Optional.of(new PaceTrend(
        sessionId,
        vehicleId,
        straightPace,
        cornerPace,
        overallPace,
        slope,
        inferDegradation(slope),
        clean.size(),
        history.size(),
        summary,
        nowMillis));
  }

  /**
   * Mean of the defined speeds; confidence grows linearly until {@code trendSaturationSamples}.
   *
   * @param samples results to average
   * @param nowMillis timestamp for the produced value
   * @return average tagged {@link DataSource#DERIVED}, or an unknown value when nothing is defined
   */
  ConfidenceValue averageSpeed(List<SegmentSpeedResult> samples, long nowMillis) {
    double sum = 0d;
    int count = 0;
    for (SegmentSpeedResult sample : samples) {
      if (sample.avgSpeed().isDefined()) {
        sum += sample.avgSpeed().value().getAsDouble();
        count++;
      }
    }
    if (count == 0) {
      return ConfidenceValue.unknown(SegmentQuality.UNKNOWN, nowMillis);
    }
    double confidence = Math.min(1d, (double) count / settings.trendSaturationSamples());
    return ConfidenceValue.of(sum / count, confidence, DataSource.DERIVED, SegmentQuality.CLEAN, nowMillis);
  }

  /**
   * Ordinary least squares slope of segment time (ms) against lap number.
   *
   * @param samples clean results
   * @param nowMillis timestamp for the produced value
   * @return slope in ms per lap with R-squared as confidence, or unknown when under three points exist
   *     or every point shares one lap
   */
  ConfidenceValue paceSlope(List<SegmentSpeedResult> samples, long nowMillis) {
    List<double[]> points = new ArrayList<>(samples.size());
    for (SegmentSpeedResult sample : samples) {
      if (sample.avgSpeed().isDefined()) {
        points.add(new double[] {sample.lapNumber(), sample.segmentTimeMs()});
      }
    }
    int n = points.size();
    if (n < 3) {
      return ConfidenceValue.unknown(SegmentQuality.UNKNOWN, nowMillis);
    }

    double sumX = 0d;
    double sumY = 0d;
    double sumXY = 0d;
    double sumX2 = 0d;
    for (double[] p : points) {
      sumX += p[0];
      sumY += p[1];
      sumXY += p[0] * p[1];
      sumX2 += p[0] * p[0];
    }
    double denominator = n * sumX2 - sumX * sumX;
    if (denominator == 0d) {
      return ConfidenceValue.unknown(SegmentQuality.UNKNOWN, nowMillis);
    }
    double slope = (n * sumXY - sumX * sumY) / denominator;

    double meanX = sumX / n;
    double meanY = sumY / n;
    double ssTotal = 0d;
    double ssResidual = 0d;
    for (double[] p : points) {
      double predicted = meanY + slope * (p[0] - meanX);
      ssTotal += (p[1] - meanY) * (p[1] - meanY);
      ssResidual += (p[1] - predicted) * (p[1] - predicted);
    }
    double r2 = ssTotal == 0d ? 1d : 1d - ssResidual / ssTotal;
    double confidence = Math.min(1d, Math.max(0d, r2));
    return ConfidenceValue.of(slope, confidence, DataSource.INFERRED, SegmentQuality.CLEAN, nowMillis);
  }

  DegradationType inferDegradation(ConfidenceValue slope) {
    if (!slope.isDefined()) {
      return DegradationType.UNKNOWN;
    }
    double value = slope.value().getAsDouble();
    if (value > settings.tireSlopeThresholdMsPerLap()) {
      return DegradationType.TIRE;
    }
    if (value < -settings.fuelBurnSlopeThresholdMsPerLap()) {
      return DegradationType.FUEL_BURN;
    }
    return DegradationType.UNKNOWN;
  }

  private static List<SegmentSpeedResult> filter(
      List<SegmentSpeedResult> source, Predicate<SegmentSpeedResult> predicate) {
    List<SegmentSpeedResult> out = new ArrayList<>(source.size());
    for (SegmentSpeedResult result : source) {
      if (predicate.test(result)) {
        out.add(result);
      }
    }
    return out;
  }
}
