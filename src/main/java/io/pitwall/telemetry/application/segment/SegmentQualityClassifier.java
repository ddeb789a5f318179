package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.DataSource;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Grades a completed segment traversal and derives its average speed.
 *
 * <p>Checks run in a fixed priority order and the first match wins: pit lane, off track, too fast,
 * too slow, traffic, clean. Speed is only computed for grades that can carry one.</p>
 *
 * @since PITWALL 0.1.0
 */
final class SegmentQualityClassifier {
  static final double CLEAN_CONFIDENCE = 0.9d;
  static final double TRAFFIC_CONFIDENCE = 0.6d;
  static final double OFFTRACK_CONFIDENCE = 0.3d;
  static final double DEFAULT_CONFIDENCE = 0.5d;

  private final DetectorSettings settings;

  SegmentQualityClassifier(DetectorSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Outcome of grading one traversal.
   *
   * @param quality final grade
   * @param reasons human-readable reasons, in the order they were raised
   * @param avgSpeed derived speed in m/s, tagged
   */
  record Assessment(SegmentQuality quality, List<String> reasons, ConfidenceValue avgSpeed) {
    Assessment {
      reasons = List.copyOf(reasons);
    }
  }

  Assessment assess(
      boolean inPitLane,
      boolean onRacingSurface,
      boolean trafficOverlap,
      long segmentTimeMs,
      double lengthMeters,
      long exitTimestampMillis) {
    List<String> reasons = new ArrayList<>(2);
    SegmentQuality quality = grade(inPitLane, onRacingSurface, trafficOverlap, segmentTimeMs, reasons);

    if (quality == SegmentQuality.PIT || quality == SegmentQuality.INVALID) {
      return new Assessment(quality, reasons, ConfidenceValue.unknown(quality, exitTimestampMillis));
    }

    double speed = lengthMeters / (segmentTimeMs / 1000d);
    if (!Double.isFinite(speed) || speed < settings.minSpeedMs() || speed > settings.maxSpeedMs()) {
      reasons.add(String.format(Locale.ROOT,
          "Derived speed %.2f m/s outside physical bounds", speed));
      return new Assessment(SegmentQuality.INVALID, reasons, ConfidenceValue.invalid(exitTimestampMillis));
    }
    return new Assessment(quality, reasons,
        ConfidenceValue.of(speed, confidenceFor(quality), DataSource.DERIVED, quality, exitTimestampMillis));
  }

  private SegmentQuality grade(
      boolean inPitLane,
      boolean onRacingSurface,
      boolean trafficOverlap,
      long segmentTimeMs,
      List<String> reasons) {
    if (inPitLane) {
      reasons.add("Car in pit lane");
      return SegmentQuality.PIT;
    }
    if (!onRacingSurface) {
      reasons.add("Off racing surface");
      return SegmentQuality.OFFTRACK;
    }
    if (segmentTimeMs < settings.minSegmentTimeMs()) {
      reasons.add("Segment time " + segmentTimeMs + "ms below minimum "
          + settings.minSegmentTimeMs() + "ms (teleport?)");
      return SegmentQuality.INVALID;
    }
    if (segmentTimeMs > settings.maxSegmentTimeMs()) {
      reasons.add("Segment time " + segmentTimeMs + "ms above maximum "
          + settings.maxSegmentTimeMs() + "ms (stopped?)");
      return SegmentQuality.INVALID;
    }
    if (trafficOverlap) {
      reasons.add("Traffic overlap detected");
      return SegmentQuality.TRAFFIC_AFFECTED;
    }
    reasons.add("No quality issues detected");
    return SegmentQuality.CLEAN;
  }

  static double confidenceFor(SegmentQuality quality) {
    return switch (quality) {
      case CLEAN -> CLEAN_CONFIDENCE;
      case TRAFFIC_AFFECTED -> TRAFFIC_CONFIDENCE;
      case OFFTRACK -> OFFTRACK_CONFIDENCE;
      default -> DEFAULT_CONFIDENCE;
    };
  }
}
