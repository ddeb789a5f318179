package io.pitwall.telemetry.domain.pace;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.track.SegmentType;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one completed segment traversal by one vehicle.
 *
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param vehicleId vehicle that completed the segment
 * @param segmentId segment that was completed
 * @param segmentType type of the completed segment
 * @param segmentTimeMs elapsed milliseconds between entry and exit
 * @param entryTimestampMillis entry time in epoch milliseconds
 * @param exitTimestampMillis exit time in epoch milliseconds
 * @param avgSpeed average speed in m/s with confidence tags
 * @param quality quality classification
 * @param reasons human-readable quality reasons; never empty
 * @param lapNumber lap on which the segment was completed
 * @since PITWALL 0.1.0
 */
public record SegmentSpeedResult(
    String vehicleId,
    String segmentId,
    SegmentType segmentType,
    long segmentTimeMs,
    long entryTimestampMillis,
    long exitTimestampMillis,
    ConfidenceValue avgSpeed,
    SegmentQuality quality,
    List<String> reasons,
    int lapNumber) {

  private static final double MS_TO_KPH = 3.6d;

  public SegmentSpeedResult {
    vehicleId = Objects.requireNonNull(vehicleId, "vehicleId");
    segmentId = Objects.requireNonNull(segmentId, "segmentId");
    segmentType = Objects.requireNonNull(segmentType, "segmentType");
    avgSpeed = Objects.requireNonNull(avgSpeed, "avgSpeed");
    quality = Objects.requireNonNull(quality, "quality");
    reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons"));
  }

  /**
   * Average speed converted to km/h.
   *
   * @return speed in km/h carrying the same confidence tags
   */
  public ConfidenceValue avgSpeedKph() {
    return avgSpeed.scaled(MS_TO_KPH);
  }
}
