package io.pitwall.telemetry.domain.pace;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.DataSource;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.telemetry.SessionScoped;
import java.util.Objects;

/**
 * Published event announcing a usable segment speed for one vehicle.
 *
 * @param sessionId owning session
 * @param vehicleId vehicle id
 * @param segmentId completed segment
 * @param avgSpeed average speed in m/s with confidence tags
 * @param segmentTimeMs elapsed milliseconds in the segment
 * @param qualityFlag quality classification
 * @param confidenceScore confidence copied from {@code avgSpeed}
 * @param source provenance copied from {@code avgSpeed}
 * @param lapNumber lap on which the segment was completed
 * @since PITWALL 0.1.0
 */
public record SegmentPaceUpdate(
    String sessionId,
    String vehicleId,
    String segmentId,
    ConfidenceValue avgSpeed,
    long segmentTimeMs,
    SegmentQuality qualityFlag,
    double confidenceScore,
    DataSource source,
    int lapNumber) implements SessionScoped {

  public SegmentPaceUpdate {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    vehicleId = Objects.requireNonNull(vehicleId, "vehicleId");
    segmentId = Objects.requireNonNull(segmentId, "segmentId");
    avgSpeed = Objects.requireNonNull(avgSpeed, "avgSpeed");
    qualityFlag = Objects.requireNonNull(qualityFlag, "qualityFlag");
    source = Objects.requireNonNull(source, "source");
  }

  /**
   * Builds the event from a completed result.
   *
   * @param sessionId owning session
   * @param result completed traversal
   * @return pace update mirroring the result's tags
   */
  public static SegmentPaceUpdate from(String sessionId, SegmentSpeedResult result) {
    ConfidenceValue speed = result.avgSpeed();
    return new SegmentPaceUpdate(
        sessionId,
        result.vehicleId(),
        result.segmentId(),
        speed,
        result.segmentTimeMs(),
        result.quality(),
        speed.confidence(),
        speed.source(),
        result.lapNumber());
  }
}
