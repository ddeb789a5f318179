package io.pitwall.telemetry.domain.pace;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.telemetry.SessionScoped;
import java.util.Objects;

/**
 * Pace summary derived from a vehicle's clean segment history.
 *
 * <p>Sample counts travel with the confidence numbers so consumers can judge reliability on their own.</p>
 *
 * @param sessionId owning session
 * @param vehicleId vehicle id
 * @param straightPace weighted average speed over straights (m/s)
 * @param cornerPace weighted average speed over every non-straight segment (m/s)
 * @param overallPace weighted average speed over all clean samples (m/s)
 * @param paceSlope regression slope of segment time against lap (ms per lap)
 * @param degradationType heuristic cause inferred from the slope
 * @param cleanSampleCount number of clean samples analysed
 * @param totalSampleCount number of samples in history
 * @param dataQualitySummary {@code CLEAN} when clean samples dominate, else {@code TRAFFIC_AFFECTED}
 * @param timestampMillis analysis time
 * @since PITWALL 0.1.0
 */
public record PaceTrend(
    String sessionId,
    String vehicleId,
    ConfidenceValue straightPace,
    ConfidenceValue cornerPace,
    ConfidenceValue overallPace,
    ConfidenceValue paceSlope,
    DegradationType degradationType,
    int cleanSampleCount,
    int totalSampleCount,
    SegmentQuality dataQualitySummary,
    long timestampMillis) implements SessionScoped {

  public PaceTrend {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    vehicleId = Objects.requireNonNull(vehicleId, "vehicleId");
    straightPace = Objects.requireNonNull(straightPace, "straightPace");
    cornerPace = Objects.requireNonNull(cornerPace, "cornerPace");
    overallPace = Objects.requireNonNull(overallPace, "overallPace");
    paceSlope = Objects.requireNonNull(paceSlope, "paceSlope");
    degradationType = Objects.requireNonNull(degradationType, "degradationType");
    dataQualitySummary = Objects.requireNonNull(dataQualitySummary, "dataQualitySummary");
  }
}
