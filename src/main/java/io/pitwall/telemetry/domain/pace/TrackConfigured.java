package io.pitwall.telemetry.domain.pace;

import io.pitwall.telemetry.domain.telemetry.SessionScoped;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.util.Objects;

/**
 * Published when a session receives a new segment map.
 *
 * @param sessionId session whose map changed
 * @param trackMap installed map
 * @since PITWALL 0.1.0
 */
public record TrackConfigured(String sessionId, TrackSegmentMap trackMap) implements SessionScoped {
  public TrackConfigured {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    trackMap = Objects.requireNonNull(trackMap, "trackMap");
  }
}
