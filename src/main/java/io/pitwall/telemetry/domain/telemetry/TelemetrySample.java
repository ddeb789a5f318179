package io.pitwall.telemetry.domain.telemetry;

import java.util.Objects;

/**
 * One position sample handed to the ingestion pipeline.
 *
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sessionId owning session; never {@code null}
 * @param subStream logical sub-stream name; never {@code null}
 * @param vehicleId vehicle the sample describes; may be {@code null} for session-level frames
 * @param frameId producer-assigned frame identity used for duplicate suppression; may be {@code null}
 * @param timestampMillis sample time in epoch milliseconds
 * @param cyclicPosition fractional lap progress in {@code [0, 1)}
 * @param lap lap index at the time of the sample
 * @param inPitLane whether the vehicle is in the pit lane
 * @param onRacingSurface whether the vehicle is on the racing surface
 * @param trafficOverlap whether another vehicle overlaps this vehicle's position window
 * @since PITWALL 0.1.0
 */
public record TelemetrySample(
    String sessionId,
    String subStream,
    String vehicleId,
    String frameId,
    long timestampMillis,
    double cyclicPosition,
    int lap,
    boolean inPitLane,
    boolean onRacingSurface,
    boolean trafficOverlap) implements SessionScoped {

  /**
   * Validates required identifiers.
   */
  public TelemetrySample {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    subStream = Objects.requireNonNull(subStream, "subStream");
  }

  /**
   * Indicates whether the sample names a vehicle.
   *
   * @return {@code true} when a non-blank vehicle id is present
   */
  public boolean hasVehicle() {
    return vehicleId != null && !vehicleId.isBlank();
  }
}
