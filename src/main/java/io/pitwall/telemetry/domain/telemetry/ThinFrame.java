package io.pitwall.telemetry.domain.telemetry;

import java.util.Objects;

/**
 * Fine-grained motion frame for a single car.
 *
 * @param sessionId owning session
 * @param frameId producer-assigned frame identity; may be {@code null}
 * @param timestampMillis frame time in epoch milliseconds
 * @param speed speed in m/s
 * @param gear selected gear
 * @param rpm engine speed
 * @param lap lap index
 * @param lapProgress fractional lap progress in {@code [0, 1)}
 * @param position running position
 * @param throttle throttle in {@code [0, 1]}; may be {@code null}
 * @param brake brake in {@code [0, 1]}; may be {@code null}
 * @param driverId driver the frame describes; may be {@code null}
 * @since PITWALL 0.1.0
 */
public record ThinFrame(
    String sessionId,
    String frameId,
    long timestampMillis,
    double speed,
    int gear,
    int rpm,
    int lap,
    double lapProgress,
    int position,
    Double throttle,
    Double brake,
    String driverId) implements SessionScoped {

  public ThinFrame {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
  }
}
