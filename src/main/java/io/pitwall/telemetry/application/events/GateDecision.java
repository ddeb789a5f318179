package io.pitwall.telemetry.application.events;

import java.util.Objects;

/**
 * Outcome of a gate admission check.
 *
 * @param accepted whether the subscription may proceed
 * @param effectiveRateHz granted rate; {@code 0} when rejected
 * @param reason human-readable explanation
 * @since PITWALL 0.1.0
 */
public record GateDecision(boolean accepted, int effectiveRateHz, String reason) {
  public GateDecision {
    reason = Objects.requireNonNull(reason, "reason");
  }

  static GateDecision accept(int effectiveRateHz, String reason) {
    return new GateDecision(true, effectiveRateHz, reason);
  }

  static GateDecision reject(String reason) {
    return new GateDecision(false, 0, reason);
  }
}
