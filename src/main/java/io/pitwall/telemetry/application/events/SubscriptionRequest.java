package io.pitwall.telemetry.application.events;

import java.util.Objects;

/**
 * Request to receive a session's stream at a given rate.
 *
 * @param sessionId session to subscribe to
 * @param role audience class of the requester
 * @param requestedRateHz desired updates per second
 * @since PITWALL 0.1.0
 */
public record SubscriptionRequest(String sessionId, ViewerRole role, int requestedRateHz) {
  public SubscriptionRequest {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    role = Objects.requireNonNull(role, "role");
  }
}
