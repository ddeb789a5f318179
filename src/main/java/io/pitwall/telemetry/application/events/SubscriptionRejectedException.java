package io.pitwall.telemetry.application.events;

import java.util.Objects;

/**
 * Thrown when the gate refuses a subscription.
 *
 * @since PITWALL 0.1.0
 */
public final class SubscriptionRejectedException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient GateDecision decision;

  /**
   * Creates an exception carrying the gate's decision.
   *
   * @param request rejected request
   * @param decision rejecting decision
   */
  public SubscriptionRejectedException(SubscriptionRequest request, GateDecision decision) {
    super("Subscription to " + request.sessionId() + " rejected for " + request.role() + ": "
        + decision.reason());
    this.decision = Objects.requireNonNull(decision, "decision");
  }

  /**
   * Returns the rejecting decision.
   *
   * @return gate decision
   */
  public GateDecision decision() {
    return decision;
  }
}
