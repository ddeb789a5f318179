package io.pitwall.telemetry.application.events;

import io.pitwall.telemetry.application.port.MetricsPort;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Admission check that caps each subscriber's delivery rate by role.
 * <p><strong>Why:</strong> High-frequency streams are expensive to fan out; entitlement is decided once
 * at subscribe time so the hot path only enforces an already-granted rate.</p>
 * <p><strong>Thread-safety:</strong> Immutable policy; safe to share.</p>
 * <p><strong>Observability:</strong> Emits {@code gate.accepted} and {@code gate.rejected}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class SubscriptionGate {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionGate.class);

  private final GatePolicy policy;
  private final MetricsPort metrics;

  /**
   * Creates a gate.
   *
   * @param policy per-role rate ceilings
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public SubscriptionGate(GatePolicy policy, MetricsPort metrics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Decides whether a request may subscribe and at what rate.
   *
   * @param request subscription request
   * @return decision; never {@code null}
   */
  public GateDecision admit(SubscriptionRequest request) {
    Objects.requireNonNull(request, "request");
    GateDecision decision = decide(request);
    if (decision.accepted()) {
      metrics.increment("gate.accepted");
      log.debug("Admitted {} on session {} at {} Hz", request.role(), request.sessionId(),
          decision.effectiveRateHz());
    } else {
      metrics.increment("gate.rejected");
      log.info("Rejected {} on session {}: {}", request.role(), request.sessionId(), decision.reason());
    }
    return decision;
  }

  /**
   * Returns the policy in force.
   *
   * @return gate policy
   */
  public GatePolicy policy() {
    return policy;
  }

  private GateDecision decide(SubscriptionRequest request) {
    int ceiling = policy.maxRateHz(request.role());
    if (ceiling <= 0) {
      return GateDecision.reject("role " + request.role() + " is not entitled");
    }
    if (request.requestedRateHz() <= 0) {
      return GateDecision.reject("requested rate must be positive (was " + request.requestedRateHz() + ")");
    }
    if (request.requestedRateHz() > ceiling) {
      return GateDecision.accept(ceiling,
          "rate capped at " + ceiling + " Hz for role " + request.role());
    }
    return GateDecision.accept(request.requestedRateHz(), "granted");
  }
}
