package io.pitwall.telemetry.domain.telemetry;

/**
 * Implemented by every payload that belongs to exactly one session, so subscribers can be scoped
 * without knowing each concrete event type.
 *
 * @since PITWALL 0.1.0
 */
public interface SessionScoped {
  /**
   * Returns the owning session.
   *
   * @return session id
   */
  String sessionId();
}
