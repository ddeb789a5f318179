package io.pitwall.telemetry.application.port;

/**
 * <strong>What:</strong> Outbound port for derived events such as pace updates and pace trends.
 * <p><strong>Why:</strong> Keeps the detector unaware of who listens (dashboards, overlays, Kafka).</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent publishes from session workers.</p>
 *
 * @since PITWALL 0.1.0
 */
@FunctionalInterface
public interface EventPublisher {
  /**
   * Publishes an event to interested subscribers.
   *
   * @param event event instance; must not be {@code null}
   */
  void publish(Object event);

  /** Publisher that drops every event. */
  EventPublisher NO_OP = event -> {};
}
