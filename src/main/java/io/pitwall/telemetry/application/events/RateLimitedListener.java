package io.pitwall.telemetry.application.events;

import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.application.port.MetricsPort;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Listener decorator that enforces a granted delivery rate by dropping events that arrive within one
 * period of the last delivered event.
 *
 * <p><strong>Thread-safety:</strong> {@link #accept(Object)} is synchronized so concurrent publishers
 * cannot both pass the same window.</p>
 *
 * @param <E> event type
 * @since PITWALL 0.1.0
 */
public final class RateLimitedListener<E> implements Consumer<E> {
  private final Consumer<? super E> delegate;
  private final long minIntervalMillis;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private long lastDeliveredMillis;
  private boolean delivered;

  /**
   * Wraps a listener.
   *
   * @param delegate listener receiving admitted events
   * @param rateHz maximum deliveries per second; must be positive
   * @param clock clock consulted per event
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public RateLimitedListener(Consumer<? super E> delegate, int rateHz, ClockPort clock, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (rateHz <= 0) {
      throw new IllegalArgumentException("rateHz must be positive (was " + rateHz + ")");
    }
    this.minIntervalMillis = 1000L / rateHz;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void accept(E event) {
    synchronized (this) {
      long now = clock.nowMillis();
      if (delivered && now - lastDeliveredMillis < minIntervalMillis) {
        metrics.increment("gate.throttled");
        return;
      }
      delivered = true;
      lastDeliveredMillis = now;
    }
    delegate.accept(event);
  }

  /**
   * Returns the enforced spacing between deliveries.
   *
   * @return minimum interval in milliseconds
   */
  public long minIntervalMillis() {
    return minIntervalMillis;
  }
}
