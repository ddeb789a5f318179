package io.pitwall.telemetry.application.events;

import io.pitwall.telemetry.application.port.EventPublisher;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Typed in-process publish/subscribe registry for telemetry and pace events.
 * <p><strong>Why:</strong> Producers (detector, sources) and consumers (sinks, viewers) must not know
 * about each other; every registration hands back a {@link Subscription} so nothing leaks.</p>
 * <p><strong>Role:</strong> Owned by {@code TelemetryRuntime}; injected into producers as an
 * {@link EventPublisher}.</p>
 * <p><strong>Thread-safety:</strong> Registrations live in a {@link CopyOnWriteArrayList}; publishing
 * iterates a stable snapshot and may run concurrently with subscribe and unsubscribe.</p>
 * <p><strong>Observability:</strong> A throwing listener is logged at warn and counted as
 * {@code events.listener.error}; delivery to the remaining listeners continues.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class EventBus implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final CopyOnWriteArrayList<Registration<?>> registrations = new CopyOnWriteArrayList<>();
  private final MetricsPort metrics;

  /**
   * Creates a bus.
   *
   * @param metrics metrics sink; {@link MetricsPort#NO_OP} when {@code null}
   */
  public EventBus(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /** Creates a bus without metrics. */
  public EventBus() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Registers a listener for events assignable to {@code type}.
   *
   * @param type event type, e.g. {@code PaceTrend.class}
   * @param listener callback
   * @param <E> event type
   * @return handle whose {@code unsubscribe()} is idempotent
   */
  public <E> Subscription subscribe(Class<E> type, Consumer<? super E> listener) {
    Registration<E> registration = new Registration<>(
        Objects.requireNonNull(type, "type"), Objects.requireNonNull(listener, "listener"));
    registrations.add(registration);
    return () -> {
      if (registration.active.compareAndSet(true, false)) {
        registrations.remove(registration);
      }
    };
  }

  @Override
  public void publish(Object event) {
    if (event == null) {
      return;
    }
    for (Registration<?> registration : registrations) {
      if (registration.type.isInstance(event)) {
        deliver(registration, event);
      }
    }
  }

  /**
   * Counts listeners whose type accepts events of {@code type}.
   *
   * @param type event type
   * @return number of active registrations that would receive an instance of {@code type}
   */
  public int subscriberCount(Class<?> type) {
    int count = 0;
    for (Registration<?> registration : registrations) {
      if (registration.type.isAssignableFrom(type)) {
        count++;
      }
    }
    return count;
  }

  private <E> void deliver(Registration<E> registration, Object event) {
    if (!registration.active.get()) {
      return;
    }
    try {
      registration.listener.accept(registration.type.cast(event));
    } catch (RuntimeException ex) {
      metrics.increment("events.listener.error");
      log.warn("Listener for {} failed on {}", registration.type.getSimpleName(),
          event.getClass().getSimpleName(), ex);
    }
  }

  private static final class Registration<E> {
    final Class<E> type;
    final Consumer<? super E> listener;
    final AtomicBoolean active = new AtomicBoolean(true);

    Registration(Class<E> type, Consumer<? super E> listener) {
      this.type = type;
      this.listener = listener;
    }
  }
}
