package io.pitwall.telemetry.infrastructure.events;

import io.pitwall.telemetry.application.events.EventBus;
import io.pitwall.telemetry.application.port.Subscription;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects events of one type in memory, for tests and diagnostics.
 *
 * @param <E> collected event type
 * @since PITWALL 0.1.0
 */
public final class InMemoryEventCollector<E> {
  private final CopyOnWriteArrayList<E> events = new CopyOnWriteArrayList<>();
  private volatile Subscription subscription = Subscription.NONE;

  /**
   * Subscribes a new collector to the bus.
   *
   * @param bus event bus
   * @param type event type to collect
   * @param <E> event type
   * @return collector; stop it with {@link #subscription()}
   */
  public static <E> InMemoryEventCollector<E> attach(EventBus bus, Class<E> type) {
    InMemoryEventCollector<E> collector = new InMemoryEventCollector<>();
    collector.subscription = bus.subscribe(type, collector::accept);
    return collector;
  }

  /**
   * Records an event.
   *
   * @param event event; must not be {@code null}
   */
  public void accept(E event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of collected events.
   *
   * @return immutable list of events
   */
  public List<E> snapshot() {
    return List.copyOf(events);
  }

  /** Clears the captured events. */
  public void clear() {
    events.clear();
  }

  /**
   * Returns the bus registration, {@link Subscription#NONE} when created directly.
   *
   * @return subscription handle
   */
  public Subscription subscription() {
    return subscription;
  }
}
