package io.pitwall.telemetry.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.domain.telemetry.SessionScoped;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventBusTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final EventBus bus = new EventBus(metrics);

  record Ping(String sessionId) implements SessionScoped {}

  record Pong(String sessionId) implements SessionScoped {}

  @Test
  void deliversOnlyMatchingTypes() {
    List<Ping> pings = new ArrayList<>();
    bus.subscribe(Ping.class, pings::add);

    bus.publish(new Ping("a"));
    bus.publish(new Pong("a"));

    assertEquals(List.of(new Ping("a")), pings);
  }

  @Test
  void supertypeSubscribersSeeAllSubtypes() {
    List<SessionScoped> seen = new ArrayList<>();
    bus.subscribe(SessionScoped.class, seen::add);

    bus.publish(new Ping("a"));
    bus.publish(new Pong("b"));
    bus.publish("not scoped");

    assertEquals(2, seen.size());
    assertEquals(1, bus.subscriberCount(Ping.class));
  }

  @Test
  void unsubscribeStopsDeliveryAndIsIdempotent() {
    List<Ping> pings = new ArrayList<>();
    Subscription subscription = bus.subscribe(Ping.class, pings::add);

    bus.publish(new Ping("a"));
    subscription.unsubscribe();
    subscription.unsubscribe();
    bus.publish(new Ping("b"));

    assertEquals(1, pings.size());
    assertEquals(0, bus.subscriberCount(Ping.class));
  }

  @Test
  void failingListenerDoesNotStarveOthers() {
    List<Ping> pings = new ArrayList<>();
    bus.subscribe(Ping.class, ping -> {
      throw new IllegalStateException("boom");
    });
    bus.subscribe(Ping.class, pings::add);

    bus.publish(new Ping("a"));

    assertEquals(1, pings.size());
    assertEquals(1, metrics.count("events.listener.error"));
  }

  @Test
  void listenerMayUnsubscribeWhilePublishing() {
    List<Ping> pings = new ArrayList<>();
    Subscription[] holder = new Subscription[1];
    holder[0] = bus.subscribe(Ping.class, ping -> {
      pings.add(ping);
      holder[0].unsubscribe();
    });

    bus.publish(new Ping("a"));
    bus.publish(new Ping("b"));

    assertEquals(1, pings.size());
  }

  @Test
  void nullEventIsIgnored() {
    List<Object> all = new ArrayList<>();
    bus.subscribe(Object.class, all::add);

    bus.publish(null);

    assertTrue(all.isEmpty());
  }
}
