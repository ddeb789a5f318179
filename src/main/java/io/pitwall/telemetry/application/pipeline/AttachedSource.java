package io.pitwall.telemetry.application.pipeline;

import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.TelemetrySource;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a source wired into a runtime. Closing it removes the runtime's listeners and disconnects
 * the source; repeated closes are ignored.
 *
 * @since PITWALL 0.1.0
 */
public final class AttachedSource implements AutoCloseable {
  private final String sessionId;
  private final TelemetrySource source;
  private final List<Subscription> subscriptions;
  private final AtomicBoolean closed = new AtomicBoolean();

  AttachedSource(String sessionId, TelemetrySource source, List<Subscription> subscriptions) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.source = Objects.requireNonNull(source, "source");
    this.subscriptions = List.copyOf(subscriptions);
  }

  /**
   * Returns the session the source feeds.
   *
   * @return session id
   */
  public String sessionId() {
    return sessionId;
  }

  /**
   * Returns the attached source.
   *
   * @return source
   */
  public TelemetrySource source() {
    return source;
  }

  /**
   * Indicates whether the source is still connected.
   *
   * @return {@code true} while connected and not closed
   */
  public boolean isActive() {
    return !closed.get() && source.isConnected();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (Subscription subscription : subscriptions) {
      subscription.unsubscribe();
    }
    source.disconnect();
  }
}
