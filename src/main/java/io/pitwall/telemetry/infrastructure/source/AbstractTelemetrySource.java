package io.pitwall.telemetry.infrastructure.source;

import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.TelemetrySource;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listener registry shared by all telemetry sources.
 *
 * <p>Registrations outlive reconnects; only {@link Subscription#unsubscribe()} removes them. A listener
 * that throws is logged and counted as {@code source.listener.error} and the remaining listeners still
 * receive the payload.</p>
 *
 * @since PITWALL 0.1.0
 */
public abstract class AbstractTelemetrySource implements TelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(AbstractTelemetrySource.class);

  private final CopyOnWriteArrayList<Consumer<TimingSnapshot>> timingListeners = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<Consumer<ThinFrame>> frameListeners = new CopyOnWriteArrayList<>();
  protected final MetricsPort metrics;

  protected AbstractTelemetrySource(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public final Subscription onTiming(Consumer<TimingSnapshot> listener) {
    return register(timingListeners, listener);
  }

  @Override
  public final Subscription onFrame(Consumer<ThinFrame> listener) {
    return register(frameListeners, listener);
  }

  /**
   * Delivers a timing snapshot to every registered listener.
   *
   * @param snapshot payload
   */
  protected final void emitTiming(TimingSnapshot snapshot) {
    deliver(timingListeners, snapshot, "timing");
  }

  /**
   * Delivers a frame to every registered listener.
   *
   * @param frame payload
   */
  protected final void emitFrame(ThinFrame frame) {
    deliver(frameListeners, frame, "frame");
  }

  /**
   * Returns the number of registered listeners of both kinds.
   *
   * @return listener count
   */
  public final int listenerCount() {
    return timingListeners.size() + frameListeners.size();
  }

  private static <T> Subscription register(List<Consumer<T>> listeners, Consumer<T> listener) {
    Objects.requireNonNull(listener, "listener");
    // One wrapper per registration so each handle removes only itself.
    Consumer<T> handle = listener::accept;
    listeners.add(handle);
    return () -> listeners.remove(handle);
  }

  private <T> void deliver(List<Consumer<T>> listeners, T payload, String kind) {
    for (Consumer<T> listener : listeners) {
      try {
        listener.accept(payload);
      } catch (RuntimeException ex) {
        metrics.increment("source.listener.error");
        log.warn("{} source {} listener failed", mode().configName(), kind, ex);
      }
    }
  }
}
