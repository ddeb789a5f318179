package io.pitwall.telemetry.application.port;

import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Uniform source of timing snapshots and thin frames for one session.
 * <p><strong>Why:</strong> The pipeline and every consumer stay indifferent to whether data comes from a
 * live push transport, a historical replay or the seeded demo simulator.</p>
 * <p><strong>Role:</strong> Port implemented by {@code LiveTelemetrySource}, {@code ReplayTelemetrySource}
 * and {@code DemoTelemetrySource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Connect to one session and deliver identical event shapes regardless of origin.</li>
 *   <li>Hand every listener an unregister handle.</li>
 *   <li>Stop all callbacks and release clocks on {@link #disconnect()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Listener registration is thread-safe; callbacks arrive on the
 * source's own clock or transport thread.</p>
 * <p><strong>Observability:</strong> Implementations count listener failures under {@code source.*}.</p>
 *
 * @since PITWALL 0.1.0
 */
public interface TelemetrySource extends AutoCloseable {
  /**
   * Reports which origin this source draws from.
   *
   * @return source mode
   */
  SourceMode mode();

  /**
   * Connects to a session and starts delivering events.
   *
   * @param sessionId session to follow; must not be blank
   * @throws IOException when the transport or history store fails; the source is then left
   *     disconnected and {@code connect} may be retried
   */
  void connect(String sessionId) throws IOException;

  /**
   * Stops delivery and releases timers and transports. Idempotent and safe before {@link #connect}.
   */
  void disconnect();

  /**
   * Registers a timing snapshot listener.
   *
   * @param listener callback; must not be {@code null}
   * @return handle that unregisters the listener
   */
  Subscription onTiming(Consumer<TimingSnapshot> listener);

  /**
   * Registers a thin frame listener.
   *
   * @param listener callback; must not be {@code null}
   * @return handle that unregisters the listener
   */
  Subscription onFrame(Consumer<ThinFrame> listener);

  /**
   * Indicates whether the source is currently delivering.
   *
   * @return {@code true} while connected
   */
  boolean isConnected();

  /**
   * Delegates to {@link #disconnect()}.
   */
  @Override
  default void close() {
    disconnect();
  }
}
