package io.pitwall.telemetry.application.port;

import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import java.io.IOException;

/**
 * <strong>What:</strong> Push transport behind the live source.
 * <p><strong>Why:</strong> Separates subscription plumbing (Kafka today) from listener fan-out.</p>
 * <p><strong>Thread-safety:</strong> {@link #open} and {@link #close()} are called from a control thread;
 * handler callbacks arrive on the transport's own thread.</p>
 *
 * @since PITWALL 0.1.0
 */
public interface LiveTransport extends AutoCloseable {
  /**
   * Opens a push subscription for one session.
   *
   * @param sessionId session key
   * @param updateRateHz requested update rate
   * @param handler receiver of inbound payloads
   * @throws IOException when the subscription cannot be established
   */
  void open(String sessionId, int updateRateHz, Handler handler) throws IOException;

  /**
   * Reports the transport's own connection status.
   *
   * @return current status
   */
  Status status();

  /**
   * Closes the subscription. Idempotent.
   */
  @Override
  void close();

  /** Connection status reported by the transport. */
  enum Status {
    IDLE,
    CONNECTING,
    CONNECTED,
    FAILED,
    CLOSED
  }

  /** Receiver of inbound payloads. */
  interface Handler {
    void onTiming(TimingSnapshot snapshot);

    void onFrame(ThinFrame frame);
  }
}
