package io.pitwall.telemetry.infrastructure.source.live;

import io.pitwall.telemetry.application.port.LiveTransport;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.infrastructure.source.AbstractTelemetrySource;
import io.pitwall.telemetry.validation.Strings;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Source that forwards timing snapshots and frames pushed by a live transport.
 * <p><strong>Role:</strong> Adapter behind the {@code TelemetrySource} port for {@code mode=live}.</p>
 * <p><strong>Thread-safety:</strong> Connect and disconnect are synchronized; payloads arrive on the
 * transport's thread.</p>
 * <p><strong>Observability:</strong> Logs connect and disconnect at info; connect failures surface as
 * {@link IOException}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class LiveTelemetrySource extends AbstractTelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(LiveTelemetrySource.class);

  /** Update rate requested from the transport when none is configured. */
  public static final int DEFAULT_UPDATE_RATE_HZ = 5;

  private final LiveTransport transport;
  private final int updateRateHz;
  private String sessionId;

  /**
   * Creates a live source.
   *
   * @param transport push transport
   * @param updateRateHz rate requested from the transport; must be positive
   * @param metrics metrics sink
   */
  public LiveTelemetrySource(LiveTransport transport, int updateRateHz, MetricsPort metrics) {
    super(metrics);
    this.transport = Objects.requireNonNull(transport, "transport");
    if (updateRateHz <= 0) {
      throw new IllegalArgumentException("updateRateHz must be positive (was " + updateRateHz + ")");
    }
    this.updateRateHz = updateRateHz;
  }

  /**
   * Creates a live source at the default update rate.
   *
   * @param transport push transport
   */
  public LiveTelemetrySource(LiveTransport transport) {
    this(transport, DEFAULT_UPDATE_RATE_HZ, MetricsPort.NO_OP);
  }

  @Override
  public SourceMode mode() {
    return SourceMode.LIVE;
  }

  @Override
  public synchronized void connect(String sessionId) throws IOException {
    String id = Strings.requireNonBlank("sessionId", sessionId);
    if (isConnected()) {
      if (id.equals(this.sessionId)) {
        return;
      }
      disconnect();
    }
    try {
      transport.open(id, updateRateHz, new LiveTransport.Handler() {
        @Override
        public void onTiming(TimingSnapshot snapshot) {
          emitTiming(snapshot);
        }

        @Override
        public void onFrame(ThinFrame frame) {
          emitFrame(frame);
        }
      });
    } catch (IOException | RuntimeException ex) {
      transport.close();
      log.warn("Live transport failed to open for session {}: {}", id, ex.getMessage());
      throw ex instanceof IOException io ? io : new IOException("Live transport failed to open", ex);
    }
    this.sessionId = id;
    log.info("Live source connected to session {} at {} Hz", id, updateRateHz);
  }

  @Override
  public synchronized void disconnect() {
    if (sessionId == null && transport.status() != LiveTransport.Status.CONNECTED) {
      return;
    }
    transport.close();
    log.info("Live source disconnected from session {}", sessionId);
    sessionId = null;
  }

  @Override
  public boolean isConnected() {
    return transport.status() == LiveTransport.Status.CONNECTED;
  }

  /**
   * Returns the rate requested from the transport.
   *
   * @return update rate in Hz
   */
  public int updateRateHz() {
    return updateRateHz;
  }
}
