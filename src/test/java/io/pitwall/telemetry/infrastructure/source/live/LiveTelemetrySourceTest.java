package io.pitwall.telemetry.infrastructure.source.live;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.application.port.LiveTransport;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.testing.RecordingMetricsPort;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LiveTelemetrySourceTest {
  private final StubTransport transport = new StubTransport();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final LiveTelemetrySource source = new LiveTelemetrySource(transport, 4, metrics);

  @Test
  void connectOpensTransportWithRequestedRate() throws IOException {
    source.connect("s1");

    assertTrue(source.isConnected());
    assertEquals(SourceMode.LIVE, source.mode());
    assertEquals("s1", transport.sessionId);
    assertEquals(4, transport.rateHz);
  }

  @Test
  void transportDataReachesListeners() throws IOException {
    List<TimingSnapshot> timing = new ArrayList<>();
    List<ThinFrame> frames = new ArrayList<>();
    source.onTiming(timing::add);
    source.onFrame(frames::add);
    source.connect("s1");

    transport.handler.onTiming(new TimingSnapshot("s1", List.of(), "racing", 1d, 2d, 3, null, null, 10L));
    transport.handler.onFrame(new ThinFrame("s1", "f", 11L, 60d, 4, 8_000, 1, 0.5, 2, null, null, "d1"));

    assertEquals(1, timing.size());
    assertEquals(1, frames.size());
  }

  @Test
  void unsubscribedListenerStopsReceiving() throws IOException {
    List<TimingSnapshot> timing = new ArrayList<>();
    Subscription subscription = source.onTiming(timing::add);
    source.connect("s1");

    subscription.unsubscribe();
    transport.handler.onTiming(new TimingSnapshot("s1", List.of(), "racing", 1d, 2d, 3, null, null, 10L));

    assertTrue(timing.isEmpty());
    assertEquals(0, source.listenerCount());
  }

  @Test
  void throwingListenerIsCountedAndIsolated() throws IOException {
    List<TimingSnapshot> timing = new ArrayList<>();
    source.onTiming(snapshot -> {
      throw new IllegalStateException("bad listener");
    });
    source.onTiming(timing::add);
    source.connect("s1");

    transport.handler.onTiming(new TimingSnapshot("s1", List.of(), "racing", 1d, 2d, 3, null, null, 10L));

    assertEquals(1, timing.size());
    assertEquals(1, metrics.count("source.listener.error"));
  }

  @Test
  void reconnectToSameSessionIsNoOp() throws IOException {
    source.connect("s1");
    source.connect("s1");

    assertEquals(1, transport.opens);
  }

  @Test
  void switchingSessionClosesPreviousTransport() throws IOException {
    source.connect("s1");
    source.connect("s2");

    assertEquals(2, transport.opens);
    assertEquals(1, transport.closes);
    assertEquals("s2", transport.sessionId);
  }

  @Test
  void openFailureSurfacesAsIOException() {
    transport.failure = new IllegalStateException("no route");

    IOException ex = assertThrows(IOException.class, () -> source.connect("s1"));

    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertFalse(source.isConnected());
    assertEquals(1, transport.closes);
  }

  @Test
  void disconnectClosesTransport() throws IOException {
    source.connect("s1");
    source.disconnect();
    source.disconnect();

    assertFalse(source.isConnected());
    assertEquals(1, transport.closes);
  }

  @Test
  void rejectsBlankSessionAndNonPositiveRate() {
    assertThrows(IllegalArgumentException.class, () -> source.connect(" "));
    assertThrows(IllegalArgumentException.class, () -> new LiveTelemetrySource(transport, 0, metrics));
    assertEquals(LiveTelemetrySource.DEFAULT_UPDATE_RATE_HZ, new LiveTelemetrySource(transport).updateRateHz());
  }

  private static final class StubTransport implements LiveTransport {
    private Status status = Status.IDLE;
    private Handler handler;
    private String sessionId;
    private int rateHz;
    private int opens;
    private int closes;
    private RuntimeException failure;

    @Override
    public void open(String sessionId, int updateRateHz, Handler handler) {
      opens++;
      if (failure != null) {
        status = Status.FAILED;
        throw failure;
      }
      this.sessionId = sessionId;
      this.rateHz = updateRateHz;
      this.handler = handler;
      status = Status.CONNECTED;
    }

    @Override
    public Status status() {
      return status;
    }

    @Override
    public void close() {
      closes++;
      status = Status.CLOSED;
    }
  }
}
