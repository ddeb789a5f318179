package io.pitwall.telemetry.infrastructure.source.demo;

import io.pitwall.telemetry.application.port.ClockPort;
import io.pitwall.telemetry.application.port.MetricsPort;
import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.Ticker;
import io.pitwall.telemetry.domain.telemetry.SourceMode;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.infrastructure.source.AbstractTelemetrySource;
import io.pitwall.telemetry.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Source that emits a seeded, fully synthetic race.
 * <p><strong>Why:</strong> Overlays and downstream consumers need realistic traffic without a simulator
 * or recorded session.</p>
 * <p><strong>Behavior:</strong> Every tick advances the simulation by the tick interval. Tick {@code n}
 * (counting from one) emits a timing snapshot when {@code n % 5 == 0} and a featured-driver frame when
 * {@code n % 2 == 0}. Timestamps are the clock reading at connect plus simulated time, so identical seeds
 * yield identical payloads.</p>
 * <p><strong>Thread-safety:</strong> State is guarded by this instance's monitor; listeners are invoked
 * outside of it.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class DemoTelemetrySource extends AbstractTelemetrySource {
  private static final Logger log = LoggerFactory.getLogger(DemoTelemetrySource.class);

  /** Default simulation step. */
  public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
  static final int TIMING_EVERY_TICKS = 5;
  static final int FRAME_EVERY_TICKS = 2;

  private final Ticker ticker;
  private final long tickIntervalMillis;
  private final String seed;
  private final Integer carCount;
  private final ClockPort clock;

  private DemoDataGenerator generator;
  private Subscription tickSubscription = Subscription.NONE;
  private String sessionId;
  private long connectedAtMillis;
  private long tickCount;

  /**
   * Creates a demo source.
   *
   * @param ticker fixed-interval clock
   * @param tickInterval simulation step per tick
   * @param seed seed text; {@code "default"} when {@code null}
   * @param carCount fixed field size, or {@code null} to derive it from the seed
   * @param clock clock read once per connect to anchor timestamps
   * @param metrics metrics sink
   */
  public DemoTelemetrySource(
      Ticker ticker,
      Duration tickInterval,
      String seed,
      Integer carCount,
      ClockPort clock,
      MetricsPort metrics) {
    super(metrics);
    this.ticker = Objects.requireNonNull(ticker, "ticker");
    Objects.requireNonNull(tickInterval, "tickInterval");
    if (tickInterval.isNegative() || tickInterval.isZero()) {
      throw new IllegalArgumentException("tickInterval must be positive");
    }
    this.tickIntervalMillis = tickInterval.toMillis();
    this.seed = seed;
    this.carCount = carCount;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public SourceMode mode() {
    return SourceMode.DEMO;
  }

  @Override
  public void connect(String sessionId) {
    String id = Strings.requireNonBlank("sessionId", sessionId);
    synchronized (this) {
      if (generator != null && id.equals(this.sessionId)) {
        return;
      }
    }
    disconnect();
    DemoDataGenerator fresh = new DemoDataGenerator(id, seed, carCount);
    synchronized (this) {
      this.generator = fresh;
      this.sessionId = id;
      this.connectedAtMillis = clock.nowMillis();
      this.tickCount = 0;
      this.tickSubscription = ticker.schedule(Duration.ofMillis(tickIntervalMillis), this::tick);
    }
    log.info("Demo source connected to session {} ({} cars at {})", id, fresh.carCount(), fresh.trackName());
  }

  @Override
  public void disconnect() {
    Subscription subscription;
    String id;
    synchronized (this) {
      if (generator == null) {
        return;
      }
      subscription = tickSubscription;
      tickSubscription = Subscription.NONE;
      generator = null;
      id = sessionId;
    }
    subscription.unsubscribe();
    log.info("Demo source disconnected from session {}", id);
  }

  @Override
  public synchronized boolean isConnected() {
    return generator != null;
  }

  void tick() {
    TimingSnapshot timing = null;
    ThinFrame frame = null;
    synchronized (this) {
      if (generator == null) {
        return;
      }
      tickCount++;
      generator.advance(tickIntervalMillis);
      long timestamp = connectedAtMillis + generator.simulatedMillis();
      if (tickCount % TIMING_EVERY_TICKS == 0) {
        timing = generator.generateTiming(timestamp);
      }
      if (tickCount % FRAME_EVERY_TICKS == 0) {
        frame = generator.generateFrame(timestamp);
      }
    }
    if (timing != null) {
      emitTiming(timing);
    }
    if (frame != null) {
      emitFrame(frame);
    }
  }

  /**
   * Returns the active generator's field size.
   *
   * @return car count, or {@code 0} while disconnected
   */
  public synchronized int activeCarCount() {
    return generator == null ? 0 : generator.carCount();
  }

  /**
   * Returns the simulated track name of the active session.
   *
   * @return track name, or {@code null} while disconnected
   */
  public synchronized String trackName() {
    return generator == null ? null : generator.trackName();
  }
}
