package io.pitwall.telemetry.infrastructure.time;

import io.pitwall.telemetry.application.port.Subscription;
import io.pitwall.telemetry.application.port.Ticker;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Ticker} backed by a {@link ScheduledExecutorService} at a fixed rate.
 *
 * <p>A tick that throws is logged at warn; later ticks still run.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class ScheduledTicker implements Ticker {
  private static final Logger log = LoggerFactory.getLogger(ScheduledTicker.class);

  private final ScheduledExecutorService scheduler;

  /**
   * Creates a ticker over a caller-owned scheduler.
   *
   * @param scheduler scheduler; shut down by its owner
   */
  public ScheduledTicker(ScheduledExecutorService scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public Subscription schedule(Duration interval, Runnable tick) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(tick, "tick");
    long periodMillis = interval.toMillis();
    if (periodMillis <= 0) {
      throw new IllegalArgumentException("interval must be at least 1ms");
    }
    ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
      try {
        tick.run();
      } catch (RuntimeException ex) {
        log.warn("Tick failed; continuing with the next interval", ex);
      }
    }, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }
}
