package io.pitwall.telemetry.application.port;

import java.time.Duration;

/**
 * Fixed-interval clock that drives replay and demo playback.
 *
 * @since PITWALL 0.1.0
 */
@FunctionalInterface
public interface Ticker {
  /**
   * Starts invoking {@code tick} at a constant cadence.
   *
   * @param interval cadence between ticks; must be positive
   * @param tick callback invoked once per interval
   * @return handle that stops further ticks
   */
  Subscription schedule(Duration interval, Runnable tick);
}
