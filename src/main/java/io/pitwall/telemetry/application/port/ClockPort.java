package io.pitwall.telemetry.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps.
 * <p><strong>Why:</strong> Rate limiting, session idle tracking and demo timestamps read time through
 * this port so tests can drive a deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since PITWALL 0.1.0
 * @see io.pitwall.telemetry.infrastructure.time.SystemClockAdapter
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
