package io.pitwall.telemetry.infrastructure.source.replay;

/**
 * Recorded time range to replay.
 *
 * @param startMillis inclusive start, epoch milliseconds
 * @param endMillis exclusive end, epoch milliseconds; must be after {@code startMillis}
 * @since PITWALL 0.1.0
 */
public record ReplayWindow(long startMillis, long endMillis) {
  public ReplayWindow {
    if (endMillis <= startMillis) {
      throw new IllegalArgumentException(
          "replay end (" + endMillis + ") must be after start (" + startMillis + ")");
    }
  }

  /**
   * Returns the window length.
   *
   * @return duration in milliseconds
   */
  public long durationMillis() {
    return endMillis - startMillis;
  }

  /**
   * Clamps a timestamp into {@code [start, end]}.
   *
   * @param millis candidate timestamp
   * @return clamped timestamp
   */
  public long clamp(long millis) {
    return Math.max(startMillis, Math.min(endMillis, millis));
  }
}
