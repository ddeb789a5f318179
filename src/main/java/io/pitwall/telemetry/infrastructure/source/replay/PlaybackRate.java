package io.pitwall.telemetry.infrastructure.source.replay;

import java.util.List;

/**
 * Replay speed multiplier restricted to 1x, 2x, 5x and 10x.
 *
 * @param multiplier virtual milliseconds per wall-clock millisecond
 * @since PITWALL 0.1.0
 */
public record PlaybackRate(int multiplier) {
  /** Multipliers accepted by {@link #of(int)}. */
  public static final List<Integer> ALLOWED = List.of(1, 2, 5, 10);

  /** Real-time playback. */
  public static final PlaybackRate REAL_TIME = new PlaybackRate(1);

  public PlaybackRate {
    if (!ALLOWED.contains(multiplier)) {
      throw new IllegalArgumentException(
          "playback rate must be one of " + ALLOWED + " (was " + multiplier + ")");
    }
  }

  /**
   * Validates and wraps a multiplier.
   *
   * @param multiplier requested rate
   * @return playback rate
   * @throws IllegalArgumentException when the rate is not in {@link #ALLOWED}
   */
  public static PlaybackRate of(int multiplier) {
    return new PlaybackRate(multiplier);
  }
}
