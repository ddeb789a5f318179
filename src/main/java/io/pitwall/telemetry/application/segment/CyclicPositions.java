package io.pitwall.telemetry.application.segment;

/**
 * Arithmetic on the cyclic lap coordinate {@code [0, 1)}.
 *
 * @since PITWALL 0.1.0
 */
public final class CyclicPositions {
  private CyclicPositions() {}

  /**
   * Shortest signed distance from {@code from} to {@code to} across the start/finish line.
   *
   * <p>{@code wrapSafeDelta(0.98, 0.02)} is {@code +0.04}, not {@code -0.96}.</p>
   *
   * @param from earlier position
   * @param to later position
   * @return delta in {@code [-0.5, 0.5]}
   */
  public static double wrapSafeDelta(double from, double to) {
    double delta = to - from;
    if (delta < -0.5d) {
      delta += 1d;
    } else if (delta > 0.5d) {
      delta -= 1d;
    }
    return delta;
  }

  /**
   * Converts a fractional lap delta into meters.
   *
   * @param delta fractional delta, typically from {@link #wrapSafeDelta(double, double)}
   * @param trackLengthMeters lap length
   * @return distance in meters, signed like {@code delta}
   */
  public static double deltaToMeters(double delta, double trackLengthMeters) {
    return delta * trackLengthMeters;
  }

  /**
   * Folds any finite position into {@code [0, 1)}.
   *
   * @param position raw position, possibly negative or above one
   * @return normalized position
   */
  public static double normalize(double position) {
    double folded = position % 1d;
    if (folded < 0d) {
      folded += 1d;
    }
    return folded >= 1d ? 0d : folded;
  }
}
