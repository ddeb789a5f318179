package io.pitwall.telemetry.application.parity;

import io.pitwall.telemetry.validation.Numbers;

/**
 * Tunables for the frame parity tracker.
 *
 * @param identityWindowCapacity number of recent frame ids kept per session for duplicate detection
 * @param outOfOrderToleranceMillis how far behind the last-seen timestamp a frame may be before it is
 *     counted as out of order
 * @param errorMaxChars maximum retained length of the last error message
 * @since PITWALL 0.1.0
 */
public record ParitySettings(int identityWindowCapacity, long outOfOrderToleranceMillis, int errorMaxChars) {
  public static final int DEFAULT_IDENTITY_WINDOW = 1_000;
  public static final long DEFAULT_OUT_OF_ORDER_TOLERANCE_MILLIS = 1_000L;
  public static final int DEFAULT_ERROR_MAX_CHARS = 200;

  public ParitySettings {
    Numbers.requireRange("identityWindowCapacity", identityWindowCapacity, 1, 1_000_000);
    Numbers.requireRange("outOfOrderToleranceMillis", outOfOrderToleranceMillis, 0, 3_600_000);
    Numbers.requireRange("errorMaxChars", errorMaxChars, 1, 10_000);
  }

  /**
   * Returns the stock settings: 1000 ids, 1000ms tolerance, 200 characters.
   *
   * @return default settings
   */
  public static ParitySettings defaults() {
    return new ParitySettings(
        DEFAULT_IDENTITY_WINDOW, DEFAULT_OUT_OF_ORDER_TOLERANCE_MILLIS, DEFAULT_ERROR_MAX_CHARS);
  }
}
