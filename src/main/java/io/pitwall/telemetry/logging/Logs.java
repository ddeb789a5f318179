package io.pitwall.telemetry.logging;

/**
 * Log hygiene helpers for values that arrive from relays and history files.
 *
 * @since PITWALL 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Bounds a string to {@code maxChars} characters, noting the original length when shortened.
   *
   * @param value string to bound; {@code null} yields {@code "<null>"}
   * @param maxChars maximum characters retained; must be positive
   * @return the value, or its prefix followed by {@code "... (truncated, max of len)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }
}
