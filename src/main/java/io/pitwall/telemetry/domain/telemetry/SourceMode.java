package io.pitwall.telemetry.domain.telemetry;

import java.util.Locale;

/**
 * Origins a telemetry source can draw from.
 *
 * @since PITWALL 0.1.0
 */
public enum SourceMode {
  /** Push subscription against a live transport. */
  LIVE,
  /** Playback of a stored time window. */
  REPLAY,
  /** Seeded synthetic simulation. */
  DEMO;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param value textual mode such as {@code "replay"}
   * @return parsed mode
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static SourceMode fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("mode must be one of live|replay|demo");
    }
    try {
      return SourceMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown mode: " + value + " (expected live|replay|demo)", ex);
    }
  }

  /**
   * Returns the lowercase name used for configuration sections.
   *
   * @return lowercase mode name
   */
  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
