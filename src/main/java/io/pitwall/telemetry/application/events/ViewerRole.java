package io.pitwall.telemetry.application.events;

import java.util.Locale;

/**
 * Audience class of a subscriber; decides the maximum update rate it may receive.
 *
 * @since PITWALL 0.1.0
 */
public enum ViewerRole {
  DRIVER,
  TEAM,
  LEAGUE,
  BROADCAST,
  ANONYMOUS;

  /**
   * Parses a role name, case-insensitively.
   *
   * @param value role name such as {@code "team"}
   * @return matching role
   * @throws IllegalArgumentException when the name is blank or unknown
   */
  public static ViewerRole fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("role must not be blank");
    }
    try {
      return ViewerRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown role: " + value, ex);
    }
  }
}
