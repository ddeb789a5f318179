package io.pitwall.telemetry.domain.pace;

import java.util.Locale;

/**
 * Heuristic cause attached to a pace trend.
 *
 * @since PITWALL 0.1.0
 */
public enum DegradationType {
  TIRE,
  FUEL_BURN,
  DAMAGE,
  UNKNOWN;

  /**
   * Returns the lowercase wire name, for example {@code fuel_burn}.
   *
   * @return wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
