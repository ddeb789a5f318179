package io.pitwall.telemetry.application.events;

import io.pitwall.telemetry.validation.Numbers;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maximum delivery rate per {@link ViewerRole}. A role without an entry, or with {@code 0}, is not
 * entitled to any stream.
 *
 * @param maxRateHz per-role ceilings in updates per second
 * @since PITWALL 0.1.0
 */
public record GatePolicy(Map<ViewerRole, Integer> maxRateHz) {
  /** Upper bound accepted for any role. */
  public static final int MAX_RATE_HZ = 60;

  public GatePolicy {
    Objects.requireNonNull(maxRateHz, "maxRateHz");
    EnumMap<ViewerRole, Integer> copy = new EnumMap<>(ViewerRole.class);
    maxRateHz.forEach((role, hz) -> {
      Objects.requireNonNull(role, "role");
      Objects.requireNonNull(hz, "maxRateHz." + role);
      Numbers.requireRange("maxRateHz." + role.name().toLowerCase(Locale.ROOT), hz, 0, MAX_RATE_HZ);
      copy.put(role, hz);
    });
    maxRateHz = Map.copyOf(copy);
  }

  /**
   * Stock policy: drivers and teams 10 Hz, broadcast 5 Hz, leagues 2 Hz, anonymous viewers nothing.
   *
   * @return default policy
   */
  public static GatePolicy defaults() {
    return new GatePolicy(Map.of(
        ViewerRole.DRIVER, 10,
        ViewerRole.TEAM, 10,
        ViewerRole.LEAGUE, 2,
        ViewerRole.BROADCAST, 5,
        ViewerRole.ANONYMOUS, 0));
  }

  /**
   * Returns the ceiling for a role.
   *
   * @param role viewer role
   * @return maximum rate in Hz; {@code 0} when the role is not entitled
   */
  public int maxRateHz(ViewerRole role) {
    Integer hz = maxRateHz.get(role);
    return hz == null ? 0 : hz;
  }

  /**
   * Returns a copy with one role's ceiling replaced.
   *
   * @param role role to change
   * @param hz new ceiling
   * @return updated policy
   */
  public GatePolicy with(ViewerRole role, int hz) {
    EnumMap<ViewerRole, Integer> copy = new EnumMap<>(ViewerRole.class);
    copy.putAll(maxRateHz);
    copy.put(role, hz);
    return new GatePolicy(copy);
  }
}
