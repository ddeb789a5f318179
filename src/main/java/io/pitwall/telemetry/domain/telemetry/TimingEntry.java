package io.pitwall.telemetry.domain.telemetry;

import java.util.Objects;

/**
 * Leaderboard row for one car inside a {@link TimingSnapshot}.
 *
 * @param driverId stable driver identifier
 * @param driverName display name
 * @param carNumber car number as painted
 * @param teamName team name; may be {@code null}
 * @param position running position, 1-based
 * @param lapNumber current lap
 * @param lapDistPct fractional lap progress in {@code [0, 1)}
 * @param lastLapTime last lap time in seconds
 * @param bestLapTime best lap time in seconds
 * @param gapToLeader gap to the leader in seconds
 * @param gapAhead gap to the car ahead in seconds; may be {@code null}
 * @param speed current speed in m/s; may be {@code null}
 * @param sector current sector index; may be {@code null}
 * @param inPit whether the car is in the pit lane
 * @param retired whether the car has retired
 * @since PITWALL 0.1.0
 */
public record TimingEntry(
    String driverId,
    String driverName,
    String carNumber,
    String teamName,
    int position,
    int lapNumber,
    double lapDistPct,
    double lastLapTime,
    double bestLapTime,
    double gapToLeader,
    Double gapAhead,
    Double speed,
    Integer sector,
    boolean inPit,
    boolean retired) {

  public TimingEntry {
    driverId = Objects.requireNonNull(driverId, "driverId");
    driverName = driverName == null ? driverId : driverName;
    carNumber = carNumber == null ? "" : carNumber;
  }
}
