package io.pitwall.telemetry.domain.telemetry;

/**
 * Session fastest lap.
 *
 * @param driverId driver holding the fastest lap
 * @param time lap time in seconds
 * @param lap lap index on which it was set
 * @since PITWALL 0.1.0
 */
public record FastestLap(String driverId, double time, int lap) {}
