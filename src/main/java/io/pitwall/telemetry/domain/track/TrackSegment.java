package io.pitwall.telemetry.domain.track;

import java.util.Objects;

/**
 * One fixed arc of track used as a virtual speed trap.
 *
 * <p>The interval {@code [startPct, endPct)} lives on the cyclic lap coordinate and may wrap past the
 * start/finish line, in which case {@code startPct > endPct}.</p>
 *
 * @param segmentId identifier unique within its map
 * @param label human-readable label
 * @param startPct inclusive start position in {@code [0, 1)}
 * @param endPct exclusive end position in {@code [0, 1)}
 * @param lengthMeters physical length; must be positive
 * @param segmentType physical character of the segment
 * @param speedTrap whether the segment is flagged as a speed trap
 * @since PITWALL 0.1.0
 */
public record TrackSegment(
    String segmentId,
    String label,
    double startPct,
    double endPct,
    double lengthMeters,
    SegmentType segmentType,
    boolean speedTrap) {

  /**
   * Validates bounds and identifiers.
   *
   * @throws IllegalArgumentException when positions leave {@code [0, 1)} or the length is not positive
   */
  public TrackSegment {
    Objects.requireNonNull(segmentId, "segmentId");
    if (segmentId.isBlank()) {
      throw new IllegalArgumentException("segmentId must not be blank");
    }
    label = label == null || label.isBlank() ? segmentId : label;
    requireCyclic("startPct", startPct);
    requireCyclic("endPct", endPct);
    if (!(lengthMeters > 0d) || Double.isInfinite(lengthMeters)) {
      throw new IllegalArgumentException(
          "lengthMeters must be positive for segment " + segmentId + " (was " + lengthMeters + ')');
    }
    segmentType = Objects.requireNonNull(segmentType, "segmentType");
  }

  /**
   * Tests wrap-aware membership of a cyclic position.
   *
   * @param position cyclic position in {@code [0, 1)}
   * @return {@code true} when the position falls inside this segment
   */
  public boolean contains(double position) {
    if (startPct <= endPct) {
      return position >= startPct && position < endPct;
    }
    return position >= startPct || position < endPct;
  }

  /**
   * Indicates whether the interval crosses the start/finish line.
   *
   * @return {@code true} when {@code startPct > endPct}
   */
  public boolean wraps() {
    return startPct > endPct;
  }

  private static void requireCyclic(String name, double value) {
    if (Double.isNaN(value) || value < 0d || value >= 1d) {
      throw new IllegalArgumentException(name + " must be within [0,1) (was " + value + ')');
    }
  }
}
