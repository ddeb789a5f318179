package io.pitwall.telemetry.domain.confidence;

/**
 * Quality classification applied to a completed segment traversal.
 *
 * <p>Consumers render "no data" or "low confidence" states directly from this tag.</p>
 *
 * @since PITWALL 0.1.0
 */
public enum SegmentQuality {
  /** Unobstructed racing lap segment. */
  CLEAN,
  /** Another vehicle overlapped the position window during the traversal. */
  TRAFFIC_AFFECTED,
  /** Vehicle was in the pit lane. */
  PIT,
  /** Vehicle left the racing surface. */
  OFFTRACK,
  /** Timing or derived speed was physically implausible. */
  INVALID,
  /** Quality could not be established. */
  UNKNOWN
}
