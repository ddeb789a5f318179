package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.domain.track.SegmentType;
import io.pitwall.telemetry.domain.track.TrackSegment;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback generator for tracks without a curated segment map.
 *
 * @since PITWALL 0.1.0
 */
public final class DefaultSegmentMaps {
  /** Segment count used when none is requested. */
  public static final int DEFAULT_SEGMENT_COUNT = 10;

  private DefaultSegmentMaps() {}

  /**
   * Builds a ten-segment equal map.
   *
   * @param trackId track identifier
   * @param trackName display name
   * @param trackLengthMeters lap length; must be positive
   * @return generated map
   */
  public static TrackSegmentMap equalSegments(String trackId, String trackName, double trackLengthMeters) {
    return equalSegments(trackId, trackName, trackLengthMeters, DEFAULT_SEGMENT_COUNT);
  }

  /**
   * Builds an equally spaced map. Every third segment starting at zero is a straight, the rest are
   * corners, and the first segment is the speed trap.
   *
   * @param trackId track identifier
   * @param trackName display name
   * @param trackLengthMeters lap length; must be positive
   * @param segmentCount number of segments; must be positive
   * @return generated map
   */
  public static TrackSegmentMap equalSegments(
      String trackId, String trackName, double trackLengthMeters, int segmentCount) {
    if (segmentCount <= 0) {
      throw new IllegalArgumentException("segmentCount must be positive");
    }
    double segmentLength = trackLengthMeters / segmentCount;
    List<TrackSegment> segments = new ArrayList<>(segmentCount);
    for (int i = 0; i < segmentCount; i++) {
      double start = (double) i / segmentCount;
      double end = i == segmentCount - 1 ? 0d : (double) (i + 1) / segmentCount;
      segments.add(new TrackSegment(
          "seg_" + i,
          "Segment " + (i + 1),
          start,
          end,
          segmentLength,
          i % 3 == 0 ? SegmentType.STRAIGHT : SegmentType.CORNER,
          i == 0));
    }
    return new TrackSegmentMap(trackId, trackName, "default", trackLengthMeters, "1.0.0", segments);
  }
}
