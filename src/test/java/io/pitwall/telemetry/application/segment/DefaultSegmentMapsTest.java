package io.pitwall.telemetry.application.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.domain.track.SegmentType;
import io.pitwall.telemetry.domain.track.TrackSegment;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import org.junit.jupiter.api.Test;

class DefaultSegmentMapsTest {

  @Test
  void buildsTenEqualSegmentsCoveringTheLap() {
    TrackSegmentMap map = DefaultSegmentMaps.equalSegments("t", "Track", 5_000d);

    assertEquals(10, map.segments().size());
    for (TrackSegment segment : map.segments()) {
      assertEquals(500d, segment.lengthMeters(), 1e-9);
    }
    for (double p = 0d; p < 1d; p += 0.01d) {
      assertTrue(map.findSegment(p).isPresent(), "position " + p);
    }
  }

  @Test
  void lastSegmentWrapsToStartLine() {
    TrackSegmentMap map = DefaultSegmentMaps.equalSegments("t", "Track", 5_000d);
    TrackSegment last = map.segments().get(9);

    assertTrue(last.wraps());
    assertEquals("seg_9", map.findSegment(0.95).orElseThrow().segmentId());
  }

  @Test
  void firstSegmentIsTheSpeedTrapAndTypesRotate() {
    TrackSegmentMap map = DefaultSegmentMaps.equalSegments("t", "Track", 3_000d, 6);

    assertTrue(map.segments().get(0).speedTrap());
    assertFalse(map.segments().get(1).speedTrap());
    assertEquals(SegmentType.STRAIGHT, map.segments().get(0).segmentType());
    assertEquals(SegmentType.CORNER, map.segments().get(1).segmentType());
    assertEquals(SegmentType.STRAIGHT, map.segments().get(3).segmentType());
  }

  @Test
  void rejectsNonPositiveSegmentCount() {
    assertThrows(IllegalArgumentException.class,
        () -> DefaultSegmentMaps.equalSegments("t", "Track", 3_000d, 0));
  }
}
