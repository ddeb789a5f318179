package io.pitwall.telemetry.application.segment;

import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Mutable per-vehicle traversal state. Guarded by its own monitor; callers in this package lock the
 * instance around every read-modify-write sequence.
 */
final class VehicleSegmentState {
  private final String vehicleId;
  private final int historyCapacity;
  private final Deque<SegmentSpeedResult> history;

  double lastPosition;
  int lastLap;
  long lastTimestampMillis;

  String currentSegmentId;
  long segmentEntryMillis;

  boolean inPitLane;
  boolean onRacingSurface = true;
  boolean trafficOverlap;

  VehicleSegmentState(String vehicleId, double position, int lap, long timestampMillis, int historyCapacity) {
    this.vehicleId = vehicleId;
    this.historyCapacity = historyCapacity;
    this.history = new ArrayDeque<>(Math.min(historyCapacity, 128));
    this.lastPosition = position;
    this.lastLap = lap;
    this.lastTimestampMillis = timestampMillis;
  }

  String vehicleId() {
    return vehicleId;
  }

  void updatePosition(double position, int lap, long timestampMillis) {
    this.lastPosition = position;
    this.lastLap = lap;
    this.lastTimestampMillis = timestampMillis;
  }

  void enterSegment(String segmentId, long timestampMillis) {
    this.currentSegmentId = segmentId;
    this.segmentEntryMillis = timestampMillis;
  }

  void append(SegmentSpeedResult result) {
    history.addLast(result);
    while (history.size() > historyCapacity) {
      history.removeFirst();
    }
  }

  List<SegmentSpeedResult> historySnapshot() {
    return List.copyOf(history);
  }

  int historySize() {
    return history.size();
  }
}
