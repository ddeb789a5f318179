package io.pitwall.telemetry.application.parity;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable parity bookkeeping for one session.
 *
 * <p>Mutators are package-private so only {@link FrameParityTracker} changes state; readers get copies
 * through {@link #snapshot(long)}.</p>
 *
 * <p><strong>Thread-safety:</strong> All access synchronizes on the record, so one session never
 * blocks another.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class ParityRecord {
  private final String sessionId;
  private final FrameIdentityWindow identityWindow;
  private final Map<String, MutableStream> streams = new HashMap<>();
  private long duplicates;
  private long outOfOrder;
  private String lastError;

  ParityRecord(String sessionId, int identityWindowCapacity) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.identityWindow = new FrameIdentityWindow(identityWindowCapacity);
  }

  public String sessionId() {
    return sessionId;
  }

  synchronized FrameClassification recordFrameIn(
      String subStream, Long timestampMillis, String frameId, long toleranceMillis) {
    MutableStream stream = streams.computeIfAbsent(subStream, key -> new MutableStream());
    stream.framesIn++;

    boolean duplicate = false;
    boolean shouldAck = false;
    if (frameId != null) {
      if (identityWindow.seenOrRecord(frameId)) {
        duplicates++;
        duplicate = true;
      } else {
        shouldAck = true;
      }
    }

    boolean late = false;
    if (timestampMillis != null) {
      long ts = timestampMillis;
      if (ts < stream.lastFrameTs - toleranceMillis) {
        outOfOrder++;
        late = true;
      } else {
        stream.lastFrameTs = ts;
      }
    }
    return new FrameClassification(duplicate, late, shouldAck);
  }

  synchronized void recordAckSent(String subStream) {
    streams.computeIfAbsent(subStream, key -> new MutableStream()).acked++;
  }

  synchronized void recordError(String truncatedMessage) {
    lastError = truncatedMessage;
  }

  /**
   * Copies the current counters.
   *
   * @param capturedAtMillis timestamp stamped on the copy
   * @return immutable snapshot
   */
  public synchronized ParitySnapshot snapshot(long capturedAtMillis) {
    Map<String, StreamStats> copy = new HashMap<>();
    for (Map.Entry<String, MutableStream> entry : streams.entrySet()) {
      MutableStream s = entry.getValue();
      copy.put(entry.getKey(), new StreamStats(s.framesIn, s.acked, s.lastFrameTs));
    }
    return new ParitySnapshot(sessionId, copy, duplicates, outOfOrder, lastError, capturedAtMillis);
  }

  synchronized int identityWindowSize() {
    return identityWindow.size();
  }

  private static final class MutableStream {
    private long framesIn;
    private long acked;
    private long lastFrameTs;
  }
}
