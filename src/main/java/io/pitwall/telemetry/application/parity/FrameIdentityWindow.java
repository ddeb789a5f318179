package io.pitwall.telemetry.application.parity;

import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * Bounded FIFO set of recently seen frame identifiers.
 *
 * <p>Membership is O(1); inserting past capacity evicts the oldest id first. Duplicates older than the
 * window are not detected.</p>
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe; guarded by the owning {@link ParityRecord}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class FrameIdentityWindow {
  private final int capacity;
  private final LinkedHashSet<String> ids = new LinkedHashSet<>();

  /**
   * Creates an empty window.
   *
   * @param capacity maximum number of retained ids; must be positive
   */
  public FrameIdentityWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  /**
   * Tests membership and records the id when absent.
   *
   * @param frameId id to record
   * @return {@code true} when the id was already inside the window
   */
  public boolean seenOrRecord(String frameId) {
    if (ids.contains(frameId)) {
      return true;
    }
    ids.add(frameId);
    if (ids.size() > capacity) {
      Iterator<String> oldest = ids.iterator();
      oldest.next();
      oldest.remove();
    }
    return false;
  }

  /**
   * Tests membership without recording.
   *
   * @param frameId id to test
   * @return {@code true} when retained
   */
  public boolean contains(String frameId) {
    return ids.contains(frameId);
  }

  public int size() {
    return ids.size();
  }

  public int capacity() {
    return capacity;
  }
}
