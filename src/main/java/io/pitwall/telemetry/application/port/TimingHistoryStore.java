package io.pitwall.telemetry.application.port;

import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Read port onto stored session history.
 * <p><strong>Why:</strong> Feeds the replay source with bounded time windows.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from a background fetch thread.</p>
 * <p><strong>Performance:</strong> Calls block on I/O; callers bound the window they request.</p>
 *
 * @since PITWALL 0.1.0
 */
public interface TimingHistoryStore {
  /**
   * Fetches timing snapshots with {@code fromMillis <= timestamp < toMillis}.
   *
   * @param sessionId session to read
   * @param fromMillis inclusive window start
   * @param toMillis exclusive window end
   * @return snapshots ordered by timestamp
   * @throws IOException when the store cannot be read
   */
  List<TimingSnapshot> fetchTiming(String sessionId, long fromMillis, long toMillis) throws IOException;

  /**
   * Fetches thin frames with {@code fromMillis <= timestamp < toMillis}.
   *
   * @param sessionId session to read
   * @param fromMillis inclusive window start
   * @param toMillis exclusive window end
   * @return frames ordered by timestamp
   * @throws IOException when the store cannot be read
   */
  List<ThinFrame> fetchFrames(String sessionId, long fromMillis, long toMillis) throws IOException;
}
