package io.pitwall.telemetry.application.parity;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable copy of one session's parity counters for diagnostics.
 *
 * <p>Holds only counters, never payload content.</p>
 *
 * @param sessionId session id
 * @param streams per sub-stream counters, sorted by name
 * @param duplicates duplicate frames across all sub-streams
 * @param outOfOrder out-of-order frames across all sub-streams
 * @param lastError most recent truncated error; may be {@code null}
 * @param capturedAtMillis time the snapshot was taken
 * @since PITWALL 0.1.0
 */
public record ParitySnapshot(
    String sessionId,
    Map<String, StreamStats> streams,
    long duplicates,
    long outOfOrder,
    String lastError,
    long capturedAtMillis) {

  public ParitySnapshot {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    streams = streams == null
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(streams));
  }

  /**
   * Returns counters for one sub-stream, zeroed when it has never been seen.
   *
   * @param subStream sub-stream name
   * @return counters
   */
  public StreamStats stream(String subStream) {
    return streams.getOrDefault(subStream, new StreamStats(0, 0, 0));
  }
}
