package io.pitwall.telemetry.domain.telemetry;

import java.util.List;
import java.util.Objects;

/**
 * Coarse leaderboard view of a session at one instant.
 *
 * <p><strong>Thread-safety:</strong> Immutable; entries are defensively copied.</p>
 *
 * @param sessionId owning session
 * @param entries leaderboard rows in position order
 * @param sessionState textual session state such as {@code racing} or {@code finished}
 * @param sessionTimeElapsed elapsed session time in seconds
 * @param sessionTimeRemaining remaining session time in seconds
 * @param lapsRemaining laps remaining, or {@code -1} for timed sessions
 * @param leaderId driver id of the leader; may be {@code null}
 * @param fastestLap fastest lap so far; may be {@code null}
 * @param timestampMillis snapshot time in epoch milliseconds
 * @since PITWALL 0.1.0
 */
public record TimingSnapshot(
    String sessionId,
    List<TimingEntry> entries,
    String sessionState,
    double sessionTimeElapsed,
    double sessionTimeRemaining,
    int lapsRemaining,
    String leaderId,
    FastestLap fastestLap,
    long timestampMillis) implements SessionScoped {

  public TimingSnapshot {
    sessionId = Objects.requireNonNull(sessionId, "sessionId");
    entries = entries == null ? List.of() : List.copyOf(entries);
    sessionState = sessionState == null ? "unknown" : sessionState;
  }
}
