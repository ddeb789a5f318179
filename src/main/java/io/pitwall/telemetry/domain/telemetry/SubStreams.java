package io.pitwall.telemetry.domain.telemetry;

/**
 * Conventional sub-stream names carried within one session.
 *
 * <p>The set is open; these are the names the bundled adapters use.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class SubStreams {
  /** Leaderboard style timing snapshots. */
  public static final String COARSE_STATE = "coarse-state";
  /** Driver control inputs. */
  public static final String CONTROL_INPUT = "control-input";
  /** Per-car motion frames. */
  public static final String HIGH_FIDELITY = "high-fidelity";
  /** Legacy discrete events. */
  public static final String LEGACY_EVENT = "legacy-event";

  private SubStreams() {}
}
