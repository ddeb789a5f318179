package io.pitwall.telemetry.domain.confidence;

/**
 * Provenance tag attached to every derived numeric output.
 *
 * @since PITWALL 0.1.0
 */
public enum DataSource {
  /** Computed directly from observed positions and timestamps. */
  DERIVED,
  /** Estimated by a model over several derived values (for example a regression slope). */
  INFERRED,
  /** No opinion could be formed. */
  UNKNOWN,
  /** A number was computed but failed a physical sanity check. */
  INVALID
}
