/**
 * Confidence-tagged values and the quality/provenance vocabulary shared by every derived output.
 * <p><strong>Concurrency:</strong> Immutable value types.</p>
 */
package io.pitwall.telemetry.domain.confidence;
