/**
 * Telemetry shapes shared by every source adapter: timing snapshots, thin frames and ingestion samples.
 * <p><strong>Concurrency:</strong> Immutable records; safe to fan out to many listeners.</p>
 * <p><strong>Security:</strong> Carry no credentials or viewer identity.</p>
 */
package io.pitwall.telemetry.domain.telemetry;
