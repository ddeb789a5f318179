/**
 * Frame parity bookkeeping: counts, acknowledgments, duplicate and ordering checks per session.
 * <p><strong>Concurrency:</strong> Session index is concurrent; each session record is self-locking.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code parity.*}.</p>
 * <p><strong>Security:</strong> Snapshots expose counters only, never payload content.</p>
 */
package io.pitwall.telemetry.application.parity;
