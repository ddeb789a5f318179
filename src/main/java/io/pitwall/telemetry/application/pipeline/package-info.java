/**
 * Runtime orchestration: session registry, source attachment, ingestion routing and gated subscription.
 * <p><strong>Concurrency:</strong> Collaborators are thread-safe; sources may deliver from their own
 * threads.</p>
 */
package io.pitwall.telemetry.application.pipeline;
