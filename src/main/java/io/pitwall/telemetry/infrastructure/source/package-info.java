/**
 * <strong>Purpose:</strong> Telemetry source adapters behind the {@code TelemetrySource} port.
 * <p><strong>Pipeline role:</strong> Each adapter turns one origin (live relay, stored history, seeded
 * simulation) into the same timing snapshot and thin frame callbacks.</p>
 * <p><strong>Concurrency:</strong> Listener registries are copy-on-write; callbacks run on the adapter's
 * delivery thread.</p>
 * <p><strong>Observability:</strong> Listener failures are logged and counted as {@code source.listener.error}.</p>
 *
 * @since PITWALL 0.1.0
 */
package io.pitwall.telemetry.infrastructure.source;
