/**
 * Ports at the seams of the telemetry core: sources, transports, history, publication, time and metrics.
 * <p><strong>Role:</strong> Interfaces consumed by application services and implemented by infrastructure.</p>
 * <p><strong>Concurrency:</strong> Each port documents its threading contract.</p>
 */
package io.pitwall.telemetry.application.port;
