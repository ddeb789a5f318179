/**
 * OpenTelemetry-backed metrics adapters.
 * <p>Metric names follow the dotted keys emitted by application services, lower-cased.</p>
 */
package io.pitwall.telemetry.infrastructure.metrics;
