/**
 * Track geometry: segment layouts on the cyclic lap coordinate.
 * <p><strong>Concurrency:</strong> Immutable records shared read-only across vehicles.</p>
 */
package io.pitwall.telemetry.domain.track;
