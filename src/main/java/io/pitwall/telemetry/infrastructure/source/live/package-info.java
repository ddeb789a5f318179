/**
 * Push source forwarding whatever a {@code LiveTransport} delivers.
 */
package io.pitwall.telemetry.infrastructure.source.live;
