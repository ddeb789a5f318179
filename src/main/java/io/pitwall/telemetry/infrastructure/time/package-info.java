/**
 * Wall-clock scheduling adapters.
 */
package io.pitwall.telemetry.infrastructure.time;
