/**
 * Event distribution and subscriber entitlement: the in-process bus, the role-based admission gate and
 * per-subscription rate limiting.
 * <p><strong>Metrics:</strong> Publishes under {@code events.*} and {@code gate.*}.</p>
 */
package io.pitwall.telemetry.application.events;
