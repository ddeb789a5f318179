/**
 * Derived pace outputs: segment results, pace updates, trends and track configuration events.
 */
package io.pitwall.telemetry.domain.pace;
