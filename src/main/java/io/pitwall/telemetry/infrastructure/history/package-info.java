/**
 * File-backed history for replay.
 */
package io.pitwall.telemetry.infrastructure.history;
