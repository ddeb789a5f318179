/**
 * Event bus listeners that log pace events or keep them in memory.
 */
package io.pitwall.telemetry.infrastructure.events;
