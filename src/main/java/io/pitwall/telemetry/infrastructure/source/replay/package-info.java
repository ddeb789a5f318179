/**
 * Virtual-clock playback of a stored window with bounded, chunked prefetch.
 *
 * <p>Virtual timestamps depend only on the window start, the playback rate and the tick count.</p>
 */
package io.pitwall.telemetry.infrastructure.source.replay;
