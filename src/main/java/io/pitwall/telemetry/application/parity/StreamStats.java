package io.pitwall.telemetry.application.parity;

/**
 * Counters for one sub-stream.
 *
 * @param framesIn frames received; never decreases
 * @param acked acknowledgments sent; counted independently of {@code framesIn}
 * @param lastFrameTs last-seen frame timestamp in epoch milliseconds, {@code 0} before any timestamp
 * @since PITWALL 0.1.0
 */
public record StreamStats(long framesIn, long acked, long lastFrameTs) {}
