package io.pitwall.telemetry.application.parity;

/**
 * Verdict for one arriving frame.
 *
 * @param isDuplicate frame id was already inside the identity window
 * @param isOutOfOrder timestamp lagged the sub-stream's last-seen timestamp beyond tolerance
 * @param shouldAck a novel frame id was recorded and the caller may echo an acknowledgment
 * @since PITWALL 0.1.0
 */
public record FrameClassification(boolean isDuplicate, boolean isOutOfOrder, boolean shouldAck) {
  /**
   * Indicates whether the frame should be fed to order-sensitive consumers.
   *
   * @return {@code true} when neither duplicate nor out of order
   */
  public boolean isNovelInOrder() {
    return !isDuplicate && !isOutOfOrder;
  }
}
