package io.pitwall.telemetry.application.pipeline;

import io.pitwall.telemetry.application.parity.FrameClassification;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of ingesting one sample.
 *
 * @param classification parity classification used for the acknowledgment decision
 * @param segmentResult traversal completed by the sample, if any
 * @since PITWALL 0.1.0
 */
public record IngestOutcome(FrameClassification classification, Optional<SegmentSpeedResult> segmentResult) {
  public IngestOutcome {
    classification = Objects.requireNonNull(classification, "classification");
    segmentResult = Objects.requireNonNull(segmentResult, "segmentResult");
  }
}
