package io.pitwall.telemetry.domain.confidence;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Derived number paired with a confidence score, provenance and quality tag.
 * <p><strong>Why:</strong> No ground-truth speed signal exists, so a value never travels without the
 * tags that let a consumer tell "no opinion" apart from "a bad opinion".</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param value derived value; empty when no number could be produced
 * @param confidence score in {@code [0, 1]}; always {@code 0} when {@code value} is empty
 * @param source provenance of the value
 * @param quality quality classification of the underlying observation
 * @param timestampMillis epoch milliseconds at which the value was produced
 * @since PITWALL 0.1.0
 */
public record ConfidenceValue(
    OptionalDouble value,
    double confidence,
    DataSource source,
    SegmentQuality quality,
    long timestampMillis) {

  /**
   * Enforces the confidence contract.
   *
   * @throws IllegalArgumentException if confidence is outside {@code [0, 1]} or an empty value carries
   *     a non-zero confidence
   */
  public ConfidenceValue {
    value = Objects.requireNonNull(value, "value");
    source = Objects.requireNonNull(source, "source");
    quality = Objects.requireNonNull(quality, "quality");
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("confidence must be within [0,1] (was " + confidence + ')');
    }
    if (value.isEmpty() && confidence != 0d) {
      throw new IllegalArgumentException("confidence must be 0 when value is undefined");
    }
    if (value.isPresent() && !Double.isFinite(value.getAsDouble())) {
      throw new IllegalArgumentException("value must be finite (was " + value.getAsDouble() + ')');
    }
  }

  /**
   * Creates a defined value.
   *
   * @param value derived number; must be finite
   * @param confidence score in {@code [0, 1]}
   * @param source provenance tag
   * @param quality quality tag
   * @param timestampMillis production time
   * @return tagged value
   */
  public static ConfidenceValue of(
      double value, double confidence, DataSource source, SegmentQuality quality, long timestampMillis) {
    return new ConfidenceValue(OptionalDouble.of(value), confidence, source, quality, timestampMillis);
  }

  /**
   * Creates an undefined value tagged {@link DataSource#UNKNOWN}.
   *
   * @param quality quality tag explaining why no value exists
   * @param timestampMillis production time
   * @return undefined value with confidence {@code 0}
   */
  public static ConfidenceValue unknown(SegmentQuality quality, long timestampMillis) {
    return new ConfidenceValue(OptionalDouble.empty(), 0d, DataSource.UNKNOWN, quality, timestampMillis);
  }

  /**
   * Creates an undefined value tagged {@link DataSource#INVALID}.
   *
   * @param timestampMillis production time
   * @return undefined value with confidence {@code 0} and quality {@link SegmentQuality#INVALID}
   */
  public static ConfidenceValue invalid(long timestampMillis) {
    return new ConfidenceValue(
        OptionalDouble.empty(), 0d, DataSource.INVALID, SegmentQuality.INVALID, timestampMillis);
  }

  /**
   * Indicates whether a number is present.
   *
   * @return {@code true} when {@link #value()} holds a number
   */
  public boolean isDefined() {
    return value.isPresent();
  }

  /**
   * Returns a copy whose value is scaled by {@code factor}; undefined values stay undefined.
   *
   * @param factor multiplier such as {@code 3.6} for m/s to km/h
   * @return scaled value carrying the same tags
   */
  public ConfidenceValue scaled(double factor) {
    if (value.isEmpty()) {
      return this;
    }
    return new ConfidenceValue(
        OptionalDouble.of(value.getAsDouble() * factor), confidence, source, quality, timestampMillis);
  }
}
