package io.pitwall.telemetry.domain.track;

import java.util.Locale;

/**
 * Physical character of a track segment.
 *
 * @since PITWALL 0.1.0
 */
public enum SegmentType {
  STRAIGHT,
  CORNER,
  COMPLEX,
  PIT_ENTRY,
  PIT_EXIT,
  START_FINISH;

  /**
   * Indicates whether the segment contributes to straight-line pace.
   *
   * @return {@code true} for {@link #STRAIGHT} and {@link #START_FINISH}
   */
  public boolean isStraight() {
    return this == STRAIGHT || this == START_FINISH;
  }

  /**
   * Indicates whether the segment contributes to cornering pace. Pit entry and exit count toward neither.
   *
   * @return {@code true} for {@link #CORNER} and {@link #COMPLEX}
   */
  public boolean isCornering() {
    return this == CORNER || this == COMPLEX;
  }

  /**
   * Parses a segment type using case-insensitive names; hyphens and underscores are interchangeable.
   *
   * @param value textual type such as {@code "corner"} or {@code "pit-entry"}
   * @return parsed type
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static SegmentType fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("segmentType must not be blank");
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return SegmentType.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown segmentType: " + value, ex);
    }
  }
}
