package io.pitwall.telemetry.domain.track;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable segment layout for one track configuration.
 * <p><strong>Why:</strong> Shared read-only by every vehicle in a session so segment transits can be
 * timed without a direct speed signal.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the segment list is defensively copied.</p>
 *
 * @param trackId track identifier
 * @param trackName display name
 * @param layoutName layout or configuration name
 * @param trackLengthMeters total lap length in meters
 * @param version map revision label
 * @param segments ordered segments; must not be empty and ids must be unique
 * @since PITWALL 0.1.0
 */
public record TrackSegmentMap(
    String trackId,
    String trackName,
    String layoutName,
    double trackLengthMeters,
    String version,
    List<TrackSegment> segments) {

  /**
   * Validates the map at configuration time.
   *
   * @throws IllegalArgumentException when identifiers are blank, the length is not positive, no
   *     segments exist, or two segments share an id
   */
  public TrackSegmentMap {
    Objects.requireNonNull(trackId, "trackId");
    if (trackId.isBlank()) {
      throw new IllegalArgumentException("trackId must not be blank");
    }
    trackName = trackName == null || trackName.isBlank() ? trackId : trackName;
    layoutName = layoutName == null || layoutName.isBlank() ? "default" : layoutName;
    version = version == null || version.isBlank() ? "1.0.0" : version;
    if (!(trackLengthMeters > 0d) || Double.isInfinite(trackLengthMeters)) {
      throw new IllegalArgumentException(
          "trackLengthMeters must be positive (was " + trackLengthMeters + ')');
    }
    segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("track " + trackId + " must define at least one segment");
    }
    Set<String> ids = new HashSet<>();
    for (TrackSegment segment : segments) {
      if (!ids.add(segment.segmentId())) {
        throw new IllegalArgumentException("duplicate segmentId " + segment.segmentId());
      }
    }
  }

  /**
   * Locates the first segment containing the cyclic position.
   *
   * @param position cyclic position
   * @return containing segment, or empty when the map has a gap at this position
   */
  public Optional<TrackSegment> findSegment(double position) {
    for (TrackSegment segment : segments) {
      if (segment.contains(position)) {
        return Optional.of(segment);
      }
    }
    return Optional.empty();
  }

  /**
   * Looks up a segment by id.
   *
   * @param segmentId identifier to search for
   * @return matching segment, if any
   */
  public Optional<TrackSegment> segment(String segmentId) {
    for (TrackSegment segment : segments) {
      if (segment.segmentId().equals(segmentId)) {
        return Optional.of(segment);
      }
    }
    return Optional.empty();
  }
}
