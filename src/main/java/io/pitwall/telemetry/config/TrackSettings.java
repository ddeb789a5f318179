package io.pitwall.telemetry.config;

import io.pitwall.telemetry.validation.Numbers;
import io.pitwall.telemetry.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Track selection: either a YAML map file or a generated equal-length map.
 *
 * @param trackId identifier used for generated maps
 * @param trackName display name used for generated maps
 * @param trackLengthMeters lap length used for generated maps
 * @param mapFile optional YAML map; takes precedence over the generated map
 * @since PITWALL 0.1.0
 */
public record TrackSettings(String trackId, String trackName, double trackLengthMeters, Optional<Path> mapFile) {
  public TrackSettings {
    trackId = Strings.requireNonBlank("trackId", trackId);
    trackName = trackName == null || trackName.isBlank() ? trackId : trackName.trim();
    Numbers.requireRange("trackLengthMeters", trackLengthMeters, 100d, 100_000d);
    mapFile = Objects.requireNonNull(mapFile, "mapFile");
  }

  /**
   * Reads {@code trackId}, {@code trackName}, {@code trackLengthMeters} and {@code trackMap}.
   *
   * @param values flat configuration
   * @return track settings
   */
  public static TrackSettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    return new TrackSettings(
        ConfigValues.string(values, "trackId", "default"),
        ConfigValues.string(values, "trackName", null),
        ConfigValues.doubleValue(values, "trackLengthMeters", 5_000d),
        ConfigValues.optionalString(values, "trackMap").map(Path::of));
  }
}
