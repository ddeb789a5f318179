package io.pitwall.telemetry.api;

import io.pitwall.telemetry.application.segment.DefaultSegmentMaps;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.infrastructure.track.TrackMapLoader;
import io.pitwall.telemetry.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code trackmap} command: prints a generated or file-based track map as JSON.
 *
 * @since PITWALL 0.1.0
 */
public final class TrackMapCli {
  private static final Logger log = LoggerFactory.getLogger(TrackMapCli.class);
  private static final String SUMMARY_USAGE =
      "usage: trackmap [trackId=ID] [trackName=NAME] [trackLengthMeters=M] [segments=N] | trackmap trackMap=PATH";
  private static final String HELP_TEXT = """
      PITWALL trackmap

      Usage:
        trackmap trackId=ID trackName=NAME trackLengthMeters=M [segments=N]
        trackmap trackMap=PATH

      Generates an equal-length map (default 10 segments) or validates a YAML map,
      then prints it as JSON.
      """;

  private TrackMapCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    TrackSegmentMap map;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String file = kv.get("trackMap");
      if (file != null && !file.isBlank()) {
        map = TrackMapLoader.load(Path.of(file));
      } else {
        map = DefaultSegmentMaps.equalSegments(
            kv.getOrDefault("trackId", "default"),
            kv.getOrDefault("trackName", "Default Circuit"),
            parseDouble("trackLengthMeters", kv.getOrDefault("trackLengthMeters", "5000")),
            parseInt("segments", kv.getOrDefault("segments",
                Integer.toString(DefaultSegmentMaps.DEFAULT_SEGMENT_COUNT))));
      }
    } catch (IOException ex) {
      log.error("Unable to read track map: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid track map: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliPrinter.println(new TelemetryJsonCodec().encodeTrackMap(map));
    return ExitCode.SUCCESS;
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was " + value + ")", ex);
    }
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }
}
