package io.pitwall.telemetry.infrastructure.track;

import io.pitwall.telemetry.domain.track.SegmentType;
import io.pitwall.telemetry.domain.track.TrackSegment;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads a {@link TrackSegmentMap} from a YAML document.
 * <p><strong>Why:</strong> Track maps are authored by hand per circuit and layout; YAML keeps them reviewable.</p>
 * <p><strong>Role:</strong> Configuration-time adapter; every map it returns has passed domain validation.</p>
 * <p>Expected document:</p>
 * <pre>{@code
 * trackId: spa
 * trackName: Spa-Francorchamps
 * layoutName: grand-prix
 * trackLengthMeters: 7004
 * version: 2.1.0
 * segments:
 *   - segmentId: la_source
 *     label: La Source
 *     startPct: 0.0
 *     endPct: 0.04
 *     lengthMeters: 280
 *     segmentType: corner
 *     isSpeedTrap: false
 * }</pre>
 *
 * @since PITWALL 0.1.0
 */
public final class TrackMapLoader {
  private static final Logger log = LoggerFactory.getLogger(TrackMapLoader.class);

  private TrackMapLoader() {}

  /**
   * Loads a map from a file.
   *
   * @param path YAML file
   * @return validated map
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or the map is invalid
   */
  public static TrackSegmentMap load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      TrackSegmentMap map = parse(reader, path.toString());
      log.info("Loaded track map {} ({} segments) from {}", map.trackId(), map.segments().size(), path);
      return map;
    }
  }

  /**
   * Parses a map from a reader.
   *
   * @param reader YAML source
   * @param sourceName label used in error messages
   * @return validated map
   * @throws IllegalArgumentException when the document is malformed or the map is invalid
   */
  public static TrackSegmentMap parse(Reader reader, String sourceName) {
    Objects.requireNonNull(reader, "reader");
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse track map YAML at " + sourceName, ex);
    }
    Map<String, Object> root = asMap(document, "track map " + sourceName);
    Object rawSegments = root.get("segments");
    if (!(rawSegments instanceof List<?> list)) {
      throw new IllegalArgumentException("segments must be a list in " + sourceName);
    }
    List<TrackSegment> segments = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      segments.add(toSegment(asMap(list.get(i), "segments[" + i + "]")));
    }
    return new TrackSegmentMap(
        requiredString(root, "trackId", sourceName),
        optionalString(root, "trackName"),
        optionalString(root, "layoutName"),
        requiredDouble(root, "trackLengthMeters", sourceName),
        optionalString(root, "version"),
        segments);
  }

  private static TrackSegment toSegment(Map<String, Object> node) {
    String id = requiredString(node, "segmentId", "segment");
    Object trap = node.get("isSpeedTrap");
    return new TrackSegment(
        id,
        optionalString(node, "label"),
        requiredDouble(node, "startPct", id),
        requiredDouble(node, "endPct", id),
        requiredDouble(node, "lengthMeters", id),
        SegmentType.fromString(requiredString(node, "segmentType", id)),
        trap != null && Boolean.parseBoolean(trap.toString().trim()));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String requiredString(Map<String, Object> node, String key, String context) {
    String value = optionalString(node, key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required in " + context);
    }
    return value;
  }

  private static String optionalString(Map<String, Object> node, String key) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }

  private static double requiredDouble(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value == null) {
      throw new IllegalArgumentException(key + " is required in " + context);
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric in " + context + " (was " + value + ")", ex);
    }
  }
}
