package io.pitwall.telemetry.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.pitwall.telemetry.application.parity.ParitySnapshot;
import io.pitwall.telemetry.application.parity.StreamStats;
import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentPaceUpdate;
import io.pitwall.telemetry.domain.telemetry.FastestLap;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingEntry;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.domain.track.TrackSegment;
import io.pitwall.telemetry.domain.track.TrackSegmentMap;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> JSON wire format for timing snapshots, frames, pace events, track maps and
 * parity diagnostics.
 * <p><strong>Why:</strong> Live transports, the history store, the Kafka sink and the CLI share one
 * field vocabulary.</p>
 * <p><strong>Behavior:</strong> Decoding reads the document into an ordered map and then maps fields;
 * missing optional fields become {@code null}, a missing required field or a non-object document raises
 * {@link IllegalArgumentException}. Undefined confidence values are written with {@code "value": null}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class TelemetryJsonCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Decodes a timing snapshot.
   *
   * @param json JSON object
   * @return snapshot
   * @throws IllegalArgumentException when the document is malformed or lacks {@code sessionId}
   */
  public TimingSnapshot decodeTiming(String json) {
    Map<String, Object> root = parseObject(json);
    List<TimingEntry> entries = new ArrayList<>();
    for (Object raw : list(root, "entries")) {
      entries.add(decodeEntry(asObject(raw, "entries[]")));
    }
    FastestLap fastestLap = null;
    Object rawFastest = root.get("fastestLap");
    if (rawFastest != null) {
      Map<String, Object> fl = asObject(rawFastest, "fastestLap");
      fastestLap = new FastestLap(requiredString(fl, "driverId"), number(fl, "time", 0d), integer(fl, "lap", 0));
    }
    return new TimingSnapshot(
        requiredString(root, "sessionId"),
        entries,
        string(root, "sessionState"),
        number(root, "sessionTimeElapsed", 0d),
        number(root, "sessionTimeRemaining", 0d),
        integer(root, "lapsRemaining", 0),
        string(root, "leaderId"),
        fastestLap,
        timestamp(root));
  }

  private TimingEntry decodeEntry(Map<String, Object> entry) {
    Object sector = entry.get("sector");
    return new TimingEntry(
        requiredString(entry, "driverId"),
        string(entry, "driverName"),
        string(entry, "carNumber"),
        string(entry, "teamName"),
        integer(entry, "position", 0),
        integer(entry, "lapNumber", 0),
        number(entry, "lapDistPct", 0d),
        number(entry, "lastLapTime", 0d),
        number(entry, "bestLapTime", 0d),
        number(entry, "gapToLeader", 0d),
        optionalNumber(entry, "gapAhead"),
        optionalNumber(entry, "speed"),
        sector instanceof Number n ? n.intValue() : null,
        bool(entry, "inPit"),
        bool(entry, "retired"));
  }

  /**
   * Decodes a thin telemetry frame.
   *
   * @param json JSON object
   * @return frame
   * @throws IllegalArgumentException when the document is malformed or lacks {@code sessionId}
   */
  public ThinFrame decodeFrame(String json) {
    Map<String, Object> root = parseObject(json);
    return new ThinFrame(
        requiredString(root, "sessionId"),
        string(root, "frameId"),
        timestamp(root),
        number(root, "speed", 0d),
        integer(root, "gear", 0),
        integer(root, "rpm", 0),
        integer(root, "lap", 0),
        number(root, "lapProgress", 0d),
        integer(root, "position", 0),
        optionalNumber(root, "throttle"),
        optionalNumber(root, "brake"),
        string(root, "driverId"));
  }

  /**
   * Encodes a timing snapshot.
   *
   * @param snapshot snapshot
   * @return JSON object text
   */
  public String encodeTiming(TimingSnapshot snapshot) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("sessionId", snapshot.sessionId());
      gen.writeArrayFieldStart("entries");
      for (TimingEntry e : snapshot.entries()) {
        gen.writeStartObject();
        gen.writeStringField("driverId", e.driverId());
        gen.writeStringField("driverName", e.driverName());
        gen.writeStringField("carNumber", e.carNumber());
        writeNullableString(gen, "teamName", e.teamName());
        gen.writeNumberField("position", e.position());
        gen.writeNumberField("lapNumber", e.lapNumber());
        gen.writeNumberField("lapDistPct", e.lapDistPct());
        gen.writeNumberField("lastLapTime", e.lastLapTime());
        gen.writeNumberField("bestLapTime", e.bestLapTime());
        gen.writeNumberField("gapToLeader", e.gapToLeader());
        writeNullableNumber(gen, "gapAhead", e.gapAhead());
        writeNullableNumber(gen, "speed", e.speed());
        if (e.sector() != null) {
          gen.writeNumberField("sector", e.sector());
        }
        gen.writeBooleanField("inPit", e.inPit());
        gen.writeBooleanField("retired", e.retired());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeStringField("sessionState", snapshot.sessionState());
      gen.writeNumberField("sessionTimeElapsed", snapshot.sessionTimeElapsed());
      gen.writeNumberField("sessionTimeRemaining", snapshot.sessionTimeRemaining());
      gen.writeNumberField("lapsRemaining", snapshot.lapsRemaining());
      writeNullableString(gen, "leaderId", snapshot.leaderId());
      if (snapshot.fastestLap() != null) {
        gen.writeObjectFieldStart("fastestLap");
        gen.writeStringField("driverId", snapshot.fastestLap().driverId());
        gen.writeNumberField("time", snapshot.fastestLap().time());
        gen.writeNumberField("lap", snapshot.fastestLap().lap());
        gen.writeEndObject();
      }
      gen.writeNumberField("timestamp", snapshot.timestampMillis());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a thin frame.
   *
   * @param frame frame
   * @return JSON object text
   */
  public String encodeFrame(ThinFrame frame) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("sessionId", frame.sessionId());
      writeNullableString(gen, "frameId", frame.frameId());
      gen.writeNumberField("timestamp", frame.timestampMillis());
      gen.writeNumberField("speed", frame.speed());
      gen.writeNumberField("gear", frame.gear());
      gen.writeNumberField("rpm", frame.rpm());
      gen.writeNumberField("lap", frame.lap());
      gen.writeNumberField("lapProgress", frame.lapProgress());
      gen.writeNumberField("position", frame.position());
      writeNullableNumber(gen, "throttle", frame.throttle());
      writeNullableNumber(gen, "brake", frame.brake());
      writeNullableString(gen, "driverId", frame.driverId());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a segment pace update as a {@code segment:pace_update} event.
   *
   * @param update pace update
   * @return JSON object text
   */
  public String encodePaceUpdate(SegmentPaceUpdate update) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("type", "segment:pace_update");
      gen.writeStringField("sessionId", update.sessionId());
      gen.writeStringField("vehicleId", update.vehicleId());
      gen.writeStringField("segmentId", update.segmentId());
      gen.writeFieldName("avgSpeed");
      writeConfidence(gen, update.avgSpeed());
      gen.writeNumberField("segmentTimeMs", update.segmentTimeMs());
      gen.writeStringField("qualityFlag", update.qualityFlag().name());
      gen.writeNumberField("confidenceScore", update.confidenceScore());
      gen.writeStringField("source", update.source().name());
      gen.writeNumberField("lapNumber", update.lapNumber());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a pace trend as an {@code opponent:pace_trend} event.
   *
   * @param trend pace trend
   * @return JSON object text
   */
  public String encodePaceTrend(PaceTrend trend) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("type", "opponent:pace_trend");
      gen.writeStringField("sessionId", trend.sessionId());
      gen.writeStringField("vehicleId", trend.vehicleId());
      gen.writeNumberField("timestamp", trend.timestampMillis());
      gen.writeFieldName("straightPace");
      writeConfidence(gen, trend.straightPace());
      gen.writeFieldName("cornerPace");
      writeConfidence(gen, trend.cornerPace());
      gen.writeFieldName("overallPace");
      writeConfidence(gen, trend.overallPace());
      gen.writeFieldName("paceSlope");
      writeConfidence(gen, trend.paceSlope());
      gen.writeStringField("degradationType", trend.degradationType().wireName());
      gen.writeNumberField("cleanSampleCount", trend.cleanSampleCount());
      gen.writeNumberField("totalSampleCount", trend.totalSampleCount());
      gen.writeStringField("dataQualitySummary", trend.dataQualitySummary().name());
      gen.writeEndObject();
    });
  }

  /**
   * Encodes parity diagnostics. Only counters are written, never payload content.
   *
   * @param snapshot parity snapshot
   * @return JSON object text
   */
  public String encodeParity(ParitySnapshot snapshot) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("sessionId", snapshot.sessionId());
      gen.writeObjectFieldStart("streams");
      for (Map.Entry<String, StreamStats> entry : snapshot.streams().entrySet()) {
        gen.writeObjectFieldStart(entry.getKey());
        gen.writeNumberField("framesIn", entry.getValue().framesIn());
        gen.writeNumberField("acked", entry.getValue().acked());
        gen.writeNumberField("lastFrameTs", entry.getValue().lastFrameTs());
        gen.writeEndObject();
      }
      gen.writeEndObject();
      gen.writeNumberField("duplicates", snapshot.duplicates());
      gen.writeNumberField("outOfOrder", snapshot.outOfOrder());
      if (snapshot.lastError() == null) {
        gen.writeNullField("lastError");
      } else {
        gen.writeStringField("lastError", snapshot.lastError());
      }
      gen.writeEndObject();
    });
  }

  /**
   * Encodes a track map.
   *
   * @param map track map
   * @return JSON object text
   */
  public String encodeTrackMap(TrackSegmentMap map) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("trackId", map.trackId());
      gen.writeStringField("trackName", map.trackName());
      gen.writeStringField("layoutName", map.layoutName());
      gen.writeNumberField("trackLengthMeters", map.trackLengthMeters());
      gen.writeStringField("version", map.version());
      gen.writeArrayFieldStart("segments");
      for (TrackSegment segment : map.segments()) {
        gen.writeStartObject();
        gen.writeStringField("segmentId", segment.segmentId());
        gen.writeStringField("label", segment.label());
        gen.writeNumberField("startPct", segment.startPct());
        gen.writeNumberField("endPct", segment.endPct());
        gen.writeNumberField("lengthMeters", segment.lengthMeters());
        gen.writeStringField("segmentType", segment.segmentType().name().toLowerCase(Locale.ROOT));
        gen.writeBooleanField("isSpeedTrap", segment.speedTrap());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  private static void writeConfidence(JsonGenerator gen, ConfidenceValue value) throws IOException {
    gen.writeStartObject();
    if (value.isDefined()) {
      gen.writeNumberField("value", value.value().getAsDouble());
    } else {
      gen.writeNullField("value");
    }
    gen.writeNumberField("confidence", value.confidence());
    gen.writeStringField("source", value.source().name());
    gen.writeStringField("quality", value.quality().name());
    gen.writeNumberField("timestamp", value.timestampMillis());
    gen.writeEndObject();
  }

  private static void writeNullableString(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static void writeNullableNumber(JsonGenerator gen, String field, Double value) throws IOException {
    if (value != null) {
      gen.writeNumberField(field, value);
    }
  }

  private String write(JsonBody body) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("JSON encoding failed", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }

  Map<String, Object> parseObject(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Expected a JSON object but found " + token);
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON payload: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload: " + ex.getMessage(), ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String name = parser.currentName();
      map.put(name, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static long timestamp(Map<String, Object> map) {
    Object value = map.containsKey("timestampMillis") ? map.get("timestampMillis") : map.get("timestamp");
    if (value instanceof Number n) {
      return n.longValue();
    }
    throw new IllegalArgumentException("timestamp is required");
  }

  private static String requiredString(Map<String, Object> map, String field) {
    String value = string(map, field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
    return value;
  }

  private static String string(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value == null) {
      return null;
    }
    return value instanceof String s ? s : String.valueOf(value);
  }

  private static double number(Map<String, Object> map, String field, double fallback) {
    Double value = optionalNumber(map, field);
    return value == null ? fallback : value;
  }

  private static Double optionalNumber(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    throw new IllegalArgumentException(field + " must be a number");
  }

  private static int integer(Map<String, Object> map, String field, int fallback) {
    Double value = optionalNumber(map, field);
    return value == null ? fallback : value.intValue();
  }

  private static boolean bool(Map<String, Object> map, String field) {
    return Boolean.TRUE.equals(map.get(field));
  }

  private static List<?> list(Map<String, Object> map, String field) {
    Object value = map.get(field);
    if (value == null) {
      return List.of();
    }
    if (value instanceof List<?> l) {
      return l;
    }
    throw new IllegalArgumentException(field + " must be an array");
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asObject(Object value, String field) {
    if (value instanceof Map<?, ?>) {
      return (Map<String, Object>) value;
    }
    throw new IllegalArgumentException(field + " must be an object");
  }
}
