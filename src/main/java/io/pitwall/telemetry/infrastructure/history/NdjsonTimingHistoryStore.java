package io.pitwall.telemetry.infrastructure.history;

import io.pitwall.telemetry.application.port.TimingHistoryStore;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import io.pitwall.telemetry.infrastructure.json.TelemetryJsonCodec;
import io.pitwall.telemetry.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TimingHistoryStore} over newline-delimited JSON files.
 * <p><strong>Layout:</strong> {@code <baseDir>/<sessionId>/timing.ndjson} and
 * {@code <baseDir>/<sessionId>/frames.ndjson}, one JSON object per line in any order.</p>
 * <p><strong>Behavior:</strong> A missing session directory raises {@link NoSuchFileException}; a missing
 * file inside an existing directory yields no records. Blank lines are ignored and malformed lines are
 * skipped with a warning. Results are sorted by timestamp and restricted to {@code [from, to)}.</p>
 * <p><strong>Thread-safety:</strong> Stateless per call; safe for concurrent fetches.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class NdjsonTimingHistoryStore implements TimingHistoryStore {
  private static final Logger log = LoggerFactory.getLogger(NdjsonTimingHistoryStore.class);

  /** File holding timing snapshots. */
  public static final String TIMING_FILE = "timing.ndjson";
  /** File holding thin frames. */
  public static final String FRAMES_FILE = "frames.ndjson";

  private final Path baseDir;
  private final TelemetryJsonCodec codec;

  /**
   * Creates a store rooted at {@code baseDir}.
   *
   * @param baseDir directory containing one sub-directory per session
   * @param codec JSON codec
   */
  public NdjsonTimingHistoryStore(Path baseDir, TelemetryJsonCodec codec) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public List<TimingSnapshot> fetchTiming(String sessionId, long fromMillis, long toMillis) throws IOException {
    return read(sessionId, TIMING_FILE, codec::decodeTiming, TimingSnapshot::timestampMillis, fromMillis, toMillis);
  }

  @Override
  public List<ThinFrame> fetchFrames(String sessionId, long fromMillis, long toMillis) throws IOException {
    return read(sessionId, FRAMES_FILE, codec::decodeFrame, ThinFrame::timestampMillis, fromMillis, toMillis);
  }

  /**
   * Returns the directory backing a session.
   *
   * @param sessionId session id restricted to {@code [A-Za-z0-9._-]}
   * @return session directory
   */
  public Path sessionDirectory(String sessionId) {
    String id = Strings.sanitizeTopic("sessionId", sessionId);
    if (id.equals(".") || id.equals("..")) {
      throw new IllegalArgumentException("sessionId must not be a relative path segment");
    }
    return baseDir.resolve(id);
  }

  private <T> List<T> read(
      String sessionId,
      String fileName,
      Function<String, T> decoder,
      ToLongFunction<T> timestamp,
      long fromMillis,
      long toMillis) throws IOException {
    Path dir = sessionDirectory(sessionId);
    if (!Files.isDirectory(dir)) {
      throw new NoSuchFileException(dir.toString(), null, "no recorded history for session " + sessionId);
    }
    Path file = dir.resolve(fileName);
    if (!Files.exists(file)) {
      return List.of();
    }
    List<T> out = new ArrayList<>();
    int lineNumber = 0;
    int skipped = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        T value;
        try {
          value = decoder.apply(line);
        } catch (IllegalArgumentException ex) {
          skipped++;
          log.warn("Skipping malformed line {} in {}: {}", lineNumber, file, ex.getMessage());
          continue;
        }
        long ts = timestamp.applyAsLong(value);
        if (ts >= fromMillis && ts < toMillis) {
          out.add(value);
        }
      }
    }
    out.sort(Comparator.comparingLong(timestamp));
    log.debug("Read {} records from {} [{}, {}) ({} skipped)", out.size(), file, fromMillis, toMillis, skipped);
    return out;
  }
}
