package io.pitwall.telemetry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("pitwall.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          trackId: spa
        replay:
          playbackRate: 4
          trackId: monza
        demo:
          seed: ignored
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "replay");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("4", map.get("playbackRate"));
    assertEquals("monza", map.get("trackId"));
    assertFalse(map.containsKey("seed"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        common:
          detector:
            minSpeedMs: 12.5
          gate:
            maxRateHz:
              league: 3
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "demo").orElseThrow();

    assertEquals("12.5", map.get("detector.minSpeedMs"));
    assertEquals("3", map.get("gate.maxRateHz.league"));
  }

  @Test
  void sectionNamesAreCaseInsensitive() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        Live:
          kafkaBootstrap: localhost:9092
        """), " LIVE ", "inline");

    assertEquals("localhost:9092", map.get("kafkaBootstrap"));
  }

  @Test
  void nullValuesBecomeEmptyStrings() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        common:
          trackMap:
        """), "demo", "inline");

    assertEquals("", map.get("trackMap"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(YamlConfigLoader.parse(new StringReader(""), "demo", "inline").isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "demo");

    assertFalse(result.isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - demo:
            seed: a
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "demo"));
  }

  @Test
  void arraysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        common:
          trackId: [a, b]
        """), "demo", "inline"));
  }

  @Test
  void malformedYamlIsReportedWithSource() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("common: [unclosed"), "demo", "broken.yaml"));

    assertTrue(ex.getMessage().contains("broken.yaml"));
  }
}
