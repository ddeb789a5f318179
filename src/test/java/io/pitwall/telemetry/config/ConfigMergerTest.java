package io.pitwall.telemetry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("seed", "default", "metricsExporter", "none");
    Map<String, String> yaml = Map.of("seed", "yaml-seed", "carCount", "22");
    Map<String, String> cli = Map.of("seed", "cli-seed", "carCount", "24");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "demo", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("cli-seed", merged.get("seed"));
    assertEquals("24", merged.get("carCount"));
    assertEquals("none", merged.get("metricsExporter"));
    assertEquals(2, warnings.size());
    assertTrue(warnings.contains("CLI overrides YAML for key: seed"));
    assertTrue(warnings.contains("CLI overrides YAML for key: carCount"));
  }

  @Test
  void yamlOverridesDefaultsWithoutWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "demo", Optional.of(Map.of("seed", "yaml")), Map.of(), Map.of("seed", "default"), warnings::add);

    assertEquals("yaml", merged.get("seed"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void liveModeRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "live", Optional.empty(), Map.of(), Map.of("kafkaBootstrap", ""), msg -> { }));
  }

  @Test
  void replayModeRequiresWindow() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "replay", Optional.empty(), Map.of("replayStart", "0"), Map.of(), msg -> { }));
  }

  @Test
  void paceTopicRequiresBootstrap() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "demo", Optional.empty(), Map.of("kafkaPaceTopic", "pitwall.pace"), Map.of(), msg -> { }));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "qualifying", Optional.empty(), Map.of(), Map.of(), msg -> { }));
  }
}
