package io.pitwall.telemetry.config;

import io.pitwall.telemetry.domain.telemetry.SourceMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI values with precedence CLI &gt; YAML &gt; defaults, then checks mode requirements.
 *
 * @since PITWALL 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param mode active source mode
   * @param yaml optional YAML-derived values for the mode
   * @param cli CLI overrides; may be empty
   * @param defaults defaults for the mode
   * @param warn receives one message per CLI key that overrides a YAML key; may be {@code null}
   * @return immutable merged configuration
   * @throws IllegalArgumentException when a mode requirement is not met
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(SourceMode.fromString(mode), merged);
    return Map.copyOf(merged);
  }

  private static void validate(SourceMode mode, Map<String, String> effective) {
    switch (mode) {
      case LIVE -> {
        if (trim(effective.get("kafkaBootstrap")).isEmpty()) {
          throw new IllegalArgumentException("kafkaBootstrap is required when mode=live");
        }
      }
      case REPLAY -> {
        if (trim(effective.get("replayStart")).isEmpty() || trim(effective.get("replayEnd")).isEmpty()) {
          throw new IllegalArgumentException("replayStart and replayEnd are required when mode=replay");
        }
      }
      case DEMO -> {
        // no external inputs
      }
    }
    if (!trim(effective.get("kafkaPaceTopic")).isEmpty() && trim(effective.get("kafkaBootstrap")).isEmpty()) {
      throw new IllegalArgumentException("kafkaPaceTopic requires kafkaBootstrap");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
