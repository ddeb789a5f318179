package io.pitwall.telemetry.config;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Typed reads over flat configuration maps. */
final class ConfigValues {
  private ConfigValues() {}

  static Optional<String> optionalString(Map<String, String> map, String key) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static String string(Map<String, String> map, String key, String fallback) {
    return optionalString(map, key).orElse(fallback);
  }

  static String requiredString(Map<String, String> map, String key) {
    return optionalString(map, key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  static int intValue(Map<String, String> map, String key, int fallback) {
    Optional<String> raw = optionalString(map, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw.get() + ")", ex);
    }
  }

  static long longValue(Map<String, String> map, String key, long fallback) {
    Optional<String> raw = optionalString(map, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw.get() + ")", ex);
    }
  }

  static double doubleValue(Map<String, String> map, String key, double fallback) {
    Optional<String> raw = optionalString(map, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was " + raw.get() + ")", ex);
    }
  }

  static boolean booleanValue(Map<String, String> map, String key, boolean fallback) {
    Optional<String> raw = optionalString(map, key);
    if (raw.isEmpty()) {
      return fallback;
    }
    return switch (raw.get().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw.get() + ")");
    };
  }

  /**
   * Reads an instant given as epoch milliseconds or ISO-8601 text such as {@code 2024-05-01T12:00:00Z}.
   */
  static long epochMillis(Map<String, String> map, String key) {
    String raw = requiredString(map, key);
    if (raw.chars().allMatch(Character::isDigit)) {
      try {
        return Long.parseLong(raw);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " is out of range (was " + raw + ")", ex);
      }
    }
    try {
      return Instant.parse(raw).toEpochMilli();
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(
          key + " must be epoch millis or an ISO-8601 instant (was " + raw + ")", ex);
    }
  }
}
