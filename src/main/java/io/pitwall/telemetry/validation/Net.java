package io.pitwall.telemetry.validation;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Validates broker endpoints before any client is constructed.
 *
 * @since PITWALL 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
  private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3}){3}");

  private Net() {
    // Utility
  }

  /**
   * Validates a single {@code host:port}; IPv6 hosts must be bracketed.
   *
   * @param value endpoint text
   * @return normalized endpoint
   * @throws IllegalArgumentException when the host or port is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPV6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, close + 1);
      portPart = sanitized.substring(close + 2);
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      validateHost(host);
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65_535);
    return host + ':' + port;
  }

  /**
   * Validates a comma-separated bootstrap list.
   *
   * @param value list such as {@code "broker-1:9092,broker-2:9092"}
   * @return normalized list without blanks
   * @throws IllegalArgumentException when the list is empty or any entry is malformed
   */
  public static String validateBootstrapServers(String value) {
    String sanitized = Strings.requireNonBlank("kafkaBootstrap", value);
    StringJoiner joiner = new StringJoiner(",");
    for (String entry : sanitized.split(",")) {
      if (!entry.isBlank()) {
        joiner.add(validateHostPort(entry.trim()));
      }
    }
    if (joiner.length() == 0) {
      throw new IllegalArgumentException("kafkaBootstrap must list at least one host:port");
    }
    return joiner.toString();
  }

  private static void validateHost(String host) {
    if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
    }
    if (IPV4.matcher(host).matches()) {
      for (String octet : host.split("\\.")) {
        Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
      }
      return;
    }
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
  }
}
