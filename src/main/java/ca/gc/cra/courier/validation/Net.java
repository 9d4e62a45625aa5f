package ca.gc.cra.courier.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Broker endpoint validation.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");
  private static final Pattern IPV6_PATTERN = Pattern.compile("^[0-9A-Fa-f:.]+$");

  private Net() {
    // Utility
  }

  /**
   * Validates a {@code host:port} pair. IPv6 literals must be bracketed.
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the endpoint is malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int close = sanitized.indexOf(']');
      if (close < 0 || close + 1 >= sanitized.length() || sanitized.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(1, close);
      if (host.isEmpty() || !IPV6_PATTERN.matcher(host).matches()) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
      portPart = sanitized.substring(close + 2);
      host = '[' + host + ']';
    } else {
      int colon = sanitized.lastIndexOf(':');
      if (colon <= 0 || colon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, colon);
      portPart = sanitized.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHostname(host);
    }
    int port = Numbers.parseInt("port", portPart, 1, 65535);
    return host + ':' + port;
  }

  /**
   * Splits and validates a comma-separated broker list.
   *
   * @param value comma-separated {@code host:port} entries
   * @return immutable list of normalized endpoints, in input order
   * @throws IllegalArgumentException if the list is empty or any entry is malformed
   */
  public static List<String> parseBrokerList(String value) {
    String sanitized = Strings.requireNonBlank("brokers", value);
    List<String> brokers = new ArrayList<>();
    for (String token : sanitized.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      brokers.add(validateHostPort(token));
    }
    if (brokers.isEmpty()) {
      throw new IllegalArgumentException("brokers must list at least one host:port");
    }
    return List.copyOf(brokers);
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL_PATTERN.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
  }
}
