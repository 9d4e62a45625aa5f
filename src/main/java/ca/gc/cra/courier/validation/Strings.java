package ca.gc.cra.courier.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for topics, group ids, and CLI values.
 * <p><strong>Why:</strong> Readers and writers must not start against blank or malformed broker identifiers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> Failures raise {@link IllegalArgumentException} naming the parameter.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final int MAX_TOPIC_LENGTH = 249;

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank, and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name using the label {@code "topic"}.
   *
   * @param topic candidate topic
   * @return trimmed topic matching {@code [A-Za-z0-9._-]+}
   * @throws NullPointerException if {@code topic} is {@code null}
   * @throws IllegalArgumentException if the topic is blank, too long, or uses unsupported characters
   */
  public static String sanitizeTopic(String topic) {
    return sanitizeTopic("topic", topic);
  }

  /**
   * Validates a Kafka topic-like identifier with a custom label.
   *
   * @param name parameter name for diagnostics
   * @param topic candidate identifier
   * @return trimmed identifier matching {@code [A-Za-z0-9._-]+}
   * @throws NullPointerException if {@code topic} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank, too long, or uses unsupported characters
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (sanitized.length() > MAX_TOPIC_LENGTH) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + MAX_TOPIC_LENGTH);
    }
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(
          label(name) + " must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
