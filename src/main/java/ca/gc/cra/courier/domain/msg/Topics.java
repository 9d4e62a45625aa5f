package ca.gc.cra.courier.domain.msg;

import java.util.Objects;

/**
 * Topic naming conventions shared by readers and writers.
 *
 * @since 0.1.0
 */
public final class Topics {
  /** Suffix appended to a topic name to form its dead-letter topic. Not configurable. */
  public static final String DEAD_LETTER_SUFFIX = ".dlq";

  private Topics() {
    // Utility
  }

  /**
   * Returns the dead-letter topic for {@code topic}.
   *
   * @param topic source topic; must not be {@code null}
   * @return {@code topic + ".dlq"}
   */
  public static String deadLetterTopic(String topic) {
    return Objects.requireNonNull(topic, "topic") + DEAD_LETTER_SUFFIX;
  }

  /**
   * Indicates whether {@code topic} follows the dead-letter naming convention.
   *
   * @param topic candidate topic; {@code null} returns {@code false}
   * @return {@code true} when the topic ends with {@link #DEAD_LETTER_SUFFIX}
   */
  public static boolean isDeadLetterTopic(String topic) {
    return topic != null && topic.endsWith(DEAD_LETTER_SUFFIX);
  }
}
