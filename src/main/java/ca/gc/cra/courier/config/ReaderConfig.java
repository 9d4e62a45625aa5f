package ca.gc.cra.courier.config;

import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import ca.gc.cra.courier.domain.msg.Topics;
import ca.gc.cra.courier.validation.Net;
import ca.gc.cra.courier.validation.Numbers;
import ca.gc.cra.courier.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable settings for one reader bound to a topic and consumer group.
 * <p><strong>Why:</strong> Resolves the retry ceiling and Kafka fetch sizing once, at construction, so the
 * consume loop never consults process-wide configuration.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Observability:</strong> Logs at DEBUG when the retry ceiling falls back to the default.</p>
 *
 * @param brokers broker endpoints in {@code host:port} form; at least one
 * @param groupId consumer group id
 * @param topic consumed topic
 * @param retryCeiling number of republications allowed before dead-lettering
 * @param fetchMinBytes Kafka {@code fetch.min.bytes}
 * @param fetchMaxBytes Kafka {@code fetch.max.bytes}
 * @param pollTimeout wait of one Kafka poll inside a blocking fetch
 * @since 0.1.0
 */
public record ReaderConfig(
    List<String> brokers,
    String groupId,
    String topic,
    int retryCeiling,
    int fetchMinBytes,
    int fetchMaxBytes,
    Duration pollTimeout) {
  private static final Logger log = LoggerFactory.getLogger(ReaderConfig.class);

  /** Configuration key of the retry ceiling. */
  public static final String RETRIES_KEY = "number.of.retries";
  /** Default {@code fetch.min.bytes}: 10 KB. */
  public static final int DEFAULT_FETCH_MIN_BYTES = 10_000;
  /** Default {@code fetch.max.bytes}: 10 MB. */
  public static final int DEFAULT_FETCH_MAX_BYTES = 10_000_000;
  /** Default poll wait inside one fetch. */
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

  private static final int MAX_RETRY_CEILING = 1_000;

  /**
   * Validates and normalizes the settings.
   *
   * @throws IllegalArgumentException if any field is blank, malformed, or out of range
   */
  public ReaderConfig {
    Objects.requireNonNull(brokers, "brokers");
    if (brokers.isEmpty()) {
      throw new IllegalArgumentException("brokers must list at least one host:port");
    }
    brokers = brokers.stream().map(Net::validateHostPort).toList();
    groupId = Strings.requireNonBlank("groupId", groupId);
    topic = Strings.sanitizeTopic(topic);
    Numbers.requireRange(RETRIES_KEY, retryCeiling, 0, MAX_RETRY_CEILING);
    Numbers.requireRange("fetchMinBytes", fetchMinBytes, 1, Integer.MAX_VALUE);
    Numbers.requireRange("fetchMaxBytes", fetchMaxBytes, fetchMinBytes, Integer.MAX_VALUE);
    pollTimeout = Objects.requireNonNullElse(pollTimeout, DEFAULT_POLL_TIMEOUT);
    if (pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeoutMs must be positive");
    }
  }

  /**
   * Builds a configuration from flat key/value settings (CLI arguments or flattened YAML).
   *
   * <p>Recognized keys: {@code brokers}, {@code groupId}, {@code topic}, {@code number.of.retries},
   * {@code fetchMinBytes}, {@code fetchMaxBytes}, {@code pollTimeoutMs}. An absent, non-numeric, or
   * out-of-range {@code number.of.retries} falls back to
   * {@link RetryingMessageReader#DEFAULT_RETRY_CEILING}.</p>
   *
   * @param settings flat settings map; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if required keys are missing or values are invalid
   */
  public static ReaderConfig fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    String brokers = settings.get("brokers");
    if (brokers == null || brokers.isBlank()) {
      throw new IllegalArgumentException("brokers is required");
    }
    String groupId = settings.get("groupId");
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId is required");
    }
    String topic = settings.get("topic");
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic is required");
    }
    int fetchMin = optionalInt(settings, "fetchMinBytes", DEFAULT_FETCH_MIN_BYTES, 1, Integer.MAX_VALUE);
    int fetchMax = optionalInt(settings, "fetchMaxBytes", DEFAULT_FETCH_MAX_BYTES, 1, Integer.MAX_VALUE);
    int pollMillis = optionalInt(settings, "pollTimeoutMs",
        (int) DEFAULT_POLL_TIMEOUT.toMillis(), 1, 60_000);
    return new ReaderConfig(
        Net.parseBrokerList(brokers),
        groupId,
        topic,
        resolveRetryCeiling(settings.get(RETRIES_KEY)),
        fetchMin,
        fetchMax,
        Duration.ofMillis(pollMillis));
  }

  /**
   * Parses the retry ceiling, falling back to the default for absent or invalid values.
   *
   * @param raw configured value; may be {@code null}
   * @return parsed ceiling, or {@link RetryingMessageReader#DEFAULT_RETRY_CEILING}
   */
  public static int resolveRetryCeiling(String raw) {
    if (raw == null || raw.isBlank()) {
      log.debug("{} was not set, using default value of {}", RETRIES_KEY, RetryingMessageReader.DEFAULT_RETRY_CEILING);
      return RetryingMessageReader.DEFAULT_RETRY_CEILING;
    }
    try {
      return Numbers.parseInt(RETRIES_KEY, raw, 0, MAX_RETRY_CEILING);
    } catch (IllegalArgumentException ex) {
      log.debug("{} is invalid ({}), using default value of {}",
          RETRIES_KEY, ex.getMessage(), RetryingMessageReader.DEFAULT_RETRY_CEILING);
      return RetryingMessageReader.DEFAULT_RETRY_CEILING;
    }
  }

  /**
   * Returns the broker list in Kafka's {@code bootstrap.servers} form.
   *
   * @return comma-separated endpoints
   */
  public String bootstrapServers() {
    return String.join(",", brokers);
  }

  /**
   * Returns the dead-letter topic for this reader.
   *
   * @return {@code topic + ".dlq"}
   */
  public String deadLetterTopic() {
    return Topics.deadLetterTopic(topic);
  }

  /**
   * Returns a copy bound to a different topic, keeping every other setting.
   *
   * @param newTopic topic to consume instead
   * @return new configuration
   */
  public ReaderConfig withTopic(String newTopic) {
    return new ReaderConfig(brokers, groupId, newTopic, retryCeiling, fetchMinBytes, fetchMaxBytes, pollTimeout);
  }

  private static int optionalInt(Map<String, String> settings, String key, int defaultValue, int min, int max) {
    String raw = settings.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseInt(key, raw, min, max);
  }
}
