package ca.gc.cra.courier.domain.msg;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable broker message as seen by consumers and producers.
 * <p><strong>Why:</strong> Decouples the consume loop and handlers from broker client record types.</p>
 * <p><strong>Role:</strong> Domain value created on fetch and discarded once committed, retried, or dead-lettered.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for sharing across threads.</p>
 * <p><strong>Performance:</strong> Clones key and value once on construction.</p>
 *
 * @param topic topic the message was read from; never {@code null}
 * @param key message key; may be {@code null} when the producer did not set one
 * @param value message payload; may be {@code null} for tombstones
 * @param time broker timestamp; {@link Instant#EPOCH} when unknown
 * @param partition partition the message was read from
 * @param offset broker-assigned offset within {@code partition}
 * @param retryCounter number of prior processing attempts for this payload; {@code 0} on first delivery
 * @implNote A republished message receives a new offset; it is linked to the original only through
 *     identical key/value and an incremented {@code retryCounter}.
 * @since 0.1.0
 */
public record Message(
    String topic,
    byte[] key,
    byte[] value,
    Instant time,
    int partition,
    long offset,
    int retryCounter) {

  /**
   * Validates the topic and retry counter and copies byte arrays.
   *
   * @throws NullPointerException if {@code topic} is {@code null}
   * @throws IllegalArgumentException if {@code retryCounter} is negative
   */
  public Message {
    Objects.requireNonNull(topic, "topic");
    if (retryCounter < 0) {
      throw new IllegalArgumentException("retryCounter must not be negative (was " + retryCounter + ")");
    }
    key = key != null ? key.clone() : null;
    value = value != null ? value.clone() : null;
    time = time != null ? time : Instant.EPOCH;
  }

  /**
   * Returns the key without copying.
   *
   * @return internal key array or {@code null}; callers must not mutate
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Key is copied on construction; handlers read it on the hot path.")
  public byte[] key() {
    return key;
  }

  /**
   * Returns the value without copying.
   *
   * @return internal value array or {@code null}; callers must not mutate
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Value is copied on construction; handlers read it on the hot path.")
  public byte[] value() {
    return value;
  }

  /**
   * Decodes the key as UTF-8.
   *
   * @return key text, or {@code null} when the message has no key
   */
  public String keyAsString() {
    return key == null ? null : new String(key, StandardCharsets.UTF_8);
  }

  /**
   * Decodes the value as UTF-8.
   *
   * @return value text, or {@code null} when the message has no value
   */
  public String valueAsString() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Message that)) {
      return false;
    }
    return partition == that.partition
        && offset == that.offset
        && retryCounter == that.retryCounter
        && topic.equals(that.topic)
        && time.equals(that.time)
        && Arrays.equals(key, that.key)
        && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(topic, time, partition, offset, retryCounter);
    result = 31 * result + Arrays.hashCode(key);
    result = 31 * result + Arrays.hashCode(value);
    return result;
  }

  @Override
  public String toString() {
    return "Message[topic=" + topic
        + ", partition=" + partition
        + ", offset=" + offset
        + ", retryCounter=" + retryCounter
        + ", keyBytes=" + (key == null ? -1 : key.length)
        + ", valueBytes=" + (value == null ? -1 : value.length)
        + ", time=" + time + ']';
  }
}
