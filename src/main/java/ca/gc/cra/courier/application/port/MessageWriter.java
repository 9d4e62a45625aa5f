package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Publishes single messages to one named topic.
 * <p><strong>Role:</strong> Sink-side port used by callers and by {@link MessageReader} for retry and
 * dead-letter republication.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their own guarantees; the Kafka adapter is
 * safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Each call is synchronous and blocks until the broker acknowledges.</p>
 *
 * @since 0.1.0
 */
public interface MessageWriter extends AutoCloseable {
  /**
   * Returns the destination topic.
   *
   * @return topic every write goes to
   */
  String topic();

  /**
   * Publishes a message with a retry counter of {@code 0}.
   *
   * @param key message key; may be {@code null}
   * @param value message value; may be {@code null}
   * @throws PublishException if the broker rejects or fails the publish
   */
  default void write(byte[] key, byte[] value) throws PublishException {
    writeWithRetryCounter(key, value, 0);
  }

  /**
   * Publishes a message carrying the given retry counter.
   *
   * @param key message key; may be {@code null}
   * @param value message value; may be {@code null}
   * @param retryCounter number of prior processing attempts; must not be negative
   * @throws PublishException if the broker rejects or fails the publish
   * @throws IllegalArgumentException if {@code retryCounter} is negative
   */
  void writeWithRetryCounter(byte[] key, byte[] value, int retryCounter) throws PublishException;

  /**
   * Flushes and releases the publish connection.
   */
  @Override
  void close();
}
