package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.msg.Message;

/**
 * <strong>What:</strong> Capability port over a broker's fetch/commit/close primitives.
 * <p><strong>Why:</strong> Keeps broker client library types out of the consume loop so any broker, or an
 * in-memory double, can be substituted.</p>
 * <p><strong>Role:</strong> Source-side port owned exclusively by one {@link MessageReader}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Translate broker-native records into {@link Message} values.</li>
 *   <li>Commit consumed offsets explicitly; implementations must never auto-commit.</li>
 *   <li>Release the broker connection and wake a blocked fetch on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #fetchMessage()} and {@link #commitMessages(Message...)} are
 * called from a single worker thread; {@link #close()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Errors are returned verbatim as exception causes; no retry happens here.</p>
 *
 * @since 0.1.0
 */
public interface BrokerClient extends AutoCloseable {
  /**
   * Blocks until the next message is available. Does not commit or advance the committed offset.
   *
   * @return next message
   * @throws BrokerClosedException if the client is closed before or during the fetch
   * @throws MessagingException if the broker connection fails
   */
  Message fetchMessage() throws MessagingException;

  /**
   * Durably advances the consumer group's committed position past each given message.
   *
   * @param messages messages to mark consumed; an empty array is a no-op
   * @throws MessagingException if the commit is rejected or the client is closed
   */
  void commitMessages(Message... messages) throws MessagingException;

  /**
   * Releases the underlying connection. Safe to call more than once.
   */
  @Override
  void close();
}
