package ca.gc.cra.courier.application.port;

/**
 * <strong>What:</strong> Consumes one topic for one consumer group and feeds messages to a handler.
 * <p><strong>Role:</strong> Inbound port exposed to applications.</p>
 * <p><strong>Thread-safety:</strong> {@link #read(MessageHandler)} is safe to race; only one caller wins.</p>
 *
 * @since 0.1.0
 */
public interface MessageReader extends AutoCloseable {
  /**
   * Registers {@code handler} and starts consuming in the background. Returns immediately.
   *
   * @param handler callback invoked once per fetched message; must not be {@code null}
   * @throws IllegalStateException if this reader is already reading or has been closed
   */
  void read(MessageHandler handler);

  /**
   * Stops consumption and releases broker connections. Safe to call more than once.
   *
   * @throws MessagingException if a connection could not be released cleanly
   */
  @Override
  void close() throws MessagingException;
}
