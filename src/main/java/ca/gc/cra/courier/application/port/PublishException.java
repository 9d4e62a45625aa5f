package ca.gc.cra.courier.application.port;

/**
 * Raised when a {@link MessageWriter} cannot publish a message.
 *
 * @since 0.1.0
 */
public final class PublishException extends MessagingException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message and the broker-side cause.
   *
   * @param msg human-readable error naming the destination topic
   * @param cause broker client failure
   */
  public PublishException(String msg, Throwable cause) { super(msg, cause); }
}
