package ca.gc.cra.courier.application.port;

/**
 * Checked exception raised when a broker operation (fetch, commit, publish, close) fails.
 *
 * @since 0.1.0
 */
public class MessagingException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public MessagingException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause broker client failure, kept verbatim
   */
  public MessagingException(String msg, Throwable cause) { super(msg, cause); }
}
