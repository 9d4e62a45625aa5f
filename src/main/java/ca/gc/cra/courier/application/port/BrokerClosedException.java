package ca.gc.cra.courier.application.port;

/**
 * Raised when a fetch or commit is attempted on, or interrupted by, a closed {@link BrokerClient}.
 *
 * @since 0.1.0
 */
public final class BrokerClosedException extends MessagingException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception for the named topic.
   *
   * @param topic topic the closed client was bound to
   */
  public BrokerClosedException(String topic) {
    super("broker client for topic " + topic + " is closed");
  }
}
