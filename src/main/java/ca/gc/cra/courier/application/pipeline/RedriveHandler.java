package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.port.MessageHandler;
import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.domain.msg.Message;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handler that moves dead-lettered messages back to their source topic with a fresh retry budget.
 *
 * <p>Register it with a reader on {@code <topic>.dlq} and a writer on {@code <topic>}. Publish failures
 * propagate, so the dead-letter reader's own retry policy applies to the redrive.</p>
 *
 * @since 0.1.0
 */
public final class RedriveHandler implements MessageHandler {
  private static final Logger log = LoggerFactory.getLogger(RedriveHandler.class);

  private final MessageWriter target;

  /**
   * Creates a redrive handler.
   *
   * @param target writer for the topic messages are returned to
   */
  public RedriveHandler(MessageWriter target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void handle(Message message) throws Exception {
    target.write(message.key(), message.value());
    log.info("Redrove [{}] {}/{} to {}", message.topic(), message.partition(), message.offset(), target.topic());
  }
}
