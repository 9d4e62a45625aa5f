package ca.gc.cra.courier.application.port;

import ca.gc.cra.courier.domain.msg.Message;

/**
 * Processing callback registered with a {@link MessageReader}.
 *
 * <p>Returning normally marks the message processed and lets the reader commit it. Throwing routes the
 * message through the reader's retry/dead-letter policy. Delivery is at-least-once, so handlers must
 * tolerate duplicates.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MessageHandler {
  /**
   * Processes one message.
   *
   * @param message fetched message; never {@code null}
   * @throws Exception when processing fails
   */
  void handle(Message message) throws Exception;
}
