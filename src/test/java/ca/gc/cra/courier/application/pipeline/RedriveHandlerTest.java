package ca.gc.cra.courier.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.courier.application.port.PublishException;
import ca.gc.cra.courier.testutil.Await;
import ca.gc.cra.courier.testutil.Messages;
import ca.gc.cra.courier.testutil.RecordingMessageWriter;
import ca.gc.cra.courier.testutil.RecordingMessageWriter.Published;
import ca.gc.cra.courier.testutil.ScriptedBrokerClient;
import java.util.List;
import org.junit.jupiter.api.Test;

class RedriveHandlerTest {

  @Test
  void republishesKeyAndValueWithFreshRetryCounter() throws Exception {
    RecordingMessageWriter target = new RecordingMessageWriter("orders");
    RedriveHandler handler = new RedriveHandler(target);

    handler.handle(Messages.of("orders.dlq", "K", "V", 7L, 0));

    assertEquals(List.of(new Published("K", "V", 0)), target.published());
  }

  @Test
  void publishFailurePropagatesToReader() {
    RecordingMessageWriter target = new RecordingMessageWriter("orders");
    PublishException failure = new PublishException("down", new IllegalStateException("down"));
    target.failWith(failure);
    RedriveHandler handler = new RedriveHandler(target);

    PublishException thrown = assertThrows(PublishException.class,
        () -> handler.handle(Messages.of("orders.dlq", "K", "V", 0L, 0)));
    assertSame(failure, thrown);
  }

  @Test
  void redriveReaderMovesDeadLettersBackToSource() throws Exception {
    ScriptedBrokerClient dlqBroker = new ScriptedBrokerClient("orders.dlq");
    RecordingMessageWriter source = new RecordingMessageWriter("orders");
    RecordingMessageWriter dlqRetry = new RecordingMessageWriter("orders.dlq");
    RecordingMessageWriter dlqDeadLetter = new RecordingMessageWriter("orders.dlq.dlq");
    dlqBroker.enqueue("K", "V", 0);

    RetryingMessageReader reader = new RetryingMessageReader(
        "orders.dlq", dlqBroker, dlqRetry, dlqDeadLetter, 5, null);
    try {
      reader.read(new RedriveHandler(source));
      Await.until("commit", () -> dlqBroker.committed().size() == 1);
    } finally {
      reader.close();
    }

    assertEquals(List.of(new Published("K", "V", 0)), source.published());
  }
}
