package ca.gc.cra.courier.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.port.MessageHandler;
import ca.gc.cra.courier.application.port.MessagingException;
import ca.gc.cra.courier.application.port.PublishException;
import ca.gc.cra.courier.testutil.Await;
import ca.gc.cra.courier.testutil.RecordingMessageWriter;
import ca.gc.cra.courier.testutil.ScriptedBrokerClient;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RetryingMessageReaderLoggingTest {
  private static final String TOPIC = "orders";

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private ScriptedBrokerClient broker;
  private RecordingMessageWriter retryWriter;
  private RecordingMessageWriter deadLetterWriter;
  private RetryingMessageReader reader;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RetryingMessageReader.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    broker = new ScriptedBrokerClient(TOPIC);
    retryWriter = new RecordingMessageWriter(TOPIC);
    deadLetterWriter = new RecordingMessageWriter(TOPIC + ".dlq");
  }

  @AfterEach
  void tearDown() throws MessagingException {
    if (reader != null) {
      reader.close();
    }
    logger.detachAppender(appender);
  }

  @Test
  void fetchedMessageIsLoggedAtInfoWithCoordinates() {
    reader = newReader(5);
    broker.enqueue("k1", "v1", 2);

    reader.read(message -> { });

    ILoggingEvent event = awaitEvent("Fetched message");
    assertEquals(Level.INFO, event.getLevel());
    assertEquals("Fetched message [topic] orders [partition] 0 [offset] 0 [retry] 2: k1 = v1",
        event.getFormattedMessage());
  }

  @Test
  void commitFailureIsLoggedAtError() {
    reader = newReader(5);
    broker.failNextCommit(new MessagingException("coordinator unavailable"));
    broker.enqueue("k1", "v1", 0);

    reader.read(message -> { });

    ILoggingEvent event = awaitEvent("Cannot commit message");
    assertEquals(Level.ERROR, event.getLevel());
    assertEquals("Cannot commit message [orders] 0/0: k1 = v1", event.getFormattedMessage());
    assertNotNull(event.getThrowableProxy());
    assertEquals("coordinator unavailable", event.getThrowableProxy().getMessage());
  }

  @Test
  void processingFailureIsLoggedAtErrorAndRetryAtInfo() {
    reader = newReader(5);
    broker.enqueue("k1", "v1", 1);

    reader.read(failing());

    ILoggingEvent failure = awaitEvent("Failed to process message");
    assertEquals(Level.ERROR, failure.getLevel());
    assertEquals("Failed to process message [orders] 0/0 (retry 1)", failure.getFormattedMessage());
    assertEquals("cannot process v1", failure.getThrowableProxy().getMessage());

    ILoggingEvent retry = awaitEvent("Republishing");
    assertEquals(Level.INFO, retry.getLevel());
    assertEquals("Republishing [orders] 0/0 to orders as retry 2", retry.getFormattedMessage());
  }

  @Test
  void deadLetterDiversionIsLoggedAtError() {
    reader = newReader(2);
    broker.enqueue("k1", "v1", 2);

    reader.read(failing());

    ILoggingEvent event = awaitEvent("Retries exhausted");
    assertEquals(Level.ERROR, event.getLevel());
    assertEquals("Retries exhausted for [orders] 0/0 after 3 attempts; writing to orders.dlq",
        event.getFormattedMessage());
    assertTrue(findEvent("Republishing").isEmpty());
  }

  @Test
  void publishFailureIsLoggedAtError() {
    reader = newReader(5);
    retryWriter.failWith(new PublishException("broker down", new IllegalStateException("down")));
    broker.enqueue("k1", "v1", 0);

    reader.read(failing());

    ILoggingEvent event = awaitEvent("Cannot publish message");
    assertEquals(Level.ERROR, event.getLevel());
    assertEquals("Cannot publish message [orders] 0/0 to orders; message dropped", event.getFormattedMessage());
    assertEquals("broker down", event.getThrowableProxy().getMessage());
  }

  @Test
  void fetchFailureIsLoggedAtWarn() {
    reader = newReader(5);
    broker.enqueueFailure(new MessagingException("network gone"));

    reader.read(message -> { });

    ILoggingEvent event = awaitEvent("Fetch on topic");
    assertEquals(Level.WARN, event.getLevel());
    assertEquals("Fetch on topic orders failed; stopping consumption", event.getFormattedMessage());
  }

  @Test
  void fetchEndedByCloseIsLoggedAtInfo() throws MessagingException {
    reader = newReader(5);
    reader.read(message -> { });
    Await.until("fetch started", () -> broker.fetchCalls() >= 1);

    reader.close();

    ILoggingEvent event = awaitEvent("Fetch on topic");
    assertEquals(Level.INFO, event.getLevel());
    assertEquals("Fetch on topic orders ended after close", event.getFormattedMessage());
  }

  private RetryingMessageReader newReader(int ceiling) {
    return new RetryingMessageReader(TOPIC, broker, retryWriter, deadLetterWriter, ceiling, null);
  }

  private ILoggingEvent awaitEvent(String prefix) {
    Await.until("log event '" + prefix + "'", () -> findEvent(prefix).isPresent());
    return findEvent(prefix).orElseThrow();
  }

  private Optional<ILoggingEvent> findEvent(String prefix) {
    return events().stream()
        .filter(event -> event.getFormattedMessage().startsWith(prefix))
        .findFirst();
  }

  private List<ILoggingEvent> events() {
    synchronized (appender) {
      return new ArrayList<>(appender.list);
    }
  }

  private static MessageHandler failing() {
    return message -> {
      throw new IllegalStateException("cannot process " + message.valueAsString());
    };
  }
}
