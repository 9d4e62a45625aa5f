package ca.gc.cra.courier.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RedriveCliTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RedriveCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void deadLetterTopicAsSourceIsRejected() {
    ExitCode code = RedriveCli.run(new String[] {
        "brokers=localhost:9092", "groupId=redrive", "topic=orders.dlq", "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(buffer.toString().contains("usage: redrive"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("not its dead-letter topic")));
  }

  @Test
  void helpDescribesRedrive() {
    ExitCode code = RedriveCli.run(new String[] {"-h"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Consumes NAME.dlq"));
  }
}
