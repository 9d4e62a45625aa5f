package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pipeline.RetryingMessageReader;
import ca.gc.cra.courier.application.port.MessageHandler;
import ca.gc.cra.courier.application.port.MessagingException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a reader in the foreground until the JVM is asked to stop or the consume loop ends.
 */
final class ReaderCliSupport {
  private static final Logger log = LoggerFactory.getLogger(ReaderCliSupport.class);
  private static final Duration WAIT_SLICE = Duration.ofSeconds(1);

  private ReaderCliSupport() {}

  /**
   * Starts {@code reader} with {@code handler} and blocks until it stops. A JVM shutdown hook closes the
   * reader on SIGINT/SIGTERM and then runs {@code afterClose}. The reader is always closed on return.
   *
   * @param reader reader that has not started yet
   * @param handler handler to register
   * @param afterClose run by the shutdown hook once the reader is closed, for example a metrics flush
   * @return {@link ExitCode#INTERRUPTED} when stopped by shutdown or interruption,
   *     {@link ExitCode#RUNTIME_FAILURE} when the loop ended on its own
   */
  static ExitCode readUntilStopped(RetryingMessageReader reader, MessageHandler handler, Runnable afterClose) {
    Thread hook = new Thread(shutdownAction(reader, afterClose), "courier-shutdown-" + reader.topic());
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      reader.read(handler);
      boolean stopped;
      do {
        stopped = reader.awaitTermination(WAIT_SLICE);
      } while (!stopped);
      if (reader.isClosed()) {
        log.info("Reader for topic {} stopped on shutdown", reader.topic());
        return ExitCode.INTERRUPTED;
      }
      log.error("Consume loop for topic {} ended unexpectedly", reader.topic());
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while reading topic {}", reader.topic());
      return ExitCode.INTERRUPTED;
    } finally {
      removeHook(hook);
      closeReader(reader);
    }
  }

  static Runnable shutdownAction(RetryingMessageReader reader, Runnable afterClose) {
    return () -> {
      closeReader(reader);
      try {
        afterClose.run();
      } catch (RuntimeException ex) {
        log.warn("Shutdown cleanup for topic {} failed", reader.topic(), ex);
      }
    };
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving shutdown hook registered");
    }
  }

  private static void closeReader(RetryingMessageReader reader) {
    try {
      reader.close();
    } catch (MessagingException ex) {
      log.warn("Failed to close reader for topic {} cleanly", reader.topic(), ex);
    }
  }
}
