package ca.gc.cra.courier.application.pipeline;

import ca.gc.cra.courier.application.port.BrokerClient;
import ca.gc.cra.courier.application.port.MessageHandler;
import ca.gc.cra.courier.application.port.MessageReader;
import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.application.port.MessagingException;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.port.PublishException;
import ca.gc.cra.courier.domain.msg.Message;
import ca.gc.cra.courier.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.courier.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one topic on a dedicated worker thread, committing after successful processing and
 * republishing failed messages until a retry ceiling is reached.
 *
 * <p>For every fetched message the handler is invoked on the worker thread. On success the offset is
 * committed; a failed commit is logged and the loop continues. On failure the message is republished to
 * the same topic with its retry counter incremented, or, once {@code retryCounter >= retryCeiling}, to
 * the dead-letter topic with the counter reset to {@code 0}. The failed original is never committed, so
 * a consumer restart may redeliver it alongside its retry copy: delivery is at-least-once.</p>
 *
 * <p>The loop ends on the first fetch failure, which is how {@link #close()} stops it. It is not
 * restarted.</p>
 *
 * @since 0.1.0
 */
public final class RetryingMessageReader implements MessageReader {
  private static final Logger log = LoggerFactory.getLogger(RetryingMessageReader.class);

  /** Retry ceiling used when configuration does not supply a valid one. */
  public static final int DEFAULT_RETRY_CEILING = 5;

  private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final String topic;
  private final BrokerClient brokerClient;
  private final MessageWriter retryWriter;
  private final MessageWriter deadLetterWriter;
  private final int retryCeiling;
  private final MetricsPort metrics;

  private final AtomicReference<MessageHandler> handler = new AtomicReference<>();
  private final AtomicReference<Thread> workerThread = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile ExecutorService worker;

  /**
   * Creates a reader. The reader takes ownership of the broker client and both writers.
   *
   * @param topic topic consumed by {@code brokerClient}
   * @param brokerClient fetch/commit capability bound to {@code topic}
   * @param retryWriter writer publishing to {@code topic}
   * @param deadLetterWriter writer publishing to the dead-letter topic
   * @param retryCeiling number of republications allowed before dead-lettering; must not be negative
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IllegalArgumentException if {@code retryCeiling} is negative
   */
  public RetryingMessageReader(
      String topic,
      BrokerClient brokerClient,
      MessageWriter retryWriter,
      MessageWriter deadLetterWriter,
      int retryCeiling,
      MetricsPort metrics) {
    this.topic = Objects.requireNonNull(topic, "topic");
    this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient");
    this.retryWriter = Objects.requireNonNull(retryWriter, "retryWriter");
    this.deadLetterWriter = Objects.requireNonNull(deadLetterWriter, "deadLetterWriter");
    if (retryCeiling < 0) {
      throw new IllegalArgumentException("retryCeiling must not be negative (was " + retryCeiling + ")");
    }
    this.retryCeiling = retryCeiling;
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public void read(MessageHandler messageHandler) {
    Objects.requireNonNull(messageHandler, "messageHandler");
    if (closed.get()) {
      throw new IllegalStateException("reader for topic " + topic + " is closed");
    }
    if (!handler.compareAndSet(null, messageHandler)) {
      throw new IllegalStateException("reader is already reading from topic " + topic);
    }
    ExecutorService executor = ExecutorFactories.newConsumerWorker(
        "courier-consume-" + topic,
        (thread, ex) -> log.error("Consume loop for topic {} died unexpectedly", topic, ex));
    worker = executor;
    executor.execute(() -> consumeLoop(messageHandler));
    executor.shutdown();
    log.info("Started reading topic {} with retry ceiling {}", topic, retryCeiling);
  }

  @Override
  public void close() throws MessagingException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    log.info("Closing reader for topic {}", topic);
    MessagingException failure = null;
    try {
      brokerClient.close();
    } catch (RuntimeException ex) {
      failure = new MessagingException("failed to close broker client for topic " + topic, ex);
    }
    awaitWorker();
    failure = closeWriter(retryWriter, failure);
    failure = closeWriter(deadLetterWriter, failure);
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Returns the configured retry ceiling.
   *
   * @return maximum retry counter that is still republished to the source topic on failure
   */
  public int retryCeiling() {
    return retryCeiling;
  }

  /**
   * Returns the consumed topic.
   *
   * @return topic name
   */
  public String topic() {
    return topic;
  }

  /**
   * Indicates whether the consume loop is currently running.
   *
   * @return {@code true} while the worker thread is alive
   */
  public boolean isRunning() {
    Thread thread = workerThread.get();
    return thread != null && thread.isAlive();
  }

  /**
   * Indicates whether {@link #close()} has been called.
   *
   * @return {@code true} once closing has started
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Blocks until the consume loop has stopped or the timeout elapses.
   *
   * @param timeout maximum wait
   * @return {@code true} if the loop has stopped (or was never started)
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    ExecutorService executor = worker;
    if (executor == null) {
      return true;
    }
    return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void consumeLoop(MessageHandler messageHandler) {
    workerThread.set(Thread.currentThread());
    try {
      while (true) {
        Message message;
        try {
          message = brokerClient.fetchMessage();
        } catch (MessagingException | RuntimeException ex) {
          logFetchFailure(ex);
          return;
        }
        if (closed.get()) {
          log.info("Reader for topic {} closed; dropping fetched offset {} uncommitted", topic, message.offset());
          return;
        }
        metrics.increment("consume.fetched");
        log.info("Fetched message [topic] {} [partition] {} [offset] {} [retry] {}: {} = {}",
            message.topic(),
            message.partition(),
            message.offset(),
            message.retryCounter(),
            Logs.preview(message.key(), Logs.PAYLOAD_PREVIEW_BYTES),
            Logs.preview(message.value(), Logs.PAYLOAD_PREVIEW_BYTES));
        process(messageHandler, message);
      }
    } finally {
      workerThread.set(null);
      log.info("Consume loop for topic {} stopped", topic);
    }
  }

  private void process(MessageHandler messageHandler, Message message) {
    long start = System.nanoTime();
    Exception failure = null;
    try {
      messageHandler.handle(message);
    } catch (Exception ex) {
      failure = ex;
    }
    metrics.observe("consume.handler.latencyNanos", System.nanoTime() - start);
    if (failure == null) {
      commit(message);
    } else {
      handleFailure(message, failure);
    }
  }

  private void commit(Message message) {
    try {
      brokerClient.commitMessages(message);
      metrics.increment("consume.committed");
    } catch (MessagingException | RuntimeException ex) {
      metrics.increment("consume.commit.failed");
      log.error("Cannot commit message [{}] {}/{}: {} = {}",
          message.topic(),
          message.partition(),
          message.offset(),
          Logs.preview(message.key(), Logs.PAYLOAD_PREVIEW_BYTES),
          Logs.preview(message.value(), Logs.PAYLOAD_PREVIEW_BYTES),
          ex);
    }
  }

  private void handleFailure(Message message, Exception failure) {
    metrics.increment("consume.handler.failed");
    log.error("Failed to process message [{}] {}/{} (retry {})",
        message.topic(), message.partition(), message.offset(), message.retryCounter(), failure);
    if (message.retryCounter() >= retryCeiling) {
      log.error("Retries exhausted for [{}] {}/{} after {} attempts; writing to {}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.retryCounter() + 1,
          deadLetterWriter.topic());
      publish(deadLetterWriter, message, 0, "consume.dlq");
    } else {
      int nextRetry = message.retryCounter() + 1;
      log.info("Republishing [{}] {}/{} to {} as retry {}",
          message.topic(), message.partition(), message.offset(), retryWriter.topic(), nextRetry);
      publish(retryWriter, message, nextRetry, "consume.retried");
    }
  }

  private void publish(MessageWriter writer, Message message, int retryCounter, String counter) {
    try {
      writer.writeWithRetryCounter(message.key(), message.value(), retryCounter);
      metrics.increment(counter);
    } catch (PublishException | RuntimeException ex) {
      metrics.increment("consume.publish.failed");
      log.error("Cannot publish message [{}] {}/{} to {}; message dropped",
          message.topic(), message.partition(), message.offset(), writer.topic(), ex);
    }
  }

  private void logFetchFailure(Exception ex) {
    if (closed.get()) {
      log.info("Fetch on topic {} ended after close", topic);
      return;
    }
    metrics.increment("consume.fetch.failed");
    log.warn("Fetch on topic {} failed; stopping consumption", topic, ex);
  }

  private void awaitWorker() {
    ExecutorService executor = worker;
    if (executor == null || Thread.currentThread() == workerThread.get()) {
      return;
    }
    try {
      if (!executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Consume loop for topic {} did not stop within {} ms", topic, WORKER_SHUTDOWN_TIMEOUT.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for consume loop on topic {} to stop", topic);
    }
  }

  private MessagingException closeWriter(MessageWriter writer, MessagingException failure) {
    try {
      writer.close();
      return failure;
    } catch (RuntimeException ex) {
      MessagingException wrapped =
          new MessagingException("failed to close writer for topic " + writer.topic(), ex);
      if (failure == null) {
        return wrapped;
      }
      failure.addSuppressed(wrapped);
      return failure;
    }
  }
}
