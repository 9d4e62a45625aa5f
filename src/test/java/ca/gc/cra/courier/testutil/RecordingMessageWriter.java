package ca.gc.cra.courier.testutil;

import ca.gc.cra.courier.application.port.MessageWriter;
import ca.gc.cra.courier.application.port.PublishException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/** {@link MessageWriter} that records publishes and can be told to fail or to loop them back. */
public final class RecordingMessageWriter implements MessageWriter {
  /** One recorded publish. */
  public record Published(String key, String value, int retryCounter) {}

  private final String topic;
  private final List<Published> published = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile PublishException failure;
  private volatile Consumer<Published> onPublish = published -> { };

  public RecordingMessageWriter(String topic) {
    this.topic = topic;
  }

  /** Makes every subsequent publish fail with {@code failure}. */
  public void failWith(PublishException failure) {
    this.failure = failure;
  }

  /** Invokes {@code callback} after each successful publish, for example to redeliver it. */
  public void onPublish(Consumer<Published> callback) {
    this.onPublish = callback;
  }

  @Override
  public String topic() {
    return topic;
  }

  @Override
  public void writeWithRetryCounter(byte[] key, byte[] value, int retryCounter) throws PublishException {
    PublishException current = failure;
    if (current != null) {
      throw current;
    }
    Published record = new Published(text(key), text(value), retryCounter);
    published.add(record);
    onPublish.accept(record);
  }

  @Override
  public void close() {
    closed.set(true);
  }

  public List<Published> published() {
    return List.copyOf(published);
  }

  public boolean isClosed() {
    return closed.get();
  }

  private static String text(byte[] bytes) {
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }
}
