package ca.gc.cra.courier.adapter.kafka;

import ca.gc.cra.courier.domain.msg.Message;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.record.RecordBatch;

/**
 * Maps Kafka records to {@link Message} values and encodes the retry counter header.
 *
 * <p>The retry counter travels as header {@value #RETRY_COUNT_HEADER} holding the decimal UTF-8 value.
 * Missing or unreadable headers decode to {@code 0}.</p>
 *
 * @since 0.1.0
 */
final class KafkaRecords {
  static final String RETRY_COUNT_HEADER = "retryCount";

  private KafkaRecords() {}

  static Message toMessage(ConsumerRecord<byte[], byte[]> record) {
    long timestamp = record.timestamp();
    Instant time = timestamp == RecordBatch.NO_TIMESTAMP ? Instant.EPOCH : Instant.ofEpochMilli(timestamp);
    return new Message(
        record.topic(),
        record.key(),
        record.value(),
        time,
        record.partition(),
        record.offset(),
        decodeRetryCount(record.headers()));
  }

  static Iterable<Header> retryHeaders(int retryCounter) {
    if (retryCounter < 0) {
      throw new IllegalArgumentException("retryCounter must not be negative (was " + retryCounter + ")");
    }
    byte[] encoded = Integer.toString(retryCounter).getBytes(StandardCharsets.UTF_8);
    return List.of(new RecordHeader(RETRY_COUNT_HEADER, encoded));
  }

  static int decodeRetryCount(Headers headers) {
    if (headers == null) {
      return 0;
    }
    Header header = headers.lastHeader(RETRY_COUNT_HEADER);
    if (header == null || header.value() == null || header.value().length == 0) {
      return 0;
    }
    String raw = new String(header.value(), StandardCharsets.UTF_8).trim();
    try {
      return Math.max(0, Integer.parseInt(raw));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
