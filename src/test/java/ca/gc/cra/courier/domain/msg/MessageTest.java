package ca.gc.cra.courier.domain.msg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MessageTest {

  @Test
  void copiesPayloadOnConstruction() {
    byte[] value = "hello".getBytes(StandardCharsets.UTF_8);
    Message message = new Message("orders", null, value, Instant.EPOCH, 0, 5L, 0);

    value[0] = 'j';

    assertEquals("hello", message.valueAsString());
    assertNull(message.key());
    assertNull(message.keyAsString());
  }

  @Test
  void equalityComparesPayloadContent() {
    Message a = new Message("orders", bytes("k"), bytes("v"), Instant.EPOCH, 1, 2L, 3);
    Message b = new Message("orders", bytes("k"), bytes("v"), Instant.EPOCH, 1, 2L, 3);
    Message c = new Message("orders", bytes("k"), bytes("other"), Instant.EPOCH, 1, 2L, 3);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  void missingTimeDefaultsToEpoch() {
    Message message = new Message("orders", null, null, null, 0, 0L, 0);

    assertEquals(Instant.EPOCH, message.time());
  }

  @Test
  void rejectsNegativeRetryCounterAndMissingTopic() {
    assertThrows(IllegalArgumentException.class,
        () -> new Message("orders", null, null, Instant.EPOCH, 0, 0L, -1));
    assertThrows(NullPointerException.class,
        () -> new Message(null, null, null, Instant.EPOCH, 0, 0L, 0));
  }

  @Test
  void toStringOmitsPayload() {
    Message message = new Message("orders", bytes("secret-key"), bytes("secret"), Instant.EPOCH, 0, 9L, 1);

    String text = message.toString();
    assertFalse(text.contains("secret"));
    assertTrue(text.contains("valueBytes=6"));
  }

  @Test
  void deadLetterTopicAppendsSuffix() {
    assertEquals("orders.dlq", Topics.deadLetterTopic("orders"));
    assertTrue(Topics.isDeadLetterTopic("orders.dlq"));
    assertFalse(Topics.isDeadLetterTopic("orders"));
    assertFalse(Topics.isDeadLetterTopic(null));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
