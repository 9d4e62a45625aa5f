package ca.gc.cra.courier.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortPayloadIsRenderedVerbatim() {
    assertEquals("hello", Logs.preview("hello".getBytes(StandardCharsets.UTF_8), 16));
  }

  @Test
  void longPayloadIsTruncatedWithMarker() {
    String preview = Logs.preview("abcdefghij".getBytes(StandardCharsets.UTF_8), 4);

    assertTrue(preview.startsWith("abcd... (truncated, 4 of 10)"), preview);
  }

  @Test
  void splitMultibyteCharacterIsDropped() {
    String preview = Logs.preview("é€".getBytes(StandardCharsets.UTF_8), 3);

    assertTrue(preview.startsWith("é..."), preview);
  }

  @Test
  void nullRendersPlaceholder() {
    assertEquals("<null>", Logs.preview(null, 4));
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.preview(new byte[] {1}, 0));
  }
}
