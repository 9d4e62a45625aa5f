package ca.gc.cra.courier.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene helpers for message keys and payloads.
 * <p><strong>Why:</strong> Every fetched message is logged at INFO; unbounded payloads would flood operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Allocates at most {@code maxBytes} for the decoder buffer.</p>
 *
 * @implNote Decoding ignores malformed input so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to keys and values in per-message log lines. */
  public static final int PAYLOAD_PREVIEW_BYTES = 256;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders a UTF-8 payload for logging, truncated to {@code maxBytes}.
   *
   * @param payload raw bytes; {@code null} renders as {@code "<null>"}
   * @param maxBytes maximum number of bytes to decode; must be positive
   * @return printable preview with a truncation marker when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (payload.length <= maxBytes) {
      return new String(payload, StandardCharsets.UTF_8);
    }
    return decodePrefix(payload, maxBytes) + "... (truncated, " + maxBytes + " of " + payload.length + ")";
  }

  private static String decodePrefix(byte[] bytes, int maxBytes) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer.toString();
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
  }
}
