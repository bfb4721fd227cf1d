package ca.gc.cra.rdt.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep payload dumps bounded.
 * <p><strong>Why:</strong> Trace logging of segments must not flood operator logs with full payloads.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by endpoints and connections.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Allocates transient buffers proportional to the requested budget.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#REPLACE} so binary payloads never raise.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxBytes);
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    return decode(bytes, maxBytes) + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Renders a payload preview: printable text is shown as text, anything else as hex.
   *
   * @param payload payload bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to render; must be positive
   * @return bounded preview with a length suffix when truncated
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(byte[] payload, int maxBytes) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxBytes);
    int shown = Math.min(payload.length, maxBytes);
    String body = isPrintable(payload, shown) ? '"' + decode(payload, shown) + '"' : hex(payload, shown);
    if (shown < payload.length) {
      return body + "... (" + payload.length + " bytes)";
    }
    return body;
  }

  private static boolean isPrintable(byte[] payload, int length) {
    for (int i = 0; i < length; i++) {
      int b = payload[i] & 0xFF;
      if ((b < 0x20 || b > 0x7E) && b != '\n' && b != '\r' && b != '\t') {
        return false;
      }
    }
    return true;
  }

  private static String hex(byte[] payload, int length) {
    StringBuilder sb = new StringBuilder(length * 2 + 2).append("0x");
    for (int i = 0; i < length; i++) {
      sb.append(HEX[(payload[i] >>> 4) & 0x0F]).append(HEX[payload[i] & 0x0F]);
    }
    return sb.toString();
  }

  private static String decode(byte[] bytes, int length) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, length));
      return buffer.toString();
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
  }

  private static void requirePositive(int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
  }
}
