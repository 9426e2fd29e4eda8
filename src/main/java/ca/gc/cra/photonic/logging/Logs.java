package ca.gc.cra.photonic.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps external tool output to a bounded size before it reaches logs and errors.
 * <p><strong>Why:</strong> ffmpeg, Hugin, and RAW converters can print megabytes of progress text; failure
 * messages only need the tail where the actual error sits.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, keeping the head.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string with a length marker when the input exceeds {@code maxBytes}
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
    String head = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    return stripBrokenTail(head) + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Keeps the last {@code maxBytes} of a tool log, prefixed with a marker when anything was dropped.
   *
   * @param value tool output; {@code null} yields an empty string
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the tail of {@code value}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String tail(String value, int maxBytes) {
    if (value == null) {
      return "";
    }
    requirePositive(maxBytes);
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int start = bytes.length - maxBytes;
    // skip continuation bytes so the tail starts on a code point
    while (start < bytes.length && (bytes[start] & 0xC0) == 0x80) {
      start++;
    }
    return "... " + new String(bytes, start, bytes.length - start, StandardCharsets.UTF_8);
  }

  private static void requirePositive(int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
  }

  private static String stripBrokenTail(String decoded) {
    if (!decoded.isEmpty() && decoded.charAt(decoded.length() - 1) == '\uFFFD') {
      return decoded.substring(0, decoded.length() - 1);
    }
    return decoded;
  }
}
