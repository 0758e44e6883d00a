package ca.siteguard.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for backend failure details and credentials.
 * <p><strong>Why:</strong> Remote error bodies can be large multi-line JSON and API keys must never reach operator
 * logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since SiteGuard 0.1
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Flattens a failure detail onto one line and cuts it to at most {@code maxBytes} UTF-8 bytes. A code point that
   * would straddle the limit is dropped whole.
   *
   * @param value detail to shorten; {@code null} results in {@code "<null>"}
   * @param maxBytes UTF-8 byte budget for the kept text; must be positive
   * @return the single-line value, with {@code "... (truncated, kept of total)"} appended when it was cut
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder kept = new StringBuilder(Math.min(value.length(), maxBytes));
    int keptBytes = 0;
    int totalBytes = 0;
    boolean full = false;
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      i += Character.charCount(codePoint);
      int width = utf8Width(codePoint);
      totalBytes += width;
      if (!full && keptBytes + width <= maxBytes) {
        keptBytes += width;
        appendFlattened(kept, codePoint);
      } else {
        full = true;
      }
    }
    if (totalBytes <= maxBytes) {
      return kept.toString();
    }
    return kept + "... (truncated, " + maxBytes + " of " + totalBytes + ")";
  }

  /**
   * Returns the redaction placeholder for a credential, keeping only whether one was set.
   *
   * @param value original secret
   * @return {@code "<unset>"} for blank input, otherwise the redacted placeholder
   */
  public static String redact(String value) {
    if (value == null || value.isBlank()) {
      return "<unset>";
    }
    return REDACTED_PLACEHOLDER;
  }

  private static void appendFlattened(StringBuilder out, int codePoint) {
    if (codePoint == '\r' || codePoint == '\n' || codePoint == '\t') {
      out.append(' ');
    } else {
      out.appendCodePoint(codePoint);
    }
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
