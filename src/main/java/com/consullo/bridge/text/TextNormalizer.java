package com.consullo.bridge.text;

/**
 * Turns one raw output line into the text a reader would see on a terminal.
 *
 * <p>
 * Steps:
 * <ul>
 * <li>strip escape sequences ({@link AnsiStripper})</li>
 * <li>carriage return: only the text written after the last CR survives (spinner and progress rewrites)</li>
 * <li>backspace erases the previous character</li>
 * <li>remaining C0 controls and DEL are dropped, tab is kept</li>
 * <li>trailing whitespace and NUL padding are trimmed</li>
 * </ul>
 * </p>
 *
 * <p>Cursor movement and screen addressing are not emulated.
 *
 * @since 1.0
 */
public final class TextNormalizer {

  private TextNormalizer() {
  }

  /**
   * Normalizes a single line.
   *
   * @param line raw line, without its line terminator (may be null)
   * @return normalized text, never null
   */
  public static String normalize(final String line) {
    if (line == null || line.isEmpty()) {
      return "";
    }

    String s = AnsiStripper.strip(line);
    s = applyCarriageReturns(s);

    final StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '\b') {
        if (sb.length() > 0) {
          sb.setLength(sb.length() - 1);
        }
        continue;
      }
      if (c == '\t') {
        sb.append(c);
        continue;
      }
      if (c < 0x20 || c == 0x7F) {
        continue;
      }
      sb.append(c);
    }
    return rightTrim(sb.toString());
  }

  /**
   * Keeps the last carriage-return segment that holds visible text. A trailing CR (as in CRLF) is ignored.
   */
  private static String applyCarriageReturns(final String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '\r') {
      end--;
    }
    final int cr = s.lastIndexOf('\r', end - 1);
    if (cr < 0) {
      return end == s.length() ? s : s.substring(0, end);
    }
    final String last = s.substring(cr + 1, end);
    if (!isBlank(last)) {
      return last;
    }
    // "text\r   " clears nothing visible; fall back to the previous segment.
    return applyCarriageReturns(s.substring(0, cr));
  }

  private static boolean isBlank(final String s) {
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c != ' ' && c != '\t' && c != '\0') {
        return false;
      }
    }
    return true;
  }

  static String rightTrim(final String s) {
    // Right-trim whitespace (including NUL chars which terminals use for empty cells)
    int n = s.length();
    while (n > 0) {
      final char c = s.charAt(n - 1);
      if (c == ' ' || c == '\0' || c == '\t') {
        n--;
      } else {
        break;
      }
    }
    if (n == s.length()) {
      return s;
    }
    return s.substring(0, n);
  }
}
