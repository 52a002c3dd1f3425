package com.consullo.bridge.text;

/**
 * Removes terminal escape sequences from text without touching any other character.
 *
 * <p>
 * Recognized grammars:
 * <ul>
 * <li>CSI: {@code ESC [} parameter bytes (0x30..0x3F), intermediate bytes (0x20..0x2F), final byte (0x40..0x7E)</li>
 * <li>OSC: {@code ESC ]} ... terminated by BEL, {@code ESC \} or ST (U+009C)</li>
 * <li>DCS, SOS, PM, APC: {@code ESC P}, {@code ESC X}, {@code ESC ^}, {@code ESC _} ... terminated by {@code ESC \} or ST</li>
 * <li>nF escapes: {@code ESC} intermediate bytes (0x20..0x2F) followed by a final byte (0x30..0x7E), e.g. {@code ESC ( B}</li>
 * <li>single-character escapes: {@code ESC} followed by one byte in 0x30..0x7E, e.g. {@code ESC 7}, {@code ESC M}</li>
 * </ul>
 * </p>
 *
 * <p>
 * A sequence that is still open at the end of the input is discarded entirely, so partial escape bytes never leak
 * into the output. A lone ESC followed by a byte that starts no grammar is dropped and the byte is kept. No regex is
 * used; the scanner is a single forward pass.
 * </p>
 *
 * <p>The output never contains ESC, so {@code strip(strip(x)).equals(strip(x))} for every input.
 *
 * @since 1.0
 */
public final class AnsiStripper {

  static final char ESC = 0x1B;
  static final char BEL = 0x07;
  static final char ST = 0x9C;

  private AnsiStripper() {
  }

  /**
   * Returns the text with every recognized escape sequence removed.
   *
   * @param text input (may be null)
   * @return stripped text, or the input itself when it holds no ESC
   */
  public static String strip(final String text) {
    if (text == null || text.indexOf(ESC) < 0) {
      return text;
    }

    final int n = text.length();
    final StringBuilder out = new StringBuilder(n);
    int i = 0;
    while (i < n) {
      final char c = text.charAt(i);
      if (c != ESC) {
        out.append(c);
        i++;
        continue;
      }
      i = skipEscape(text, i);
    }
    return out.toString();
  }

  /**
   * Returns true if the text contains at least one ESC character.
   *
   * @param text input (may be null)
   * @return true if escape sequences may be present
   */
  public static boolean containsEscape(final String text) {
    return text != null && text.indexOf(ESC) >= 0;
  }

  /**
   * Skips the escape sequence starting at {@code start} (which holds ESC).
   *
   * @return index of the first character after the sequence
   */
  private static int skipEscape(final String s, final int start) {
    final int n = s.length();
    final int next = start + 1;
    if (next >= n) {
      return n;
    }

    final char kind = s.charAt(next);
    switch (kind) {
      case '[':
        return skipCsi(s, next + 1);
      case ']':
        return skipString(s, next + 1, true);
      case 'P':
      case 'X':
      case '^':
      case '_':
        return skipString(s, next + 1, false);
      default:
        break;
    }

    if (kind >= 0x20 && kind <= 0x2F) {
      return skipNf(s, next);
    }
    if (kind >= 0x30 && kind <= 0x7E) {
      return next + 1;
    }
    // Not an escape grammar: drop the ESC, keep the following character.
    return next;
  }

  private static int skipCsi(final String s, final int from) {
    final int n = s.length();
    int i = from;
    while (i < n) {
      final char c = s.charAt(i);
      if (c >= 0x30 && c <= 0x3F) {
        i++;
        continue;
      }
      break;
    }
    while (i < n) {
      final char c = s.charAt(i);
      if (c >= 0x20 && c <= 0x2F) {
        i++;
        continue;
      }
      break;
    }
    if (i >= n) {
      return n;
    }
    final char fin = s.charAt(i);
    if (fin >= 0x40 && fin <= 0x7E) {
      return i + 1;
    }
    // Malformed: the sequence ends before the offending character, which is kept.
    return i;
  }

  private static int skipString(final String s, final int from, final boolean belTerminates) {
    final int n = s.length();
    int i = from;
    while (i < n) {
      final char c = s.charAt(i);
      if (c == ST) {
        return i + 1;
      }
      if (belTerminates && c == BEL) {
        return i + 1;
      }
      if (c == ESC) {
        if (i + 1 < n && s.charAt(i + 1) == '\\') {
          return i + 2;
        }
        // A new escape aborts the string; let the caller scan it.
        return i;
      }
      i++;
    }
    return n;
  }

  private static int skipNf(final String s, final int from) {
    final int n = s.length();
    int i = from;
    while (i < n) {
      final char c = s.charAt(i);
      if (c >= 0x20 && c <= 0x2F) {
        i++;
        continue;
      }
      break;
    }
    if (i >= n) {
      return n;
    }
    final char fin = s.charAt(i);
    if (fin >= 0x30 && fin <= 0x7E) {
      return i + 1;
    }
    return i;
  }
}
