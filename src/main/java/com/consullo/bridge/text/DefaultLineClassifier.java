package com.consullo.bridge.text;

import java.util.Locale;

/**
 * Default line classification heuristics.
 *
 * <p>
 * This classifier is intentionally conservative and keyword driven. Checks run in a fixed order so that a line such
 * as {@code "Error: build 50% failed"} is an error rather than progress:
 * <ol>
 * <li>error: error, failed, exception</li>
 * <li>warning: warning, warn</li>
 * <li>success: success, complete, done, check mark</li>
 * <li>progress: spinner glyphs, percentages, bracketed or block bars, "loading..." status lines</li>
 * <li>info: file operations and command start lines</li>
 * <li>code: lines that open like source code</li>
 * </ol>
 * No regex is used.
 * </p>
 */
public final class DefaultLineClassifier implements LineClassifier {

  private static final String[] ERROR_KEYWORDS = {"error", "failed", "exception"};
  private static final String[] SUCCESS_KEYWORDS = {"success", "complete"};
  private static final String[] INFO_MARKERS = {"created file", "modified file", "deleted file"};
  private static final String[] CODE_PREFIXES = {
      "def ", "function ", "class ", "import ", "#include", "package ", "public class ", "const ", "fn ", "func "
  };
  private static final String[] PROMPT_WORDS = {"enter", "continue", "press", "confirm"};

  @Override
  public LineType classify(final String text) {
    if (text == null || text.isEmpty()) {
      return LineType.NORMAL;
    }
    final String lower = text.toLowerCase(Locale.ROOT);

    if (containsAny(lower, ERROR_KEYWORDS)) {
      return LineType.ERROR;
    }
    if (lower.contains("warning") || containsWord(lower, "warn")) {
      return LineType.WARNING;
    }
    if (containsAny(lower, SUCCESS_KEYWORDS) || containsWord(lower, "done") || text.indexOf('✅') >= 0) {
      return LineType.SUCCESS;
    }
    if (isLikelyProgressLine(text) || isLikelySpinnerLine(text)) {
      return LineType.PROGRESS;
    }
    if (containsAny(lower, INFO_MARKERS) || lower.startsWith("running:") || lower.startsWith("running ")) {
      return LineType.INFO;
    }
    if (isLikelyCode(text)) {
      return LineType.CODE;
    }
    return LineType.NORMAL;
  }

  @Override
  public boolean isInteractivePrompt(final String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    if (text.indexOf('?') >= 0) {
      return true;
    }
    final String lower = text.toLowerCase(Locale.ROOT);
    for (String word : PROMPT_WORDS) {
      if (containsWord(lower, word)) {
        return true;
      }
    }
    return lower.contains("(y/n)") || lower.contains("[y/n]");
  }

  static boolean isLikelySpinnerLine(final String s) {
    // Common patterns: "Working |", "|", "-", "\", "..."
    final String t = s.trim();
    final int n = t.length();
    if (n == 0) {
      return false;
    }
    if (n == 1) {
      return isSpinnerGlyph(t.charAt(0));
    }
    if (n <= 3 && allDots(t)) {
      return true;
    }
    // Many spinners update the last char.
    final char last = t.charAt(n - 1);
    if (isSpinnerGlyph(last) && t.charAt(n - 2) == ' ') {
      int letters = 0;
      for (int i = 0; i < n - 2; i++) {
        final char c = t.charAt(i);
        if (Character.isLetter(c)) {
          letters++;
        } else if (c != ' ') {
          return false;
        }
      }
      return letters > 0;
    }
    // Braille spinner leading a status line.
    return isBrailleGlyph(t.charAt(0));
  }

  static boolean isLikelyProgressLine(final String s) {
    if (containsPercent(s)) {
      return true;
    }
    // Bracketed bar: "[=====>   ]"
    final int open = s.indexOf('[');
    final int close = s.lastIndexOf(']');
    if (open >= 0 && close > open) {
      int bar = 0;
      for (int i = open + 1; i < close; i++) {
        final char c = s.charAt(i);
        if (c == '=' || c == '#' || c == '-' || c == '>') {
          bar++;
        }
      }
      if (bar >= 3) {
        return true;
      }
    }
    if (longestBlockRun(s) >= 10) {
      return true;
    }
    final String lower = s.trim().toLowerCase(Locale.ROOT);
    if (lower.startsWith("loading") || lower.startsWith("thinking") || lower.startsWith("working")
        || lower.startsWith("processing") || lower.startsWith("please wait")) {
      return lower.endsWith("...") || lower.endsWith("…");
    }
    return false;
  }

  private static boolean isLikelyCode(final String s) {
    final String t = s.stripLeading();
    for (String prefix : CODE_PREFIXES) {
      if (t.startsWith(prefix)) {
        return true;
      }
    }
    final String r = t.stripTrailing();
    return r.endsWith("{") || r.equals("}") || r.equals("};") || r.startsWith("} ");
  }

  private static boolean containsPercent(final String s) {
    // A digit immediately followed by '%'.
    for (int i = 1; i < s.length(); i++) {
      if (s.charAt(i) == '%') {
        final char prev = s.charAt(i - 1);
        if (prev >= '0' && prev <= '9') {
          return true;
        }
      }
    }
    return false;
  }

  private static int longestBlockRun(final String s) {
    int best = 0;
    int run = 0;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      // Block elements U+2580..U+259F cover full, partial and shaded blocks.
      if (c >= 0x2580 && c <= 0x259F) {
        run++;
        best = Math.max(best, run);
      } else {
        run = 0;
      }
    }
    return best;
  }

  private static boolean isSpinnerGlyph(final char c) {
    // ASCII spinners
    if (c == '|' || c == '/' || c == '\\' || c == '-') {
      return true;
    }
    return isBrailleGlyph(c);
  }

  private static boolean isBrailleGlyph(final char c) {
    // Braille patterns: U+2800..U+28FF
    return c >= 0x2800 && c <= 0x28FF;
  }

  private static boolean allDots(final String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != '.') {
        return false;
      }
    }
    return s.length() > 0;
  }

  private static boolean containsAny(final String s, final String[] needles) {
    for (String needle : needles) {
      if (s.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if {@code word} occurs in {@code s} delimited by non-letters.
   */
  static boolean containsWord(final String s, final String word) {
    int from = 0;
    while (true) {
      final int at = s.indexOf(word, from);
      if (at < 0) {
        return false;
      }
      final int end = at + word.length();
      final boolean leftOk = at == 0 || !Character.isLetter(s.charAt(at - 1));
      final boolean rightOk = end == s.length() || !Character.isLetter(s.charAt(end));
      if (leftOk && rightOk) {
        return true;
      }
      from = at + 1;
    }
  }
}
