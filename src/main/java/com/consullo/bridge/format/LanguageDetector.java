package com.consullo.bridge.format;

import java.util.Locale;

/**
 * Guesses the source language of a text block for code-fence syntax highlighting.
 *
 * <p>Languages are tried in a fixed order (python, javascript, bash, json, yaml, xml, sql) and the first match wins.
 * The result is a fence tag such as {@code "python"}, or an empty string when nothing matches.
 *
 * @since 1.0
 */
public final class LanguageDetector {

  private LanguageDetector() {
  }

  /**
   * Detects the language of the given text.
   *
   * @param text text block (may be null)
   * @return fence tag, never null
   */
  public static String detect(final String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    final String[] lines = text.split("\n", -1);
    if (isPython(text, lines)) {
      return "python";
    }
    if (isJavaScript(text)) {
      return "javascript";
    }
    if (isBash(text, lines)) {
      return "bash";
    }
    if (isJson(lines)) {
      return "json";
    }
    if (isYaml(lines)) {
      return "yaml";
    }
    if (isXml(text)) {
      return "xml";
    }
    if (isSql(text)) {
      return "sql";
    }
    return "";
  }

  /**
   * Returns true if the text contains constructs that are typical for source code.
   *
   * @param text text block (may be null)
   * @return true if the text looks like code
   */
  public static boolean looksLikeCode(final String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    if (containsCallPrefixed(text, "def ") || containsCallPrefixed(text, "function ")
        || text.contains("#include <") || text.contains("#include<")) {
      return true;
    }
    for (String line : text.split("\n", -1)) {
      final String t = line.stripLeading();
      if (t.startsWith("class ") || t.startsWith("import ") || t.startsWith("package ")
          || (t.startsWith("from ") && t.contains(" import "))) {
        return true;
      }
      if (!t.isEmpty() && "{}()[];,".indexOf(t.charAt(0)) >= 0) {
        return true;
      }
      if (containsMethodCall(t)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isPython(final String text, final String[] lines) {
    if (containsCallPrefixed(text, "def ") || text.contains("__name__ ==") || text.contains("__name__==")) {
      return true;
    }
    for (String line : lines) {
      final String t = line.stripLeading();
      if (t.startsWith("from ") && t.contains(" import ")) {
        return true;
      }
      if (t.startsWith("import ") && !t.contains(";") && !t.contains(" from ")) {
        return true;
      }
    }
    return false;
  }

  private static boolean isJavaScript(final String text) {
    return containsCallPrefixed(text, "function ") || text.contains("const ") || text.contains("let ")
        || text.contains("=>");
  }

  private static boolean isBash(final String text, final String[] lines) {
    if (text.contains("#!/bin/bash") || text.contains("#!/bin/sh")) {
      return true;
    }
    for (String line : lines) {
      final String t = line.stripLeading();
      if (t.startsWith("$ ") || t.startsWith("cd ") || t.startsWith("ls ")) {
        return true;
      }
    }
    return false;
  }

  private static boolean isJson(final String[] lines) {
    final String first = firstNonBlank(lines);
    if (first.startsWith("{") || first.startsWith("[")) {
      for (String line : lines) {
        if (line.contains("\":")) {
          return true;
        }
      }
      return first.startsWith("[");
    }
    return false;
  }

  private static boolean isYaml(final String[] lines) {
    int keyed = 0;
    int nonBlank = 0;
    for (String line : lines) {
      final String t = line.strip();
      if (t.isEmpty()) {
        continue;
      }
      nonBlank++;
      if (t.startsWith("- ") || isYamlKey(t)) {
        keyed++;
      }
    }
    // Require most lines to be keys or list items, otherwise prose with a colon would match.
    return nonBlank > 1 && keyed * 2 > nonBlank;
  }

  private static boolean isYamlKey(final String t) {
    final int colon = t.indexOf(':');
    if (colon <= 0) {
      return false;
    }
    for (int i = 0; i < colon; i++) {
      final char c = t.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_' && c != '-') {
        return false;
      }
    }
    return colon == t.length() - 1 || t.charAt(colon + 1) == ' ';
  }

  private static boolean isXml(final String text) {
    final int open = text.indexOf('<');
    if (open < 0 || open + 1 >= text.length()) {
      return false;
    }
    return Character.isLetter(text.charAt(open + 1)) && text.indexOf('>', open) > 0
        && (text.contains("</") || text.contains("/>"));
  }

  private static boolean isSql(final String text) {
    final String upper = text.toUpperCase(Locale.ROOT);
    return upper.contains("SELECT ") || upper.contains("INSERT ")
        || (upper.contains("FROM ") && upper.contains("WHERE "));
  }

  /**
   * Returns true if the text holds {@code keyword name(} with an identifier between keyword and parenthesis.
   */
  private static boolean containsCallPrefixed(final String text, final String keyword) {
    int from = 0;
    while (true) {
      final int at = text.indexOf(keyword, from);
      if (at < 0) {
        return false;
      }
      int i = at + keyword.length();
      final int start = i;
      while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
        i++;
      }
      if (i > start && i < text.length() && text.charAt(i) == '(') {
        return true;
      }
      from = at + 1;
    }
  }

  /**
   * Returns true for {@code a.b(} shaped calls.
   */
  private static boolean containsMethodCall(final String line) {
    int dot = line.indexOf('.');
    while (dot > 0) {
      if (isIdentChar(line.charAt(dot - 1))) {
        int i = dot + 1;
        while (i < line.length() && isIdentChar(line.charAt(i))) {
          i++;
        }
        if (i > dot + 1 && i < line.length() && line.charAt(i) == '(') {
          return true;
        }
      }
      dot = line.indexOf('.', dot + 1);
    }
    return false;
  }

  private static boolean isIdentChar(final char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static String firstNonBlank(final String[] lines) {
    for (String line : lines) {
      final String t = line.strip();
      if (!t.isEmpty()) {
        return t;
      }
    }
    return "";
  }
}
