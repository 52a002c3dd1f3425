package com.consullo.bridge.text;

/**
 * Pluggable heuristics applied to normalized output lines.
 *
 * <p>Implementations must be thread-safe; the output buffer calls them from the process reader threads.
 *
 * @since 1.0
 */
public interface LineClassifier {

  /**
   * Classifies a normalized line.
   *
   * @param text normalized line text (escape sequences already removed)
   * @return line type, never null
   */
  LineType classify(final String text);

  /**
   * Returns true if the line looks like the child is waiting for an answer (question, "press enter", confirmation).
   *
   * @param text normalized line text
   * @return true if the line is prompt-like
   */
  boolean isInteractivePrompt(final String text);
}
