package com.consullo.bridge.capture;

import com.consullo.bridge.process.StreamKind;
import com.consullo.bridge.text.LineType;
import java.time.Instant;

/**
 * One line of child output as held by the {@link OutputBuffer}.
 *
 * @param content raw line as read from the process
 * @param text normalized line (escape sequences removed, carriage-return rewrites applied)
 * @param timestamp arrival time
 * @param sessionId owning session
 * @param type classified or caller-supplied line type
 * @param stream channel the line was read from
 * @param metadata analysis details
 * @since 1.0
 */
public record OutputLine(
    String content,
    String text,
    Instant timestamp,
    String sessionId,
    LineType type,
    StreamKind stream,
    Metadata metadata) {

  /**
   * Line analysis details.
   *
   * @param hadEscapes true if the raw line contained escape sequences
   * @param escapeOverhead number of characters removed by normalization
   * @param interactivePrompt true if the line looked like a prompt waiting for input
   */
  public record Metadata(
      boolean hadEscapes,
      int escapeOverhead,
      boolean interactivePrompt) {
  }
}
