package com.consullo.bridge.process;

/**
 * Receives complete lines read from a child's output streams.
 *
 * <p>Called from the reader thread of the respective stream: lines of one stream arrive in emission order, lines
 * of different streams may interleave.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface OutputSink {

  /**
   * Handles one line.
   *
   * @param stream stream the line was read from
   * @param line line without its terminator
   */
  void onLine(final StreamKind stream, final String line);
}
