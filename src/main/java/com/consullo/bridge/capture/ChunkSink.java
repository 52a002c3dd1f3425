package com.consullo.bridge.capture;

import com.consullo.bridge.format.MessageChunk;
import java.util.List;

/**
 * Receives the ordered chunk batches produced by a flush.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ChunkSink {

  /**
   * Delivers one flush worth of chunks. Called from the flushing thread; batches of one buffer never overlap.
   *
   * @param sessionId owning session
   * @param chunks chunks in textual order, never empty
   */
  void deliver(final String sessionId, final List<MessageChunk> chunks);
}
