package com.consullo.bridge.format;

import com.consullo.bridge.text.LineType;
import java.time.Instant;

/**
 * Transport-ready unit of formatted text.
 *
 * @param content decorated text; its length never exceeds the chunker's configured limit
 * @param type aggregate type of the text this chunk was cut from
 * @param priority delivery priority for consumer-side queues (higher first)
 * @param timestamp creation time
 * @param metadata position and formatting details
 * @since 1.0
 */
public record MessageChunk(
    String content,
    LineType type,
    int priority,
    Instant timestamp,
    Metadata metadata) {

  /**
   * Chunk position and formatting details.
   *
   * @param index zero-based index of this chunk within its message. A flush delivers one message per line group, so
   *     a delivered batch may hold several chunks with the same index; the batch's list order is the delivery order
   * @param total number of chunks the message was split into
   * @param language detected source language for code blocks, empty when none
   * @param format decoration applied to {@link MessageChunk#content()}
   * @param text undecorated text of this chunk
   * @param originalLength length of the full text before splitting
   */
  public record Metadata(
      int index,
      int total,
      String language,
      ChunkFormat format,
      String text,
      int originalLength) {
  }

  /**
   * Returns true if this chunk is one part of a multi-part message.
   *
   * @return true if total is greater than one
   */
  public boolean isPartial() {
    return metadata.total() > 1;
  }
}
