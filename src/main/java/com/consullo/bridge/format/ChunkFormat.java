package com.consullo.bridge.format;

/**
 * Decoration applied to a chunk's text.
 *
 * @since 1.0
 */
public enum ChunkFormat {
  /** Text as is. */
  PLAIN,
  /** Wrapped in a fenced code block with an optional language tag. */
  CODE_BLOCK,
  /** Wrapped in single backticks. */
  INLINE_CODE,
  /** Text as is; the transport renders it as an embed or card. */
  EMBED
}
