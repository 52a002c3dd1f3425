package com.consullo.bridge.capture;

/**
 * Output buffering strategies.
 *
 * <p>The immediate-flush triggers of {@link OutputBuffer} (error/success lines, prompts, a full pending queue, a
 * stale buffer) apply to every strategy.
 *
 * @since 1.0
 */
public enum BufferStrategy {
  /** Flush on every line. */
  IMMEDIATE,
  /** Flush whenever the pending queue reaches the configured line threshold. */
  LINE_BUFFERED,
  /** Flush on the flush interval only, polling at a fixed rate. */
  TIME_WINDOWED,
  /** Flush on the flush interval, polling faster while output arrives in bursts. */
  SMART
}
