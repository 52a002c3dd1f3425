package com.consullo.bridge.capture;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Output buffer configuration values.
 *
 * @param strategy buffering strategy
 * @param flushInterval minimum time between timer-driven flushes
 * @param maxBufferSize capacity of the ring buffer of recent lines
 * @param maxPendingLines pending queue size above which a flush is forced
 * @param lineFlushThreshold pending lines that trigger a flush under {@link BufferStrategy#LINE_BUFFERED}
 * @since 1.0
 */
public record OutputBufferConfig(
    BufferStrategy strategy,
    Duration flushInterval,
    int maxBufferSize,
    int maxPendingLines,
    int lineFlushThreshold) {

  public OutputBufferConfig {
    Validate.notNull(strategy, "strategy must not be null");
    Validate.notNull(flushInterval, "flushInterval must not be null");
    Validate.isTrue(!flushInterval.isNegative() && !flushInterval.isZero(), "flushInterval must be positive");
    Validate.isTrue(maxBufferSize > 0, "maxBufferSize must be positive");
    Validate.isTrue(maxPendingLines > 0, "maxPendingLines must be positive");
    Validate.isTrue(lineFlushThreshold > 0, "lineFlushThreshold must be positive");
  }

  /**
   * Defaults: smart strategy, 2 s flush interval, 1000 recent lines, flush above 20 pending lines.
   *
   * @return default configuration
   */
  public static OutputBufferConfig defaults() {
    return new OutputBufferConfig(BufferStrategy.SMART, Duration.ofSeconds(2), 1000, 20, 5);
  }

  public OutputBufferConfig withStrategy(final BufferStrategy value) {
    return new OutputBufferConfig(value, flushInterval, maxBufferSize, maxPendingLines, lineFlushThreshold);
  }

  public OutputBufferConfig withFlushInterval(final Duration value) {
    return new OutputBufferConfig(strategy, value, maxBufferSize, maxPendingLines, lineFlushThreshold);
  }
}
