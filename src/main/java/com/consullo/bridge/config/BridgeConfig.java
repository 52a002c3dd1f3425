package com.consullo.bridge.config;

import com.consullo.bridge.capture.BufferStrategy;
import com.consullo.bridge.format.MessageChunker;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Validated bridge configuration.
 *
 * @param command command and arguments of the child process
 * @param workingDirectory default working directory of new sessions
 * @param sessionTimeout idle time after which a session is swept
 * @param cleanupInterval interval of the expiry sweep
 * @param maxHistoryLength cap of each session's command history
 * @param maxOutputLength working chunk limit, kept below the transport limit for decoration headroom
 * @param transportMaxLength hard message limit of the chat transport
 * @param flushInterval output buffer flush interval
 * @param bufferStrategy output buffering strategy
 * @param usePty launch the child on a pseudo-terminal instead of pipes
 * @param gracePeriod wait after the graceful termination signal before the child is killed
 * @param ciMode set {@code CI=1} in the child environment to reduce spinners and animations
 * @since 1.0
 */
public record BridgeConfig(
    List<String> command,
    Path workingDirectory,
    Duration sessionTimeout,
    Duration cleanupInterval,
    int maxHistoryLength,
    int maxOutputLength,
    int transportMaxLength,
    Duration flushInterval,
    BufferStrategy bufferStrategy,
    boolean usePty,
    Duration gracePeriod,
    boolean ciMode) {

  public static final List<String> DEFAULT_COMMAND = List.of("claude");
  public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofHours(1);
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);
  public static final int DEFAULT_MAX_HISTORY_LENGTH = 100;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(2);
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);

  public BridgeConfig {
    Validate.notNull(command, "command must not be null");
    Validate.isTrue(!command.isEmpty(), "command must not be empty");
    Validate.noNullElements(command, "command must not contain null elements");
    Validate.notBlank(command.get(0), "command executable must not be blank");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    requirePositive(sessionTimeout, "sessionTimeout");
    requirePositive(cleanupInterval, "cleanupInterval");
    requirePositive(flushInterval, "flushInterval");
    requirePositive(gracePeriod, "gracePeriod");
    Validate.isTrue(maxHistoryLength > 0, "maxHistoryLength must be positive");
    Validate.isTrue(maxOutputLength >= MessageChunker.MIN_MAX_LENGTH,
        "maxOutputLength must be at least %d", MessageChunker.MIN_MAX_LENGTH);
    Validate.isTrue(maxOutputLength <= transportMaxLength,
        "maxOutputLength (%d) must not exceed transportMaxLength (%d)", maxOutputLength, transportMaxLength);
    Validate.notNull(bufferStrategy, "bufferStrategy must not be null");
    command = List.copyOf(command);
  }

  /**
   * Defaults: {@code claude} in the current directory, 1 h session timeout, 5 min sweep, 1900 char chunks.
   *
   * @return default configuration
   */
  public static BridgeConfig defaults() {
    return new BridgeConfig(
        DEFAULT_COMMAND,
        Path.of(".").toAbsolutePath().normalize(),
        DEFAULT_SESSION_TIMEOUT,
        DEFAULT_CLEANUP_INTERVAL,
        DEFAULT_MAX_HISTORY_LENGTH,
        MessageChunker.DEFAULT_MAX_LENGTH,
        MessageChunker.TRANSPORT_MAX_LENGTH,
        DEFAULT_FLUSH_INTERVAL,
        BufferStrategy.SMART,
        false,
        DEFAULT_GRACE_PERIOD,
        false);
  }

  public BridgeConfig withCommand(final List<String> value) {
    return new BridgeConfig(value, workingDirectory, sessionTimeout, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withWorkingDirectory(final Path value) {
    return new BridgeConfig(command, value, sessionTimeout, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withSessionTimeout(final Duration value) {
    return new BridgeConfig(command, workingDirectory, value, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withCleanupInterval(final Duration value) {
    return new BridgeConfig(command, workingDirectory, sessionTimeout, value, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withMaxHistoryLength(final int value) {
    return new BridgeConfig(command, workingDirectory, sessionTimeout, cleanupInterval, value,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withFlushInterval(final Duration value) {
    return new BridgeConfig(command, workingDirectory, sessionTimeout, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, value, bufferStrategy, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withBufferStrategy(final BufferStrategy value) {
    return new BridgeConfig(command, workingDirectory, sessionTimeout, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, value, usePty, gracePeriod, ciMode);
  }

  public BridgeConfig withGracePeriod(final Duration value) {
    return new BridgeConfig(command, workingDirectory, sessionTimeout, cleanupInterval, maxHistoryLength,
        maxOutputLength, transportMaxLength, flushInterval, bufferStrategy, usePty, value, ciMode);
  }

  private static void requirePositive(final Duration value, final String name) {
    Validate.notNull(value, "%s must not be null", name);
    Validate.isTrue(!value.isNegative() && !value.isZero(), "%s must be positive", name);
  }
}
