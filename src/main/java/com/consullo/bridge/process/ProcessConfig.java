package com.consullo.bridge.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for spawning and supervising a child process.
 *
 * @param command command and arguments (e.g., ["claude"])
 * @param workingDirectory working directory for the spawned process, created when absent
 * @param environment environment variables to add/override (may be empty)
 * @param gracePeriod wait after the graceful termination signal before the child is killed, and again for the reap
 *     after the kill; must be positive
 * @param inputTimeout upper bound for one write to the child's stdin
 * @since 1.0
 */
public record ProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    Duration gracePeriod,
    Duration inputTimeout) {

  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);
  public static final Duration DEFAULT_INPUT_TIMEOUT = Duration.ofSeconds(5);

  public ProcessConfig {
    Validate.notNull(command, "command must not be null");
    Validate.isTrue(!command.isEmpty(), "command must not be empty");
    Validate.notBlank(command.get(0), "executable must not be blank");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.notNull(gracePeriod, "gracePeriod must not be null");
    Validate.notNull(inputTimeout, "inputTimeout must not be null");
    Validate.isTrue(!gracePeriod.isNegative() && !gracePeriod.isZero(), "gracePeriod must be positive");
    Validate.isTrue(!inputTimeout.isNegative() && !inputTimeout.isZero(), "inputTimeout must be positive");
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Creates a configuration with default grace period and input timeout.
   *
   * @param command command and arguments
   * @param workingDirectory working directory
   * @return configuration
   */
  public static ProcessConfig of(final List<String> command, final Path workingDirectory) {
    return new ProcessConfig(command, workingDirectory, Map.of(), DEFAULT_GRACE_PERIOD, DEFAULT_INPUT_TIMEOUT);
  }

  public ProcessConfig withEnvironment(final Map<String, String> value) {
    return new ProcessConfig(command, workingDirectory, value, gracePeriod, inputTimeout);
  }

  public ProcessConfig withGracePeriod(final Duration value) {
    return new ProcessConfig(command, workingDirectory, environment, value, inputTimeout);
  }

  public ProcessConfig withWorkingDirectory(final Path value) {
    return new ProcessConfig(command, value, environment, gracePeriod, inputTimeout);
  }
}
