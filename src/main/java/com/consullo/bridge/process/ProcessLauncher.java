package com.consullo.bridge.process;

/**
 * Spawns a {@link ChildProcess} for a validated configuration.
 *
 * <p>The working directory exists and the executable has been resolved before {@link #launch} is called.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ProcessLauncher {

  /** Plain pipes for stdin, stdout and stderr. */
  ProcessLauncher PIPES = PipeChildProcess::start;

  /** Pseudo-terminal for stdin and stdout, separate stderr. */
  ProcessLauncher PTY = PtyChildProcess::start;

  /**
   * Spawns the child.
   *
   * @param config process configuration
   * @return running child
   * @throws ProcessStartException if the child cannot be spawned
   */
  ChildProcess launch(final ProcessConfig config) throws ProcessStartException;
}
