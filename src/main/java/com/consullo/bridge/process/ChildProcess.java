package com.consullo.bridge.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal handle on a spawned child process.
 *
 * <p>Implementations must provide:
 * - access to the child's stdin/stdout/stderr streams
 * - graceful and forced termination
 * - exit monitoring
 *
 * @since 1.0
 */
public interface ChildProcess {

  InputStream stdout();

  InputStream stderr();

  OutputStream stdin();

  /**
   * Returns a future completed with the exit code once the child has exited.
   *
   * @return exit future
   */
  CompletableFuture<Integer> onExit();

  long pid();

  boolean isAlive();

  /**
   * Requests graceful termination (SIGTERM on Unix).
   */
  void destroy();

  /**
   * Kills the child (SIGKILL on Unix).
   */
  void destroyForcibly();

  /**
   * Waits for the child to exit.
   *
   * @param timeout maximum wait
   * @return true if the child exited within the timeout
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean waitFor(final Duration timeout) throws InterruptedException;
}
