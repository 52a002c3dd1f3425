package com.consullo.bridge.process;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Child process attached to plain stdin/stdout/stderr pipes, spawned with {@link ProcessBuilder}.
 *
 * @since 1.0
 */
public final class PipeChildProcess implements ChildProcess {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipeChildProcess.class);

  private final Process process;
  private final CompletableFuture<Integer> exitFuture;

  private PipeChildProcess(final Process process) {
    this.process = process;
    this.exitFuture = process.onExit().thenApply(Process::exitValue);
  }

  /**
   * Spawns a pipe-attached process.
   *
   * @param config process configuration
   * @return running child
   * @throws ProcessStartException if the process cannot be started
   */
  public static PipeChildProcess start(final ProcessConfig config) throws ProcessStartException {
    Validate.notNull(config, "config must not be null");

    final ProcessBuilder builder = new ProcessBuilder(config.command())
        .directory(config.workingDirectory().toFile())
        .redirectErrorStream(false);
    builder.environment().putAll(config.environment());

    try {
      final Process process = builder.start();
      LOGGER.debug("Spawned pipe process PID={} command={}", process.pid(), config.command());
      return new PipeChildProcess(process);
    } catch (final IOException e) {
      throw new ProcessStartException(reasonOf(e), "Failed to start " + config.command() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Maps the errno embedded in {@link ProcessBuilder} failures ("error=2, No such file or directory").
   */
  static ProcessStartException.Reason reasonOf(final IOException e) {
    final String message = e.getMessage() == null ? "" : e.getMessage();
    if (message.contains("error=2,")) {
      return ProcessStartException.Reason.NOT_FOUND;
    }
    if (message.contains("error=13,")) {
      return ProcessStartException.Reason.PERMISSION_DENIED;
    }
    return ProcessStartException.Reason.SPAWN_ERROR;
  }

  @Override
  public InputStream stdout() {
    return process.getInputStream();
  }

  @Override
  public InputStream stderr() {
    return process.getErrorStream();
  }

  @Override
  public OutputStream stdin() {
    return process.getOutputStream();
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return exitFuture;
  }

  @Override
  public long pid() {
    return process.pid();
  }

  @Override
  public boolean isAlive() {
    return process.isAlive();
  }

  @Override
  public void destroy() {
    process.destroy();
  }

  @Override
  public void destroyForcibly() {
    process.destroyForcibly();
  }

  @Override
  public boolean waitFor(final Duration timeout) throws InterruptedException {
    return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
