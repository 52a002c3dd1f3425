package com.consullo.bridge.process;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Child process attached to a pseudo-terminal, implemented with pty4j.
 *
 * <p>
 * Interactive CLIs often switch to line-buffered, colored output only when stdout is a terminal. This launcher gives
 * them one:
 * - stdin and stdout go through the PTY (input is echoed by the terminal line discipline)
 * - stderr stays a separate stream
 * - the terminal size is fixed; resize is not supported
 * </p>
 *
 * @since 1.0
 */
public final class PtyChildProcess implements ChildProcess {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyChildProcess.class);

  static final int COLUMNS = 160;
  static final int ROWS = 48;

  private final PtyProcess process;
  private final CompletableFuture<Integer> exitFuture;

  private PtyChildProcess(final PtyProcess process) {
    this.process = process;
    this.exitFuture = new CompletableFuture<>();
    startExitMonitorThread();
  }

  /**
   * Spawns a PTY-attached process.
   *
   * @param config process configuration (command, working directory, environment)
   * @return running child
   * @throws ProcessStartException if the process cannot be started
   */
  public static PtyChildProcess start(final ProcessConfig config) throws ProcessStartException {
    Validate.notNull(config, "config must not be null");

    final String[] cmd = config.command().toArray(new String[0]);

    // pty4j replaces the whole environment; start from the parent's.
    final Map<String, String> env = new HashMap<>(System.getenv());
    env.putIfAbsent("TERM", "xterm-256color");
    env.putAll(config.environment());

    final PtyProcessBuilder builder = new PtyProcessBuilder(cmd)
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(env)
        .setRedirectErrorStream(false)
        .setInitialColumns(COLUMNS)
        .setInitialRows(ROWS);

    try {
      final PtyProcess process = builder.start();
      LOGGER.debug("Spawned PTY process PID={} command={}", process.pid(), config.command());
      return new PtyChildProcess(process);
    } catch (final IOException e) {
      throw new ProcessStartException(ProcessStartException.Reason.SPAWN_ERROR,
          "Failed to start " + config.command() + " on a PTY: " + e.getMessage(), e);
    }
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

  /**
   * Starts a monitor thread that completes the exit future when the subprocess terminates.
   */
  private void startExitMonitorThread() {
    final Thread monitor = new Thread(() -> {
      try {
        final int code = this.process.waitFor();
        this.exitFuture.complete(code);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        this.exitFuture.completeExceptionally(e);
      }
    }, "PtyProcessExitMonitor-" + process.pid());
    monitor.setDaemon(true);
    monitor.start();
  }
}
