package com.consullo.bridge.process;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of one child process.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the current {@link ChildProcess} (at most one at a time)</li>
 * <li>one reader thread per output stream, forwarding complete lines to the {@link OutputSink}</li>
 * <li>one writer thread, so stdin writes are applied in send order and a stuck pipe cannot block callers</li>
 * </ul>
 * </p>
 *
 * <p>
 * Termination sends the graceful signal first and kills the child when it has not exited within the grace period.
 * Spawn failures are reported through {@link ProcessStartException}; retrying is up to the caller.
 * </p>
 *
 * <p>
 * Lifecycle operations are serialized on their own monitor, so the state accessors never wait for a child to exit or
 * for reader threads to drain. After {@link #close()} the controller never spawns again.
 * </p>
 *
 * @since 1.0
 */
public final class ProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessController.class);

  private static final long READER_JOIN_MILLIS = 1000L;

  private final String name;
  private final ProcessConfig config;
  private final ProcessLauncher launcher;
  private final OutputSink sink;
  private final IntConsumer exitListener;

  // Serializes start, terminate, restart and close. Never taken while holding lock.
  private final Object lifecycle = new Object();
  private final Object lock = new Object();

  // Guarded by lock
  private boolean closed;
  private ChildProcess process;
  private ExecutorService stdinWriter;
  private final List<Thread> readers = new ArrayList<>(2);
  private boolean terminating;
  private Integer lastExitCode;

  /**
   * Creates a controller. Nothing is spawned until {@link #start()}.
   *
   * @param name name used in logs and thread names (e.g. the session id)
   * @param config process configuration
   * @param launcher spawning back end
   * @param sink receiver of output lines
   * @param exitListener notified with the exit code when the child exits on its own (not through terminate)
   */
  public ProcessController(
      final String name,
      final ProcessConfig config,
      final ProcessLauncher launcher,
      final OutputSink sink,
      final IntConsumer exitListener) {
    Validate.notBlank(name, "name must not be blank");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(sink, "sink must not be null");
    this.name = name;
    this.config = config;
    this.launcher = launcher;
    this.sink = sink;
    this.exitListener = exitListener != null ? exitListener : code -> { };
  }

  public ProcessConfig config() {
    return config;
  }

  /**
   * Spawns the child and starts the reader threads.
   *
   * @throws ProcessStartException if the executable cannot be located, may not be executed, or fails to spawn
   * @throws IllegalStateException if a child is already running or the controller is closed
   */
  public void start() throws ProcessStartException {
    synchronized (lifecycle) {
      final List<Thread> stale;
      synchronized (lock) {
        if (closed) {
          throw new IllegalStateException("Process controller for " + name + " is closed");
        }
        if (process != null && process.isAlive()) {
          throw new IllegalStateException("Process already running for " + name);
        }
        stale = releaseLocked();
      }
      joinReaders(stale);
      spawn();
    }
  }

  // Caller holds lifecycle, so the launch itself can run without lock.
  private void spawn() throws ProcessStartException {
    final Path workDir = config.workingDirectory();
    try {
      Files.createDirectories(workDir);
    } catch (final IOException e) {
      throw new ProcessStartException(ProcessStartException.Reason.PERMISSION_DENIED,
          "Cannot create working directory " + workDir + ": " + e.getMessage(), e);
    }
    checkExecutable(config.command().get(0), workDir);

    LOGGER.info("Starting process for {}: command={} workingDirectory={}", name, config.command(), workDir);
    final ChildProcess child = launcher.launch(config);

    synchronized (lock) {
      this.process = child;
      this.terminating = false;
      this.lastExitCode = null;
      this.stdinWriter = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "ProcessStdinWriter-" + name);
        t.setDaemon(true);
        return t;
      });
      readers.add(startReader(child.stdout(), StreamKind.STDOUT));
      readers.add(startReader(child.stderr(), StreamKind.STDERR));
    }
    child.onExit().whenComplete((code, error) -> onChildExit(child, code));

    LOGGER.info("Process for {} started with PID {}", name, child.pid());
  }

  /**
   * Writes one newline-terminated line to the child's stdin.
   *
   * @param text text to send; a trailing newline is added when missing
   * @return false if no child is running, the pipe is closed, or the write timed out
   */
  public boolean sendInput(final String text) {
    Validate.notNull(text, "text must not be null");

    final ChildProcess child;
    final ExecutorService writer;
    synchronized (lock) {
      child = this.process;
      writer = this.stdinWriter;
    }
    if (child == null || writer == null || !child.isAlive()) {
      LOGGER.warn("Cannot send input to {}: process not running", name);
      return false;
    }

    final String line = text.endsWith("\n") ? text : text + "\n";
    final byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
    final Future<?> write;
    try {
      write = writer.submit(() -> {
        final OutputStream in = child.stdin();
        in.write(bytes);
        in.flush();
        return null;
      });
    } catch (final RuntimeException e) {
      LOGGER.warn("Cannot send input to {}: writer unavailable ({})", name, e.getMessage());
      return false;
    }

    try {
      write.get(config.inputTimeout().toMillis(), TimeUnit.MILLISECONDS);
      LOGGER.debug("Sent input to {}: {}", name, text.strip());
      return true;
    } catch (final TimeoutException e) {
      write.cancel(true);
      LOGGER.warn("Input to {} not accepted within {}", name, config.inputTimeout());
      return false;
    } catch (final ExecutionException e) {
      LOGGER.warn("Cannot send input to {}: stdin is closed ({})", name, e.getCause().getMessage());
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Non-blocking liveness poll.
   *
   * @return true if a child is running
   */
  public boolean isRunning() {
    synchronized (lock) {
      return process != null && process.isAlive();
    }
  }

  /**
   * Returns the PID of the current child, or -1 when none was started.
   *
   * @return pid
   */
  public long pid() {
    synchronized (lock) {
      return process != null ? process.pid() : -1L;
    }
  }

  /**
   * Returns the exit code of the last child, or null while it runs or when none was started.
   *
   * @return exit code or null
   */
  public Integer exitCode() {
    synchronized (lock) {
      return lastExitCode;
    }
  }

  /**
   * Terminates the child: graceful signal, forced kill after the grace period, then reap. Idempotent.
   */
  public void terminate() {
    synchronized (lifecycle) {
      terminateChild();
    }
  }

  /**
   * Terminates the child and refuses every later {@link #start()} or {@link #restart()}. Waits for a lifecycle
   * operation in progress, so a child spawned by a concurrent restart is terminated too.
   */
  public void close() {
    synchronized (lifecycle) {
      synchronized (lock) {
        closed = true;
      }
      terminateChild();
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  // Caller holds lifecycle.
  private void terminateChild() {
    final ChildProcess child;
    synchronized (lock) {
      child = this.process;
      if (child == null) {
        return;
      }
      terminating = true;
    }

    if (child.isAlive()) {
      LOGGER.info("Terminating process for {} (PID {})", name, child.pid());
      child.destroy();
      try {
        if (!child.waitFor(config.gracePeriod())) {
          LOGGER.warn("Process for {} did not exit within {}, forcing kill", name, config.gracePeriod());
          child.destroyForcibly();
          if (!child.waitFor(config.gracePeriod())) {
            LOGGER.warn("Process for {} still not reaped after forced kill", name);
          }
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.warn("Interrupted while waiting for {} to exit, forcing kill", name);
        child.destroyForcibly();
      }
    }

    final List<Thread> released;
    synchronized (lock) {
      released = this.process == child ? releaseLocked() : List.of();
    }
    joinReaders(released);
    LOGGER.info("Process for {} terminated", name);
  }

  /**
   * Terminates the current child and starts a new one with identical parameters.
   *
   * @throws ProcessStartException if the new child cannot be spawned
   * @throws IllegalStateException if the controller is closed
   */
  public void restart() throws ProcessStartException {
    synchronized (lifecycle) {
      LOGGER.info("Restarting process for {}", name);
      terminateChild();
      start();
    }
  }

  // Caller holds lock. Closes the current child's resources and forgets it; returns the readers left to join.
  private List<Thread> releaseLocked() {
    final ChildProcess child = this.process;
    if (child != null && !child.isAlive()) {
      lastExitCode = exitValueOf(child);
    }
    if (stdinWriter != null) {
      stdinWriter.shutdownNow();
      stdinWriter = null;
    }
    if (child != null) {
      try {
        child.stdin().close();
      } catch (final IOException e) {
        LOGGER.debug("Closing stdin of {} failed: {}", name, e.getMessage());
      }
    }
    final List<Thread> released = new ArrayList<>(readers);
    readers.clear();
    this.process = null;
    return released;
  }

  // Called without lock; a grandchild holding the pipe open may keep a reader alive past the join.
  private void joinReaders(final List<Thread> released) {
    for (Thread reader : released) {
      try {
        reader.join(READER_JOIN_MILLIS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (reader.isAlive()) {
        LOGGER.debug("{} still draining output of {}", reader.getName(), name);
      }
    }
  }

  private static Integer exitValueOf(final ChildProcess child) {
    final Integer code = child.onExit().getNow(null);
    return code;
  }

  private void onChildExit(final ChildProcess child, final Integer code) {
    final boolean expected;
    synchronized (lock) {
      if (this.process != child) {
        return;
      }
      lastExitCode = code;
      expected = terminating;
    }
    if (expected) {
      return;
    }
    LOGGER.info("Process for {} (PID {}) exited with code {}", name, child.pid(), code);
    try {
      exitListener.accept(code != null ? code : -1);
    } catch (final RuntimeException e) {
      LOGGER.error("Exit listener for {} failed: {}", name, e.getMessage(), e);
    }
  }

  private Thread startReader(final InputStream in, final StreamKind stream) {
    final Thread reader = new Thread(() -> {
      try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          try {
            sink.onLine(stream, line);
          } catch (final RuntimeException e) {
            LOGGER.error("Output sink for {} failed on {} line: {}", name, stream, e.getMessage(), e);
          }
        }
      } catch (final IOException e) {
        // Closed underneath us when the process is killed.
        LOGGER.debug("{} reader for {} stopped: {}", stream, name, e.getMessage());
      }
      LOGGER.debug("{} reader for {} reached end of stream", stream, name);
    }, "Process" + (stream == StreamKind.STDOUT ? "Stdout" : "Stderr") + "Reader-" + name);
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  /**
   * Resolves the executable the way the launcher will, so a missing binary is reported as NOT_FOUND.
   */
  static void checkExecutable(final String executable, final Path workDir) throws ProcessStartException {
    if (executable.indexOf('/') >= 0 || executable.indexOf(File.separatorChar) >= 0) {
      Path path = Path.of(executable);
      if (!path.isAbsolute()) {
        path = workDir.resolve(path);
      }
      if (!Files.exists(path)) {
        throw new ProcessStartException(ProcessStartException.Reason.NOT_FOUND, "Executable not found: " + executable);
      }
      if (!Files.isExecutable(path) || Files.isDirectory(path)) {
        throw new ProcessStartException(ProcessStartException.Reason.PERMISSION_DENIED,
            "Executable not runnable: " + executable);
      }
      return;
    }

    final String pathEnv = System.getenv("PATH");
    if (pathEnv == null || pathEnv.isEmpty()) {
      // Nothing to search; leave resolution to the launcher.
      return;
    }
    boolean found = false;
    for (String dir : pathEnv.split(File.pathSeparator)) {
      if (dir.isEmpty()) {
        continue;
      }
      final Path candidate = Path.of(dir, executable);
      if (Files.isRegularFile(candidate)) {
        if (Files.isExecutable(candidate)) {
          return;
        }
        found = true;
      }
    }
    if (found) {
      throw new ProcessStartException(ProcessStartException.Reason.PERMISSION_DENIED,
          "Executable not runnable: " + executable);
    }
    throw new ProcessStartException(ProcessStartException.Reason.NOT_FOUND,
        "Executable not found on PATH: " + executable);
  }
}
