package com.consullo.bridge.session;

import com.consullo.bridge.capture.OutputBuffer;
import com.consullo.bridge.process.ProcessConfig;
import com.consullo.bridge.process.ProcessController;
import com.consullo.bridge.process.ProcessLauncher;
import com.consullo.bridge.process.StreamKind;
import com.consullo.bridge.text.LineType;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One managed child process together with its output buffer and bounded history.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the {@link ProcessController} of the child (fixed for the session's lifetime)</li>
 * <li>the {@link OutputBuffer} fed by the controller's reader threads</li>
 * <li>the command and output histories, evicted oldest first</li>
 * </ul>
 * </p>
 *
 * <p>Mutable state is guarded by the session's monitor; reader threads and registry callers both touch it.
 *
 * @since 1.0
 */
public final class Session {

  private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);

  /** Default cap of the command history. */
  public static final int DEFAULT_MAX_HISTORY_LENGTH = 100;

  /** Cap of the output history. */
  public static final int MAX_OUTPUT_HISTORY = 50;

  /** Prefix of stderr lines in the output history and the delivered text. */
  public static final String STDERR_PREFIX = "ERROR: ";

  private final String id;
  private final Path workingDirectory;
  private final Instant createdAt;
  private final int maxHistoryLength;
  private final Clock clock;
  private final ProcessController controller;
  private final OutputBuffer buffer;

  // Guarded by this
  private SessionStatus status = SessionStatus.INACTIVE;
  private Instant lastActivity;
  private final Deque<String> commandHistory = new ArrayDeque<>();
  private final Deque<String> outputHistory = new ArrayDeque<>();
  private TransportBinding transport;

  /**
   * Creates an inactive session. The process is not started.
   *
   * @param id session id
   * @param processConfig configuration of the child process
   * @param launcher spawning back end
   * @param buffer output buffer of this session
   * @param maxHistoryLength cap of the command history
   * @param clock time source for activity tracking
   */
  public Session(
      final String id,
      final ProcessConfig processConfig,
      final ProcessLauncher launcher,
      final OutputBuffer buffer,
      final int maxHistoryLength,
      final Clock clock) {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(processConfig, "processConfig must not be null");
    Validate.notNull(buffer, "buffer must not be null");
    Validate.isTrue(maxHistoryLength > 0, "maxHistoryLength must be positive");
    Validate.notNull(clock, "clock must not be null");
    this.id = id;
    this.workingDirectory = processConfig.workingDirectory();
    this.maxHistoryLength = maxHistoryLength;
    this.clock = clock;
    this.buffer = buffer;
    this.createdAt = clock.instant();
    this.lastActivity = createdAt;
    this.controller = new ProcessController(id, processConfig, launcher, this::onProcessLine, this::onProcessExit);
  }

  public String id() {
    return id;
  }

  public Path workingDirectory() {
    return workingDirectory;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public ProcessController controller() {
    return controller;
  }

  public OutputBuffer buffer() {
    return buffer;
  }

  public synchronized SessionStatus status() {
    return status;
  }

  public synchronized Instant lastActivity() {
    return lastActivity;
  }

  /**
   * Returns true if the session is active and its child process is running.
   *
   * @return activity state
   */
  public boolean isActive() {
    return status() == SessionStatus.ACTIVE && controller.isRunning();
  }

  /**
   * Returns true if the session is terminated or has been idle for longer than {@code timeout}.
   *
   * @param timeout idle timeout
   * @param now current time
   * @return expiry state
   */
  public synchronized boolean isExpired(final Duration timeout, final Instant now) {
    if (status == SessionStatus.TERMINATED) {
      return true;
    }
    return Duration.between(lastActivity, now).compareTo(timeout) > 0;
  }

  public synchronized void touch() {
    lastActivity = clock.instant();
  }

  /**
   * Records a command that was delivered to the child.
   *
   * @param command command text
   */
  public synchronized void addCommand(final String command) {
    commandHistory.addLast(command);
    while (commandHistory.size() > maxHistoryLength) {
      commandHistory.removeFirst();
    }
    lastActivity = clock.instant();
  }

  /**
   * Records a raw output line of the child.
   *
   * @param output output line
   */
  public synchronized void addOutput(final String output) {
    outputHistory.addLast(output);
    while (outputHistory.size() > MAX_OUTPUT_HISTORY) {
      outputHistory.removeFirst();
    }
    lastActivity = clock.instant();
  }

  public synchronized List<String> commandHistory() {
    return new ArrayList<>(commandHistory);
  }

  public synchronized List<String> outputHistory() {
    return new ArrayList<>(outputHistory);
  }

  /**
   * Returns up to {@code count} of the most recent commands, oldest first.
   *
   * @param count maximum number of commands
   * @return commands
   */
  public synchronized List<String> recentCommands(final int count) {
    return tail(commandHistory, count);
  }

  /**
   * Returns up to {@code count} of the most recent output lines, oldest first.
   *
   * @param count maximum number of lines
   * @return output lines
   */
  public synchronized List<String> recentOutput(final int count) {
    return tail(outputHistory, count);
  }

  public synchronized Optional<TransportBinding> transport() {
    return Optional.ofNullable(transport);
  }

  synchronized void attachTransport(final TransportBinding binding) {
    this.transport = binding;
    lastActivity = clock.instant();
  }

  synchronized void detachTransport() {
    this.transport = null;
    lastActivity = clock.instant();
  }

  // Only an inactive session becomes active here; a child that already died keeps it terminated.
  synchronized void markStarted() {
    if (status == SessionStatus.INACTIVE) {
      status = SessionStatus.ACTIVE;
    }
  }

  synchronized void markRestarted() {
    status = SessionStatus.ACTIVE;
    lastActivity = clock.instant();
  }

  synchronized void markTerminated() {
    status = SessionStatus.TERMINATED;
    lastActivity = clock.instant();
  }

  /**
   * Returns an immutable snapshot of the session.
   *
   * @return snapshot
   */
  public SessionSnapshot snapshot() {
    final boolean active = isActive();
    synchronized (this) {
      return new SessionSnapshot(id, status, createdAt, lastActivity, commandHistory.size(), outputHistory.size(),
          workingDirectory, active);
    }
  }

  // Stderr lines are always delivered as errors, so they flush at once and never merge with stdout output.
  void onProcessLine(final StreamKind stream, final String line) {
    if (stream == StreamKind.STDERR) {
      final String error = STDERR_PREFIX + line;
      addOutput(error);
      buffer.addOutput(error, LineType.ERROR, stream);
      return;
    }
    addOutput(line);
    buffer.addOutput(line, null, stream);
  }

  private void onProcessExit(final int exitCode) {
    LOGGER.info("Process of session {} exited with code {}; marking session terminated", id, exitCode);
    markTerminated();
  }

  private static List<String> tail(final Deque<String> items, final int count) {
    final List<String> all = new ArrayList<>(items);
    final int from = Math.max(0, all.size() - Math.max(0, count));
    return new ArrayList<>(all.subList(from, all.size()));
  }

  @Override
  public String toString() {
    return "Session{id=" + id + ", status=" + status() + ", workingDirectory=" + workingDirectory + "}";
  }
}
