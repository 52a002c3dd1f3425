package com.consullo.bridge.session;

import com.consullo.bridge.capture.OutputBuffer;
import com.consullo.bridge.config.BridgeConfig;
import com.consullo.bridge.format.MessageChunker;
import com.consullo.bridge.process.ProcessConfig;
import com.consullo.bridge.process.ProcessLauncher;
import com.consullo.bridge.process.ProcessStartException;
import com.consullo.bridge.text.DefaultLineClassifier;
import com.consullo.bridge.text.LineClassifier;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of sessions keyed by their short id.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the session map, guarded by one {@link ReentrantLock}; the lock is never held while a process starts or
 * stops. Termination closes the session's controller, which waits for a restart in progress and refuses later
 * ones</li>
 * <li>the scheduler thread running the expiry sweep and every output buffer's flush loop</li>
 * <li>the {@link SessionEventBus} delivering notifications to listeners</li>
 * </ul>
 * </p>
 *
 * <p>
 * Every removal, whether explicit, by sweep, or on shutdown, goes through {@link #terminateSession(String)}.
 * </p>
 *
 * @since 1.0
 */
public final class SessionManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

  private static final long SCHEDULER_SHUTDOWN_MILLIS = 2000L;

  private final BridgeConfig config;
  private final ProcessLauncher launcher;
  private final LineClassifier classifier;
  private final MessageChunker chunker;
  private final SessionIdGenerator idGenerator;
  private final Clock clock;
  private final SessionEventBus eventBus = new SessionEventBus();
  private final ScheduledExecutorService scheduler;

  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock
  private final Map<String, Session> sessions = new LinkedHashMap<>();
  private final Set<String> reservedIds = new HashSet<>();

  private volatile boolean running;
  private volatile ScheduledFuture<?> sweepFuture;

  /**
   * Creates a manager with the launcher selected by the configuration and the built-in classifier.
   *
   * @param config bridge configuration
   */
  public SessionManager(final BridgeConfig config) {
    this(config, BridgeSessionFactory.launcher(config), new DefaultLineClassifier(), new SessionIdGenerator(),
        Clock.systemUTC());
  }

  /**
   * Creates a manager.
   *
   * @param config bridge configuration
   * @param launcher spawning back end
   * @param classifier line classifier used by every output buffer
   * @param idGenerator session id generator
   * @param clock time source for activity tracking and expiry
   */
  public SessionManager(
      final BridgeConfig config,
      final ProcessLauncher launcher,
      final LineClassifier classifier,
      final SessionIdGenerator idGenerator,
      final Clock clock) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(classifier, "classifier must not be null");
    Validate.notNull(idGenerator, "idGenerator must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.config = config;
    this.launcher = launcher;
    this.classifier = classifier;
    this.idGenerator = idGenerator;
    this.clock = clock;
    this.chunker = new MessageChunker(config.maxOutputLength());
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "SessionManagerScheduler");
      t.setDaemon(true);
      return t;
    });
  }

  public BridgeConfig config() {
    return config;
  }

  /**
   * Starts event dispatch and the periodic expiry sweep.
   */
  public void start() {
    if (running) {
      return;
    }
    Validate.validState(!scheduler.isShutdown(), "SessionManager cannot be restarted after stop()");
    LOGGER.info("Starting session manager (timeout={}, cleanupInterval={})",
        config.sessionTimeout(), config.cleanupInterval());
    running = true;
    eventBus.start();
    final long interval = config.cleanupInterval().toMillis();
    sweepFuture = scheduler.scheduleWithFixedDelay(this::sweepFromScheduler, interval, interval,
        TimeUnit.MILLISECONDS);
  }

  /**
   * Cancels the sweep, terminates every session one after the other, then stops event dispatch.
   */
  public void stop() {
    LOGGER.info("Stopping session manager");
    running = false;
    final ScheduledFuture<?> future = sweepFuture;
    if (future != null) {
      future.cancel(false);
    }

    for (String id : sessionIds()) {
      try {
        terminateSession(id);
      } catch (final RuntimeException e) {
        LOGGER.error("Failed to terminate session {} during shutdown: {}", id, e.getMessage(), e);
      }
    }

    eventBus.stop();
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(SCHEDULER_SHUTDOWN_MILLIS, TimeUnit.MILLISECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
  }

  public boolean isRunning() {
    return running;
  }

  public void addListener(final SessionEventListener listener) {
    eventBus.addListener(listener);
  }

  public void removeListener(final SessionEventListener listener) {
    eventBus.removeListener(listener);
  }

  /**
   * Returns an id that is neither registered nor reserved by a session being created.
   *
   * @return fresh id
   */
  public String generateId() {
    lock.lock();
    try {
      return idGenerator.generate(this::isTakenLocked);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Creates a session in the configured working directory.
   *
   * @return the session, or null if its process could not be started
   */
  public Session createSession() {
    return createSession(null);
  }

  /**
   * Creates a session, starts its process and registers it.
   *
   * @param workingDirectory working directory, or null for the configured default
   * @return the session, or null if its process could not be started
   */
  public Session createSession(final Path workingDirectory) {
    final String id;
    lock.lock();
    try {
      id = idGenerator.generate(this::isTakenLocked);
      reservedIds.add(id);
    } finally {
      lock.unlock();
    }

    final ProcessConfig processConfig = BridgeSessionFactory.processConfig(config, workingDirectory);
    LOGGER.info("Creating session {} in {}", id, processConfig.workingDirectory());

    final OutputBuffer buffer = new OutputBuffer(id, BridgeSessionFactory.bufferConfig(config), chunker, classifier,
        scheduler, (sessionId, chunks) -> eventBus.publish(SessionEvent.output(sessionId, chunks)), clock);
    final Session session = new Session(id, processConfig, launcher, buffer, config.maxHistoryLength(), clock);

    boolean registered = false;
    try {
      buffer.start();
      try {
        session.controller().start();
      } catch (final ProcessStartException e) {
        LOGGER.error("Failed to start process for session {} ({}): {}", id, e.reason(), e.getMessage());
        return null;
      }
      session.markStarted();

      lock.lock();
      try {
        sessions.put(id, session);
        registered = true;
      } finally {
        lock.unlock();
      }
    } finally {
      lock.lock();
      try {
        reservedIds.remove(id);
      } finally {
        lock.unlock();
      }
      if (!registered) {
        buffer.stop();
        session.controller().close();
      }
    }

    LOGGER.info("Session {} created", id);
    eventBus.publish(SessionEvent.created(session.snapshot()));
    return session;
  }

  /**
   * Looks up a session.
   *
   * @param id session id
   * @return the session, or null if none is registered under the id
   */
  public Session getSession(final String id) {
    if (id == null) {
      return null;
    }
    lock.lock();
    try {
      return sessions.get(id);
    } finally {
      lock.unlock();
    }
  }

  public List<Session> getAllSessions() {
    lock.lock();
    try {
      return new ArrayList<>(sessions.values());
    } finally {
      lock.unlock();
    }
  }

  public List<Session> getActiveSessions() {
    final List<Session> active = new ArrayList<>();
    for (Session session : getAllSessions()) {
      if (session.isActive()) {
        active.add(session);
      }
    }
    return active;
  }

  /**
   * Returns registry counters.
   *
   * @return statistics
   */
  public SessionStats getSessionStats() {
    final List<Session> all = getAllSessions();
    final List<String> ids = new ArrayList<>(all.size());
    int active = 0;
    for (Session session : all) {
      ids.add(session.id());
      if (session.isActive()) {
        active++;
      }
    }
    return new SessionStats(all.size(), active, all.size() - active, ids);
  }

  /**
   * Forwards a command to the session's process and records it in the command history.
   *
   * @param id session id
   * @param command command text
   * @return false if the session is unknown or inactive, or the write failed
   */
  public boolean sendCommand(final String id, final String command) {
    Validate.notNull(command, "command must not be null");
    final Session session = getSession(id);
    if (session == null) {
      LOGGER.warn("Session {} not found", id);
      return false;
    }
    if (!session.isActive()) {
      LOGGER.warn("Session {} is not active", id);
      return false;
    }
    if (!session.controller().sendInput(command)) {
      LOGGER.error("Failed to send command to session {}", id);
      return false;
    }
    session.addCommand(command);
    LOGGER.debug("Command sent to session {}: {}", id, command);
    return true;
  }

  /**
   * Terminates a session: unregisters it, stops its process, flushes its buffer and publishes a terminated event.
   *
   * @param id session id
   * @return true if the session was registered; false on a second call
   */
  public boolean terminateSession(final String id) {
    final Session session;
    lock.lock();
    try {
      session = id != null ? sessions.remove(id) : null;
    } finally {
      lock.unlock();
    }
    if (session == null) {
      LOGGER.warn("Session {} not found for termination", id);
      return false;
    }

    LOGGER.info("Terminating session {}", id);
    // Waits for a restart in progress and prevents any later one from spawning.
    session.controller().close();
    session.buffer().stop();
    session.markTerminated();
    LOGGER.info("Session {} terminated", id);

    eventBus.publish(SessionEvent.terminated(session.snapshot()));
    return true;
  }

  /**
   * Restarts the session's process with its original parameters.
   *
   * @param id session id
   * @return true if the new process started and the session is still registered; on a spawn failure the session is
   *     marked terminated
   */
  public boolean restartSession(final String id) {
    final Session session = getSession(id);
    if (session == null) {
      LOGGER.warn("Session {} not found for restart", id);
      return false;
    }

    LOGGER.info("Restarting session {}", id);
    try {
      session.controller().restart();
    } catch (final ProcessStartException e) {
      LOGGER.error("Failed to restart session {} ({}): {}", id, e.reason(), e.getMessage());
      session.markTerminated();
      return false;
    } catch (final IllegalStateException e) {
      LOGGER.warn("Session {} was terminated before its restart: {}", id, e.getMessage());
      return false;
    }

    // A concurrent termination owns the session's final state.
    lock.lock();
    try {
      if (sessions.get(id) != session) {
        LOGGER.warn("Session {} was terminated during its restart", id);
        return false;
      }
      session.markRestarted();
    } finally {
      lock.unlock();
    }
    LOGGER.info("Session {} restarted", id);
    return true;
  }

  /**
   * Attaches a chat transport to an active session, replacing any previous binding.
   *
   * @param id session id
   * @param binding transport binding
   * @return false if the session is unknown or inactive
   */
  public boolean connectTransport(final String id, final TransportBinding binding) {
    Validate.notNull(binding, "binding must not be null");
    final Session session = getSession(id);
    if (session == null) {
      LOGGER.warn("Session {} not found for transport connection", id);
      return false;
    }
    if (!session.isActive()) {
      LOGGER.warn("Session {} is not active", id);
      return false;
    }
    session.attachTransport(binding);
    LOGGER.info("Transport {}:{} connected to session {}", binding.transport(), binding.channelId(), id);
    return true;
  }

  /**
   * Detaches the chat transport of a session.
   *
   * @param id session id
   * @return false if the session is unknown
   */
  public boolean disconnectTransport(final String id) {
    final Session session = getSession(id);
    if (session == null) {
      return false;
    }
    session.detachTransport();
    LOGGER.info("Transport disconnected from session {}", id);
    return true;
  }

  /**
   * Terminates every session that is terminated or idle for longer than the session timeout.
   *
   * @return number of sessions terminated
   */
  public int sweepExpiredSessions() {
    final Instant now = clock.instant();
    final List<String> expired = new ArrayList<>();
    for (Session session : getAllSessions()) {
      if (session.isExpired(config.sessionTimeout(), now)) {
        expired.add(session.id());
      }
    }

    int terminated = 0;
    for (String id : expired) {
      LOGGER.info("Cleaning up expired session {}", id);
      if (terminateSession(id)) {
        terminated++;
      }
    }
    return terminated;
  }

  private void sweepFromScheduler() {
    try {
      sweepExpiredSessions();
    } catch (final RuntimeException e) {
      LOGGER.error("Error in periodic cleanup: {}", e.getMessage(), e);
    }
  }

  // Caller holds lock.
  private boolean isTakenLocked(final String id) {
    return sessions.containsKey(id) || reservedIds.contains(id);
  }

  private List<String> sessionIds() {
    lock.lock();
    try {
      return new ArrayList<>(sessions.keySet());
    } finally {
      lock.unlock();
    }
  }
}
