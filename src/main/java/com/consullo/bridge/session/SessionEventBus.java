package com.consullo.bridge.session;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue between the code that produces session events and the listeners that consume them.
 *
 * <p>
 * Publishing only enqueues. A single daemon thread dispatches events in publish order, so a slow or failing listener
 * never blocks a reader thread, the flush loop or a registry call.
 * </p>
 *
 * @since 1.0
 */
public final class SessionEventBus {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionEventBus.class);

  private static final long POLL_MILLIS = 100L;
  private static final long STOP_JOIN_MILLIS = 2000L;

  private final BlockingQueue<SessionEvent> queue = new LinkedBlockingQueue<>();
  private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

  private volatile boolean running;
  private Thread dispatcher;

  public void addListener(final SessionEventListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  public void removeListener(final SessionEventListener listener) {
    listeners.remove(listener);
  }

  /**
   * Starts the dispatch thread. Calling it again while running has no effect.
   */
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    dispatcher = new Thread(this::dispatchLoop, "SessionEventDispatcher");
    dispatcher.setDaemon(true);
    dispatcher.start();
  }

  /**
   * Stops the dispatch thread after the events already queued have been delivered.
   */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    try {
      dispatcher.join(STOP_JOIN_MILLIS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (!queue.isEmpty()) {
      LOGGER.warn("Event bus stopped with {} undelivered events", queue.size());
      queue.clear();
    }
    dispatcher = null;
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Enqueues an event. Events published while the bus is stopped are dropped.
   *
   * @param event event
   */
  public void publish(final SessionEvent event) {
    Validate.notNull(event, "event must not be null");
    if (!running) {
      LOGGER.debug("Event bus not running, dropping {} event for session {}", event.type(), event.sessionId());
      return;
    }
    queue.add(event);
  }

  private void dispatchLoop() {
    while (running || !queue.isEmpty()) {
      final SessionEvent event;
      try {
        event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (event != null) {
        dispatch(event);
      }
    }
  }

  private void dispatch(final SessionEvent event) {
    for (SessionEventListener listener : listeners) {
      try {
        switch (event.type()) {
          case CREATED:
            listener.onSessionCreated(event.snapshot());
            break;
          case TERMINATED:
            listener.onSessionTerminated(event.snapshot());
            break;
          case OUTPUT:
            listener.onOutput(event.sessionId(), event.chunks());
            break;
          default:
            break;
        }
      } catch (final RuntimeException e) {
        LOGGER.error("Listener failed on {} event for session {}: {}", event.type(), event.sessionId(),
            e.getMessage(), e);
      }
    }
  }
}
