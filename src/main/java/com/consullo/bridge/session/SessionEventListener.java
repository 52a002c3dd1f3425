package com.consullo.bridge.session;

import com.consullo.bridge.format.MessageChunk;
import java.util.List;

/**
 * Receives session notifications on the event bus dispatch thread. Exceptions are logged by the bus and never reach
 * the code that published the event.
 *
 * @since 1.0
 */
public interface SessionEventListener {

  default void onSessionCreated(final SessionSnapshot session) {
  }

  default void onSessionTerminated(final SessionSnapshot session) {
  }

  /**
   * Called with each flushed chunk batch of a session, in flush order.
   *
   * @param sessionId session id
   * @param chunks chunks in textual order
   */
  default void onOutput(final String sessionId, final List<MessageChunk> chunks) {
  }
}
