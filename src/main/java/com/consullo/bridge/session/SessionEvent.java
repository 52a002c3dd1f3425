package com.consullo.bridge.session;

import com.consullo.bridge.format.MessageChunk;
import java.time.Instant;
import java.util.List;

/**
 * Notification queued on the {@link SessionEventBus}.
 *
 * @param type event type
 * @param sessionId session the event belongs to
 * @param snapshot session state at the time of the event (null for output events)
 * @param chunks ordered chunk batch (empty unless type is {@link Type#OUTPUT})
 * @param timestamp time the event was published
 * @since 1.0
 */
public record SessionEvent(Type type, String sessionId, SessionSnapshot snapshot, List<MessageChunk> chunks,
    Instant timestamp) {

  /**
   * Event type.
   */
  public enum Type {
    CREATED,
    TERMINATED,
    OUTPUT
  }

  public SessionEvent {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }

  public static SessionEvent created(final SessionSnapshot snapshot) {
    return new SessionEvent(Type.CREATED, snapshot.id(), snapshot, List.of(), Instant.now());
  }

  public static SessionEvent terminated(final SessionSnapshot snapshot) {
    return new SessionEvent(Type.TERMINATED, snapshot.id(), snapshot, List.of(), Instant.now());
  }

  public static SessionEvent output(final String sessionId, final List<MessageChunk> chunks) {
    return new SessionEvent(Type.OUTPUT, sessionId, null, chunks, Instant.now());
  }
}
