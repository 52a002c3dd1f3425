package com.consullo.bridge.session;

import java.util.List;

/**
 * Registry counters.
 *
 * @param totalSessions registered sessions
 * @param activeSessions sessions that are active with a running process
 * @param inactiveSessions registered sessions that are not active
 * @param sessionIds ids of the registered sessions
 * @since 1.0
 */
public record SessionStats(int totalSessions, int activeSessions, int inactiveSessions, List<String> sessionIds) {

  public SessionStats {
    sessionIds = List.copyOf(sessionIds);
  }
}
