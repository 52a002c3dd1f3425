package com.consullo.bridge.session;

/**
 * Session lifecycle state. Transitions only move forward: inactive, active, terminated. A restart may move a
 * terminated session that is still registered back to active.
 *
 * @since 1.0
 */
public enum SessionStatus {
  INACTIVE,
  ACTIVE,
  TERMINATED
}
