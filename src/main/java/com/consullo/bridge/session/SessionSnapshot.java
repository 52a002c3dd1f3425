package com.consullo.bridge.session;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Immutable view of a session, safe to hand to other threads.
 *
 * @param id session id
 * @param status lifecycle state
 * @param createdAt creation time
 * @param lastActivity last command, output or explicit touch
 * @param commandCount commands held in the history
 * @param outputCount output lines held in the history
 * @param workingDirectory working directory of the child process
 * @param active true if the session is active and its process is running
 * @since 1.0
 */
public record SessionSnapshot(
    String id,
    SessionStatus status,
    Instant createdAt,
    Instant lastActivity,
    int commandCount,
    int outputCount,
    Path workingDirectory,
    boolean active) {
}
