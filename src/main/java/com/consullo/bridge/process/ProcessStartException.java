package com.consullo.bridge.process;

/**
 * Thrown when a child process cannot be spawned. Spawn failures are reported to the caller, never retried.
 *
 * @since 1.0
 */
public final class ProcessStartException extends Exception {

  private static final long serialVersionUID = 1L;

  /**
   * Failure cause category.
   */
  public enum Reason {
    /** The executable could not be located. */
    NOT_FOUND,
    /** The executable exists but may not be executed, or the working directory is not accessible. */
    PERMISSION_DENIED,
    /** Any other spawn error. */
    SPAWN_ERROR
  }

  private final Reason reason;

  public ProcessStartException(final Reason reason, final String message) {
    super(message);
    this.reason = reason;
  }

  public ProcessStartException(final Reason reason, final String message, final Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
