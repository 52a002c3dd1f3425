package com.consullo.bridge.process;

/**
 * Output channel of a child process.
 *
 * @since 1.0
 */
public enum StreamKind {
  STDOUT,
  STDERR
}
