package com.consullo.bridge.demo;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Deterministic child process used by the demo and for manual verification.
 *
 * <p>This app emits:
 * 1) A few committed lines, one of them colored
 * 2) Progress updates rewritten with carriage returns
 * 3) An error on stderr
 * 4) A prompt, then echoes every stdin line until "exit"
 *
 * @since 1.0
 */
public final class BridgeFixtureApp {

  private BridgeFixtureApp() {
  }

  /**
   * Entry point.
   *
   * @param args args
   * @throws Exception if sleep is interrupted or stdin fails
   */
  public static void main(final String[] args) throws Exception {
    final PrintStream out = System.out;

    out.println("fixture: start");
    out.println("\u001b[32mfixture: connected\u001b[0m");
    out.println("fixture: line 1");

    for (int p = 0; p <= 100; p += 20) {
      out.print("\r[==========          ] " + p + "%");
      out.flush();
      Thread.sleep(15L);
    }
    out.println();
    out.println("fixture: build complete");

    System.err.println("Error: fixture warning lamp is on");
    System.err.flush();

    out.println("Continue? (y/n)");
    out.flush();

    final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    String line;
    while ((line = in.readLine()) != null) {
      if ("exit".equals(line.strip())) {
        break;
      }
      out.println("fixture: echo " + line);
      out.flush();
    }
    out.println("fixture: done");
    out.flush();
  }
}
