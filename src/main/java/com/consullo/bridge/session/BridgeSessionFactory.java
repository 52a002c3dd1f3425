package com.consullo.bridge.session;

import com.consullo.bridge.capture.OutputBufferConfig;
import com.consullo.bridge.config.BridgeConfig;
import com.consullo.bridge.process.ProcessConfig;
import com.consullo.bridge.process.ProcessLauncher;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * Derives per-session settings from the bridge configuration.
 *
 * <p>
 * This class centralizes the decision-making around:
 * <ul>
 * <li>TERM defaults (so terminal-aware CLIs emit the escapes the normalizer understands)</li>
 * <li>optional CI mode to reduce spinners and animations</li>
 * <li>pipe or pseudo-terminal launch</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class BridgeSessionFactory {

  private BridgeSessionFactory() {
  }

  /**
   * Creates the process configuration of one session.
   *
   * @param config bridge configuration
   * @param workingDirectory session working directory, or null for the configured default
   * @return process configuration
   */
  public static ProcessConfig processConfig(final BridgeConfig config, final Path workingDirectory) {
    Validate.notNull(config, "config must not be null");

    final Map<String, String> env = new LinkedHashMap<>();
    // Sensible default for terminal-aware CLIs.
    env.put("TERM", "xterm-256color");
    if (config.ciMode()) {
      env.put("CI", "1");
    }

    final Path workDir = workingDirectory != null
        ? workingDirectory.toAbsolutePath().normalize()
        : config.workingDirectory();

    return ProcessConfig.of(config.command(), workDir)
        .withEnvironment(env)
        .withGracePeriod(config.gracePeriod());
  }

  /**
   * Creates the output buffer configuration shared by all sessions.
   *
   * @param config bridge configuration
   * @return buffer configuration
   */
  public static OutputBufferConfig bufferConfig(final BridgeConfig config) {
    Validate.notNull(config, "config must not be null");
    return OutputBufferConfig.defaults()
        .withStrategy(config.bufferStrategy())
        .withFlushInterval(config.flushInterval());
  }

  /**
   * Selects the launch back end.
   *
   * @param config bridge configuration
   * @return pty launcher if configured, pipe launcher otherwise
   */
  public static ProcessLauncher launcher(final BridgeConfig config) {
    Validate.notNull(config, "config must not be null");
    return config.usePty() ? ProcessLauncher.PTY : ProcessLauncher.PIPES;
  }
}
