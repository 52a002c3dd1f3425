package com.consullo.bridge.config;

import com.consullo.bridge.capture.BufferStrategy;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link BridgeConfig} from a properties source and environment variables.
 *
 * <p>
 * Precedence, highest first:
 * <ul>
 * <li>environment variables ({@code CLAUDE_CODE_COMMAND}, {@code CLAUDE_CODE_WORKDIR}, {@code SESSION_TIMEOUT},
 * {@code SESSION_CLEANUP_INTERVAL}, {@code SESSION_MAX_HISTORY}, {@code SESSION_MAX_OUTPUT}); durations in
 * seconds</li>
 * <li>properties ({@code bridge.command}, {@code session.timeout-seconds}, ...)</li>
 * <li>{@link BridgeConfig#defaults()}</li>
 * </ul>
 * </p>
 *
 * <p>A malformed value fails with an {@link IllegalArgumentException} naming the key.
 *
 * @since 1.0
 */
public final class BridgeConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(BridgeConfigLoader.class);

  public static final String KEY_COMMAND = "bridge.command";
  public static final String KEY_WORKING_DIRECTORY = "bridge.working-directory";
  public static final String KEY_SESSION_TIMEOUT = "session.timeout-seconds";
  public static final String KEY_CLEANUP_INTERVAL = "session.cleanup-interval-seconds";
  public static final String KEY_MAX_HISTORY = "session.max-history-length";
  public static final String KEY_MAX_OUTPUT = "session.max-output-length";
  public static final String KEY_TRANSPORT_MAX = "transport.max-length";
  public static final String KEY_FLUSH_INTERVAL = "buffer.flush-interval-millis";
  public static final String KEY_BUFFER_STRATEGY = "buffer.strategy";
  public static final String KEY_USE_PTY = "process.use-pty";
  public static final String KEY_GRACE_PERIOD = "process.grace-period-seconds";
  public static final String KEY_CI_MODE = "process.ci-mode";

  public static final String ENV_COMMAND = "CLAUDE_CODE_COMMAND";
  public static final String ENV_WORKDIR = "CLAUDE_CODE_WORKDIR";
  public static final String ENV_SESSION_TIMEOUT = "SESSION_TIMEOUT";
  public static final String ENV_CLEANUP_INTERVAL = "SESSION_CLEANUP_INTERVAL";
  public static final String ENV_MAX_HISTORY = "SESSION_MAX_HISTORY";
  public static final String ENV_MAX_OUTPUT = "SESSION_MAX_OUTPUT";

  /** Classpath resource read by {@link #loadDefault()}. */
  public static final String DEFAULT_RESOURCE = "/bridge.properties";

  private BridgeConfigLoader() {
  }

  /**
   * Loads the configuration from {@link #DEFAULT_RESOURCE} (if present) and the process environment.
   *
   * @return configuration
   * @throws IOException if the resource cannot be read
   */
  public static BridgeConfig loadDefault() throws IOException {
    final Properties props = new Properties();
    try (InputStream in = BridgeConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in != null) {
        props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
      } else {
        LOGGER.info("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
      }
    }
    return load(props, System.getenv());
  }

  /**
   * Loads the configuration from a properties file and the process environment.
   *
   * @param file properties file; a missing file yields the defaults
   * @return configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static BridgeConfig load(final Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    final Properties props = new Properties();
    if (Files.exists(file)) {
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
      LOGGER.info("Loaded bridge configuration from {}", file);
    } else {
      LOGGER.warn("Configuration file {} not found, using defaults", file);
    }
    return load(props, System.getenv());
  }

  /**
   * Builds a configuration from explicit sources.
   *
   * @param props properties (may be empty)
   * @param env environment variables (may be empty)
   * @return configuration
   */
  public static BridgeConfig load(final Properties props, final Map<String, String> env) {
    Validate.notNull(props, "props must not be null");
    Validate.notNull(env, "env must not be null");
    final BridgeConfig d = BridgeConfig.defaults();

    final String command = firstNonBlank(env.get(ENV_COMMAND), props.getProperty(KEY_COMMAND));
    final String workDir = firstNonBlank(env.get(ENV_WORKDIR), props.getProperty(KEY_WORKING_DIRECTORY));

    return new BridgeConfig(
        command != null ? splitCommand(command) : d.command(),
        workDir != null ? Path.of(workDir).toAbsolutePath().normalize() : d.workingDirectory(),
        seconds(env, ENV_SESSION_TIMEOUT, props, KEY_SESSION_TIMEOUT, d.sessionTimeout()),
        seconds(env, ENV_CLEANUP_INTERVAL, props, KEY_CLEANUP_INTERVAL, d.cleanupInterval()),
        integer(env, ENV_MAX_HISTORY, props, KEY_MAX_HISTORY, d.maxHistoryLength()),
        integer(env, ENV_MAX_OUTPUT, props, KEY_MAX_OUTPUT, d.maxOutputLength()),
        integer(null, null, props, KEY_TRANSPORT_MAX, d.transportMaxLength()),
        millis(props, KEY_FLUSH_INTERVAL, d.flushInterval()),
        strategy(props, d.bufferStrategy()),
        bool(props, KEY_USE_PTY, d.usePty()),
        seconds(null, null, props, KEY_GRACE_PERIOD, d.gracePeriod()),
        bool(props, KEY_CI_MODE, d.ciMode()));
  }

  static List<String> splitCommand(final String command) {
    return Arrays.stream(StringUtils.split(command.strip()))
        .collect(Collectors.toList());
  }

  private static String firstNonBlank(final String envValue, final String propValue) {
    if (StringUtils.isNotBlank(envValue)) {
      return envValue.strip();
    }
    if (StringUtils.isNotBlank(propValue)) {
      return propValue.strip();
    }
    return null;
  }

  private static String lookup(final Map<String, String> env, final String envKey, final Properties props,
      final String key) {
    return firstNonBlank(env != null && envKey != null ? env.get(envKey) : null, props.getProperty(key));
  }

  private static long parseLong(final String value, final String key) {
    try {
      return Long.parseLong(value);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": '" + value + "'", e);
    }
  }

  private static Duration seconds(final Map<String, String> env, final String envKey, final Properties props,
      final String key, final Duration fallback) {
    final String value = lookup(env, envKey, props, key);
    return value != null ? Duration.ofSeconds(parseLong(value, key)) : fallback;
  }

  private static Duration millis(final Properties props, final String key, final Duration fallback) {
    final String value = lookup(null, null, props, key);
    return value != null ? Duration.ofMillis(parseLong(value, key)) : fallback;
  }

  private static int integer(final Map<String, String> env, final String envKey, final Properties props,
      final String key, final int fallback) {
    final String value = lookup(env, envKey, props, key);
    if (value == null) {
      return fallback;
    }
    final long parsed = parseLong(value, key);
    Validate.isTrue(parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE, "%s out of range: %s", key, value);
    return (int) parsed;
  }

  private static boolean bool(final Properties props, final String key, final boolean fallback) {
    final String value = lookup(null, null, props, key);
    if (value == null) {
      return fallback;
    }
    switch (value.toLowerCase(Locale.ROOT)) {
      case "true":
      case "yes":
      case "1":
        return true;
      case "false":
      case "no":
      case "0":
        return false;
      default:
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + value + "'");
    }
  }

  private static BufferStrategy strategy(final Properties props, final BufferStrategy fallback) {
    final String value = lookup(null, null, props, KEY_BUFFER_STRATEGY);
    if (value == null) {
      return fallback;
    }
    try {
      return BufferStrategy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid buffer strategy for " + KEY_BUFFER_STRATEGY + ": '" + value
          + "'", e);
    }
  }
}
