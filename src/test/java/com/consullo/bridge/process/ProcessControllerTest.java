package com.consullo.bridge.process;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Process controller tests against real {@code /bin/sh} children.
 *
 * @since 1.0
 */
public class ProcessControllerTest {

  @TempDir
  Path tempDir;

  private final BlockingQueue<String> stdout = new LinkedBlockingQueue<>();
  private final BlockingQueue<String> stderr = new LinkedBlockingQueue<>();
  private final CompletableFuture<Integer> exited = new CompletableFuture<>();
  private final AtomicInteger exitCalls = new AtomicInteger();

  private ProcessController controller;

  @AfterEach
  void tearDown() {
    if (controller != null) {
      controller.terminate();
    }
  }

  @Test
  @DisplayName("Should forward stdin lines to the child and read its stdout")
  void sendInput_Cat_EchoesLine() throws Exception {
    controller = controller(List.of("/bin/cat"));
    controller.start();

    assertThat(controller.isRunning()).isTrue();
    assertThat(controller.pid()).isPositive();
    assertThat(controller.sendInput("hello")).isTrue();
    assertThat(controller.sendInput("world\n")).isTrue();

    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("hello");
    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("world");
  }

  @Test
  @DisplayName("Should read stderr separately from stdout")
  void start_StderrOutput_ForwardedAsStderr() throws Exception {
    controller = controller(List.of("/bin/sh", "-c", "echo out; echo oops 1>&2"));
    controller.start();

    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("out");
    assertThat(stderr.poll(5, TimeUnit.SECONDS)).isEqualTo("oops");
  }

  @Test
  @DisplayName("Should report a missing executable as NOT_FOUND")
  void start_MissingExecutable_NotFound() throws Exception {
    controller = controller(List.of("/nonexistent/bridge-missing-binary"));
    final ProcessStartException byPath = assertThrows(ProcessStartException.class, controller::start);
    assertThat(byPath.reason()).isEqualTo(ProcessStartException.Reason.NOT_FOUND);

    controller = controller(List.of("bridge-missing-binary-on-path"));
    final ProcessStartException onPath = assertThrows(ProcessStartException.class, controller::start);
    assertThat(onPath.reason()).isEqualTo(ProcessStartException.Reason.NOT_FOUND);
    assertThat(controller.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should report a non-executable file as PERMISSION_DENIED")
  void start_NotExecutable_PermissionDenied() throws Exception {
    final Path script = Files.writeString(tempDir.resolve("script.sh"), "echo hi\n");
    controller = controller(List.of(script.toString()));

    final ProcessStartException e = assertThrows(ProcessStartException.class, controller::start);
    assertThat(e.reason()).isEqualTo(ProcessStartException.Reason.PERMISSION_DENIED);
  }

  @Test
  @DisplayName("Should create a missing working directory")
  void start_MissingWorkingDirectory_Created() throws Exception {
    final Path workDir = tempDir.resolve("a").resolve("b");
    controller = new ProcessController("T1", ProcessConfig.of(List.of("/bin/sh", "-c", "pwd"), workDir),
        ProcessLauncher.PIPES, this::collect, this::exited);

    controller.start();

    assertThat(Files.isDirectory(workDir)).isTrue();
    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo(workDir.toRealPath().toString());
  }

  @Test
  @DisplayName("Should notify the exit listener and refuse input after the child exits")
  void sendInput_AfterExit_ReturnsFalse() throws Exception {
    controller = controller(List.of("/bin/sh", "-c", "exit 3"));
    controller.start();

    assertThat(exited.get(5, TimeUnit.SECONDS)).isEqualTo(3);
    assertThat(controller.isRunning()).isFalse();
    assertThat(controller.exitCode()).isEqualTo(3);
    assertThat(controller.sendInput("too late")).isFalse();
  }

  @Test
  @DisplayName("Should kill a child that ignores the graceful signal after the grace period")
  void terminate_IgnoresSigterm_ForcedKill() throws Exception {
    final ProcessConfig config = ProcessConfig.of(
        List.of("/bin/sh", "-c", "trap '' TERM; echo ready; while true; do sleep 0.1; done"), tempDir)
        .withGracePeriod(Duration.ofMillis(500));
    controller = new ProcessController("T1", config, ProcessLauncher.PIPES, this::collect, this::exited);
    controller.start();
    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("ready");

    final long startNanos = System.nanoTime();
    controller.terminate();
    final long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

    assertThat(controller.isRunning()).isFalse();
    assertThat(elapsedMillis).isGreaterThanOrEqualTo(400L);
    assertThat(exitCalls.get()).isZero();
  }

  @Test
  @DisplayName("Should treat repeated termination as a no-op")
  void terminate_CalledTwice_Idempotent() throws Exception {
    controller = controller(List.of("/bin/cat"));
    controller.terminate();

    controller.start();
    controller.terminate();
    controller.terminate();

    assertThat(controller.isRunning()).isFalse();
    assertThat(controller.sendInput("x")).isFalse();
    assertThat(exitCalls.get()).isZero();
  }

  @Test
  @DisplayName("Should replace the child on restart")
  void restart_RunningChild_NewProcess() throws Exception {
    controller = controller(List.of("/bin/cat"));
    controller.start();
    final long firstPid = controller.pid();

    controller.restart();

    assertThat(controller.isRunning()).isTrue();
    assertThat(controller.pid()).isNotEqualTo(firstPid);
    assertThat(controller.sendInput("again")).isTrue();
    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("again");
  }

  @Test
  @DisplayName("Should refuse to start a second child while one is running")
  void start_AlreadyRunning_Rejected() throws Exception {
    controller = controller(List.of("/bin/cat"));
    controller.start();

    assertThrows(IllegalStateException.class, controller::start);
  }

  @Test
  @DisplayName("Should answer liveness polls promptly while terminate waits for output readers")
  void isRunning_DuringTerminateWithOpenPipe_Prompt() throws Exception {
    controller = controller(List.of("/bin/sh", "-c", "(sleep 3; echo late-line) & exec cat"));
    controller.start();
    assertThat(controller.sendInput("ready")).isTrue();
    assertThat(stdout.poll(5, TimeUnit.SECONDS)).isEqualTo("ready");

    final AtomicBoolean done = new AtomicBoolean();
    final AtomicLong maxPollMillis = new AtomicLong();
    final ExecutorService poller = Executors.newSingleThreadExecutor();
    try {
      final Future<?> polling = poller.submit(() -> {
        while (!done.get()) {
          final long t0 = System.nanoTime();
          controller.isRunning();
          controller.pid();
          maxPollMillis.accumulateAndGet(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0), Math::max);
          try {
            TimeUnit.MILLISECONDS.sleep(20L);
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
          }
        }
      });

      controller.terminate();
      done.set(true);
      polling.get(5, TimeUnit.SECONDS);
    } finally {
      poller.shutdownNow();
    }

    assertThat(controller.isRunning()).isFalse();
    assertThat(maxPollMillis.get()).isLessThan(500L);
  }

  @Test
  @DisplayName("Should refuse to spawn again once closed")
  void close_ThenStartOrRestart_Rejected() throws Exception {
    controller = controller(List.of("/bin/cat"));
    controller.start();

    controller.close();

    assertThat(controller.isClosed()).isTrue();
    assertThat(controller.isRunning()).isFalse();
    assertThrows(IllegalStateException.class, controller::start);
    assertThrows(IllegalStateException.class, controller::restart);
    assertThat(controller.isRunning()).isFalse();
    assertThat(exitCalls.get()).isZero();
  }

  @Test
  @DisplayName("Should require a positive grace period")
  void processConfig_ZeroGracePeriod_Rejected() throws Exception {
    final ProcessConfig config = ProcessConfig.of(List.of("/bin/cat"), tempDir);

    assertThatThrownBy(() -> config.withGracePeriod(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> config.withGracePeriod(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private ProcessController controller(final List<String> command) {
    return new ProcessController("T1", ProcessConfig.of(command, tempDir), ProcessLauncher.PIPES, this::collect,
        this::exited);
  }

  private void collect(final StreamKind stream, final String line) {
    if (stream == StreamKind.STDOUT) {
      stdout.add(line);
    } else {
      stderr.add(line);
    }
  }

  private void exited(final int code) {
    exitCalls.incrementAndGet();
    exited.complete(code);
  }
}
