package com.consullo.bridge.session;

import com.consullo.bridge.MutableClock;
import com.consullo.bridge.capture.OutputBuffer;
import com.consullo.bridge.process.ProcessConfig;
import com.consullo.bridge.process.ProcessLauncher;
import com.consullo.bridge.process.StreamKind;
import com.consullo.bridge.text.LineType;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Tests for session state and bounded history. The process is never started.
 *
 * @since 1.0
 */
public class SessionTest {

  private MutableClock clock;
  private Session session;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    session = new Session("ABC123", ProcessConfig.of(List.of("/bin/cat"), Path.of("/tmp")),
        mock(ProcessLauncher.class), mock(OutputBuffer.class), 100, clock);
  }

  @Test
  @DisplayName("Should start inactive with no running process")
  void newSession_Inactive() throws Exception {
    assertThat(session.status()).isEqualTo(SessionStatus.INACTIVE);
    assertThat(session.isActive()).isFalse();
    assertThat(session.transport()).isEmpty();
    assertThat(session.snapshot().active()).isFalse();
  }

  @Test
  @DisplayName("Should evict the oldest commands beyond the history cap")
  void addCommand_OverCap_EvictsOldest() throws Exception {
    for (int i = 0; i < 105; i++) {
      session.addCommand("cmd " + i);
    }

    assertThat(session.commandHistory()).hasSize(100);
    assertThat(session.commandHistory().get(0)).isEqualTo("cmd 5");
    assertThat(session.recentCommands(2)).containsExactly("cmd 103", "cmd 104");
  }

  @Test
  @DisplayName("Should keep at most fifty output lines")
  void addOutput_OverCap_EvictsOldest() throws Exception {
    for (int i = 0; i < 60; i++) {
      session.addOutput("out " + i);
    }

    assertThat(session.outputHistory()).hasSize(Session.MAX_OUTPUT_HISTORY);
    assertThat(session.recentOutput(1)).containsExactly("out 59");
    assertThat(session.snapshot().outputCount()).isEqualTo(50);
  }

  @Test
  @DisplayName("Should expire after the idle timeout and always once terminated")
  void isExpired_IdleOrTerminated() throws Exception {
    final Duration timeout = Duration.ofSeconds(1);
    assertThat(session.isExpired(timeout, clock.instant())).isFalse();

    clock.advance(Duration.ofSeconds(2));
    assertThat(session.isExpired(timeout, clock.instant())).isTrue();

    session.touch();
    assertThat(session.isExpired(timeout, clock.instant())).isFalse();

    session.markTerminated();
    assertThat(session.isExpired(timeout, clock.instant())).isTrue();
  }

  @Test
  @DisplayName("Should not reactivate a session whose process already died")
  void markStarted_AfterTermination_StaysTerminated() throws Exception {
    session.markTerminated();
    session.markStarted();

    assertThat(session.status()).isEqualTo(SessionStatus.TERMINATED);

    session.markRestarted();
    assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);
  }

  @Test
  @DisplayName("Should deliver stderr lines as prefixed errors and stdout lines unchanged")
  void onProcessLine_Stderr_PrefixedError() throws Exception {
    final OutputBuffer buffer = mock(OutputBuffer.class);
    final Session withBuffer = new Session("ERR001", ProcessConfig.of(List.of("/bin/cat"), Path.of("/tmp")),
        mock(ProcessLauncher.class), buffer, 100, clock);

    withBuffer.onProcessLine(StreamKind.STDERR, "disk full");
    withBuffer.onProcessLine(StreamKind.STDOUT, "plain output");

    verify(buffer).addOutput("ERROR: disk full", LineType.ERROR, StreamKind.STDERR);
    verify(buffer).addOutput("plain output", null, StreamKind.STDOUT);
    assertThat(withBuffer.outputHistory()).containsExactly("ERROR: disk full", "plain output");
  }
}
