package com.consullo.bridge.capture;

import com.consullo.bridge.MutableClock;
import com.consullo.bridge.format.ChunkFormat;
import com.consullo.bridge.format.MessageChunk;
import com.consullo.bridge.format.MessageChunker;
import com.consullo.bridge.text.DefaultLineClassifier;
import com.consullo.bridge.text.LineType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for the output buffer. Most tests use a mocked scheduler so that flushes only happen when the test calls
 * {@link OutputBuffer#flush()}.
 *
 * @since 1.0
 */
public class OutputBufferTest {

  private MutableClock clock;
  private ScheduledExecutorService scheduler;
  private List<MessageChunk> delivered;
  private ChunkSink sink;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    scheduler = mock(ScheduledExecutorService.class);
    delivered = new CopyOnWriteArrayList<>();
    sink = (sessionId, chunks) -> delivered.addAll(chunks);
  }

  @Test
  @DisplayName("Should flush a colored error line as one clean error chunk")
  void addOutput_ColoredError_OneErrorChunk() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);

    buffer.addOutput("\u001b[31mError: disk full\u001b[0m");
    final List<MessageChunk> chunks = buffer.flush();

    assertThat(chunks).hasSize(1);
    final MessageChunk chunk = chunks.get(0);
    assertThat(chunk.type()).isEqualTo(LineType.ERROR);
    assertThat(chunk.content()).isEqualTo("Error: disk full");
    assertThat(chunk.content()).doesNotContain("\u001b");
    assertThat(chunk.metadata().format()).isEqualTo(ChunkFormat.EMBED);
    assertThat(delivered).containsExactly(chunk);
    // Error lines request an immediate flush.
    verify(scheduler).execute(any());
  }

  @Test
  @DisplayName("Should preserve line order and drop no line across groups")
  void flush_ManyLines_OrderPreserved() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);
    final List<String> expected = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      expected.add("line " + i);
      buffer.addOutput("line " + i);
    }

    final List<MessageChunk> chunks = buffer.flush();

    assertThat(chunks).hasSize(2);
    final String visible = chunks.stream().map(c -> c.metadata().text()).collect(Collectors.joining("\n"));
    assertThat(visible).isEqualTo(String.join("\n", expected));
    assertThat(buffer.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should number chunks per message while the batch list keeps delivery order")
  void flush_TwoGroups_IndexPerMessage() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);
    buffer.addOutput("Error: disk full");
    buffer.addOutput("retrying in a moment");

    final List<MessageChunk> chunks = buffer.flush();

    assertThat(chunks).hasSize(2);
    assertThat(chunks).extracting(c -> c.metadata().index()).containsExactly(0, 0);
    assertThat(chunks).extracting(c -> c.metadata().total()).containsExactly(1, 1);
    assertThat(chunks).extracting(MessageChunk::type).containsExactly(LineType.ERROR, LineType.NORMAL);
    assertThat(delivered).containsExactlyElementsOf(chunks);
  }

  @Test
  @DisplayName("Should split one long line into ordered chunks within the limit")
  void flush_LongLine_ChunkedWithinLimit() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);
    final String text = "Line ".repeat(500);

    buffer.addOutput(text, LineType.NORMAL);
    final List<MessageChunk> chunks = buffer.flush();

    assertThat(chunks.size()).isGreaterThanOrEqualTo(2);
    assertThat(chunks).allSatisfy(c -> assertThat(c.content().length()).isLessThanOrEqualTo(1900));
    final String rejoined = chunks.stream().map(c -> c.metadata().text()).collect(Collectors.joining(" "));
    assertThat(rejoined).isEqualTo(text.strip());
  }

  @Test
  @DisplayName("Should emit nothing when stopping with an empty queue")
  void stop_EmptyQueue_EmitsNothing() throws Exception {
    final ChunkSink mockSink = mock(ChunkSink.class);
    final OutputBuffer buffer = new OutputBuffer("S1", OutputBufferConfig.defaults(), new MessageChunker(),
        new DefaultLineClassifier(), scheduler, mockSink, clock);

    buffer.stop();

    verifyNoInteractions(mockSink);
  }

  @Test
  @DisplayName("Should flush pending output when stopped")
  void stop_PendingOutput_FinalFlush() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);
    buffer.addOutput("hello");
    assertThat(buffer.pendingCount()).isEqualTo(1);

    buffer.stop();

    assertThat(delivered).hasSize(1);
    assertThat(delivered.get(0).metadata().text()).isEqualTo("hello");
    assertThat(buffer.isRunning()).isFalse();
  }

  @Test
  @DisplayName("Should ignore empty content and skip lines that normalize to blank")
  void addOutput_EmptyOrBlank_NoChunks() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);

    buffer.addOutput("");
    buffer.addOutput(null);
    assertThat(buffer.pendingCount()).isZero();

    buffer.addOutput("\u001b[0m   ");
    assertThat(buffer.pendingCount()).isEqualTo(1);
    assertThat(buffer.flush()).isEmpty();
    assertThat(delivered).isEmpty();
  }

  @Test
  @DisplayName("Should request an immediate flush for prompts but not for plain lines")
  void addOutput_Prompt_RequestsFlush() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);

    buffer.addOutput("plain line");
    verify(scheduler, never()).execute(any());

    buffer.addOutput("Continue? (y/n)");
    verify(scheduler).execute(any());
  }

  @Test
  @DisplayName("Should enter burst mode on a run of similar lines and leave it when idle")
  void addOutput_SimilarRun_BurstMode() throws Exception {
    final OutputBuffer buffer = buffer(OutputBufferConfig.defaults(), clock);

    for (int i = 0; i < 7; i++) {
      buffer.addOutput("compiling module " + i);
      clock.advance(Duration.ofMillis(100));
    }
    assertThat(buffer.isBurstMode()).isTrue();
    assertThat(buffer.stats().burstMode()).isTrue();

    clock.advance(Duration.ofSeconds(6));
    assertThat(buffer.isBurstMode()).isFalse();
  }

  @Test
  @DisplayName("Should keep a bounded ring of recent lines and clear it on request")
  void recentLines_BoundedRing() throws Exception {
    final OutputBufferConfig config = new OutputBufferConfig(BufferStrategy.SMART, Duration.ofSeconds(2), 3, 20, 5);
    final OutputBuffer buffer = buffer(config, clock);
    for (int i = 0; i < 5; i++) {
      buffer.addOutput("line " + i);
    }

    assertThat(buffer.recentLines(10)).extracting(OutputLine::text).containsExactly("line 2", "line 3", "line 4");
    assertThat(buffer.recentLines(1)).extracting(OutputLine::text).containsExactly("line 4");
    assertThat(buffer.stats().totalLines()).isEqualTo(3);
    assertThat(buffer.stats().pendingLines()).isEqualTo(5);

    buffer.clear();
    assertThat(buffer.recentLines(10)).isEmpty();
    assertThat(buffer.pendingCount()).isZero();
  }

  @Test
  @DisplayName("Should deliver every line immediately under the immediate strategy")
  void addOutput_ImmediateStrategy_DeliversWithoutTimer() throws Exception {
    final ScheduledExecutorService real = Executors.newSingleThreadScheduledExecutor();
    try {
      final CountDownLatch latch = new CountDownLatch(1);
      final OutputBuffer buffer = new OutputBuffer("S1",
          OutputBufferConfig.defaults().withStrategy(BufferStrategy.IMMEDIATE), new MessageChunker(),
          new DefaultLineClassifier(), real, (id, chunks) -> latch.countDown(), Clock.systemUTC());

      buffer.addOutput("just a line");

      assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      real.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should flush from the background loop once the interval has passed")
  void start_TimerLoop_FlushesPendingOutput() throws Exception {
    final ScheduledExecutorService real = Executors.newSingleThreadScheduledExecutor();
    try {
      final List<MessageChunk> received = new CopyOnWriteArrayList<>();
      final CountDownLatch latch = new CountDownLatch(1);
      final OutputBuffer buffer = new OutputBuffer("S1",
          OutputBufferConfig.defaults().withFlushInterval(Duration.ofMillis(200)), new MessageChunker(),
          new DefaultLineClassifier(), real, (id, chunks) -> {
            received.addAll(chunks);
            latch.countDown();
          }, Clock.systemUTC());
      buffer.start();

      buffer.addOutput("some ordinary output");

      assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(received).extracting(c -> c.metadata().text()).containsExactly("some ordinary output");
      buffer.stop();
      assertThat(buffer.isRunning()).isFalse();
    } finally {
      real.shutdownNow();
    }
  }

  @Test
  @DisplayName("Should log and survive a failing sink")
  void flush_SinkThrows_ChunksStillReturned() throws Exception {
    final OutputBuffer buffer = new OutputBuffer("S1", OutputBufferConfig.defaults(), new MessageChunker(),
        new DefaultLineClassifier(), scheduler, (id, chunks) -> {
          throw new IllegalStateException("transport down");
        }, clock);
    buffer.addOutput("hello");

    assertThat(buffer.flush()).hasSize(1);
    assertThat(buffer.pendingCount()).isZero();
  }

  private OutputBuffer buffer(final OutputBufferConfig config, final Clock bufferClock) {
    return new OutputBuffer("S1", config, new MessageChunker(), new DefaultLineClassifier(), scheduler, sink,
        bufferClock);
  }
}
