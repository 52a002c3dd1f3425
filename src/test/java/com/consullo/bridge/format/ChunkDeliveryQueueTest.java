package com.consullo.bridge.format;

import com.consullo.bridge.MutableClock;
import com.consullo.bridge.text.LineType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the rate-limited send queue.
 *
 * @since 1.0
 */
public class ChunkDeliveryQueueTest {

  private MutableClock clock;
  private ChunkDeliveryQueue queue;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    queue = new ChunkDeliveryQueue(Duration.ofMillis(500), clock);
  }

  @Test
  @DisplayName("Should hand out the highest priority first and keep arrival order among equals")
  void poll_MixedPriorities_HighestFirst() throws Exception {
    queue.addAll(List.of(chunk("normal one", LineType.NORMAL, 20), chunk("normal two", LineType.NORMAL, 20)));
    queue.addAll(List.of(chunk("Error: disk full", LineType.ERROR, 130)));

    assertThat(drainAll()).containsExactly("Error: disk full", "normal one", "normal two");
  }

  @Test
  @DisplayName("Should space sends by the minimum interval")
  void poll_WithinInterval_Empty() throws Exception {
    queue.addAll(List.of(chunk("a", LineType.NORMAL, 20), chunk("b", LineType.NORMAL, 20)));

    assertThat(queue.poll()).map(c -> c.metadata().text()).contains("a");
    assertThat(queue.poll()).isEmpty();
    assertThat(queue.untilNextSend()).isEqualTo(Duration.ofMillis(500));

    clock.advance(Duration.ofMillis(300));
    assertThat(queue.poll()).isEmpty();
    assertThat(queue.untilNextSend()).isEqualTo(Duration.ofMillis(200));

    clock.advance(Duration.ofMillis(200));
    assertThat(queue.untilNextSend()).isEqualTo(Duration.ZERO);
    assertThat(queue.poll()).map(c -> c.metadata().text()).contains("b");
    assertThat(queue.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should estimate the send time from queue size and interval")
  void estimateSendTime_QueuedChunks() throws Exception {
    assertThat(queue.estimateSendTime()).isEqualTo(Duration.ZERO);
    assertThat(queue.poll()).isEmpty();

    queue.addAll(List.of(chunk("a", LineType.NORMAL, 20), chunk("b", LineType.INFO, 50),
        chunk("c", LineType.NORMAL, 20)));

    assertThat(queue.size()).isEqualTo(3);
    assertThat(queue.estimateSendTime()).isEqualTo(Duration.ofMillis(1500));

    queue.clear();
    assertThat(queue.isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should order real chunker output by its priority score")
  void addAll_ChunkerOutput_ErrorsJumpAhead() throws Exception {
    final MessageChunker chunker = new MessageChunker();
    final ChunkDeliveryQueue unpaced = new ChunkDeliveryQueue(Duration.ZERO, clock);
    unpaced.addAll(chunker.format("still working on it", LineType.PROGRESS));
    unpaced.addAll(chunker.format("Error: build failed", LineType.ERROR));

    final Optional<MessageChunk> first = unpaced.poll();
    assertThat(first).isPresent();
    assertThat(first.get().type()).isEqualTo(LineType.ERROR);
    assertThat(unpaced.poll()).map(MessageChunk::type).contains(LineType.PROGRESS);
  }

  private List<String> drainAll() {
    final List<String> texts = new ArrayList<>();
    Optional<MessageChunk> next;
    while ((next = queue.poll()).isPresent()) {
      texts.add(next.get().metadata().text());
      clock.advance(Duration.ofMillis(500));
    }
    return texts;
  }

  private static MessageChunk chunk(final String text, final LineType type, final int priority) {
    return new MessageChunk(text, type, priority, Instant.EPOCH,
        new MessageChunk.Metadata(0, 1, "", ChunkFormat.PLAIN, text, text.length()));
  }
}
