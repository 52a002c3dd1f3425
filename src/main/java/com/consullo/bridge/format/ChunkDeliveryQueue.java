package com.consullo.bridge.format;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;

/**
 * Send queue for chat transports that limit the message rate.
 *
 * <p>
 * Chunks leave the queue highest {@link MessageChunk#priority()} first, in arrival order among equal priorities, and
 * never closer together than the minimum send interval. The queue does not block: {@link #poll()} returns empty
 * while the interval has not elapsed and {@link #untilNextSend()} tells the caller how long to wait.
 * </p>
 *
 * @since 1.0
 */
public final class ChunkDeliveryQueue {

  /** Default spacing between two sends. */
  public static final Duration DEFAULT_MIN_SEND_INTERVAL = Duration.ofMillis(500);

  private static final Comparator<Entry> ORDER = Comparator
      .comparingInt((Entry e) -> e.chunk().priority()).reversed()
      .thenComparingLong(Entry::sequence);

  private final Duration minSendInterval;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock
  private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
  private long nextSequence;
  private Instant lastSent;

  public ChunkDeliveryQueue() {
    this(DEFAULT_MIN_SEND_INTERVAL, Clock.systemUTC());
  }

  /**
   * Creates a queue.
   *
   * @param minSendInterval minimum time between two chunks leaving the queue; zero disables spacing
   * @param clock time source
   */
  public ChunkDeliveryQueue(final Duration minSendInterval, final Clock clock) {
    Validate.notNull(minSendInterval, "minSendInterval must not be null");
    Validate.isTrue(!minSendInterval.isNegative(), "minSendInterval must not be negative");
    Validate.notNull(clock, "clock must not be null");
    this.minSendInterval = minSendInterval;
    this.clock = clock;
  }

  public Duration minSendInterval() {
    return minSendInterval;
  }

  /**
   * Enqueues the chunks of one delivery.
   *
   * @param chunks chunks in delivery order
   */
  public void addAll(final List<MessageChunk> chunks) {
    Validate.notNull(chunks, "chunks must not be null");
    Validate.noNullElements(chunks, "chunks must not contain null elements");
    lock.lock();
    try {
      for (MessageChunk chunk : chunks) {
        queue.add(new Entry(nextSequence++, chunk));
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the next chunk if the minimum send interval has elapsed since the previous one.
   *
   * @return the chunk to send now, or empty if the queue is empty or the caller must wait
   */
  public Optional<MessageChunk> poll() {
    lock.lock();
    try {
      if (queue.isEmpty()) {
        return Optional.empty();
      }
      final Instant now = clock.instant();
      if (lastSent != null && Duration.between(lastSent, now).compareTo(minSendInterval) < 0) {
        return Optional.empty();
      }
      lastSent = now;
      return Optional.of(queue.poll().chunk());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the time until {@link #poll()} may hand out the next chunk.
   *
   * @return remaining wait, zero when a send is allowed now
   */
  public Duration untilNextSend() {
    lock.lock();
    try {
      if (lastSent == null) {
        return Duration.ZERO;
      }
      final Duration remaining = minSendInterval.minus(Duration.between(lastSent, clock.instant()));
      return remaining.isNegative() ? Duration.ZERO : remaining;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Estimates how long sending every queued chunk takes at the minimum interval.
   *
   * @return estimate
   */
  public Duration estimateSendTime() {
    lock.lock();
    try {
      return minSendInterval.multipliedBy(queue.size());
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public void clear() {
    lock.lock();
    try {
      queue.clear();
    } finally {
      lock.unlock();
    }
  }

  private record Entry(long sequence, MessageChunk chunk) {
  }
}
