package com.consullo.bridge.capture;

import com.consullo.bridge.format.MessageChunk;
import com.consullo.bridge.format.MessageChunker;
import com.consullo.bridge.process.StreamKind;
import com.consullo.bridge.text.AnsiStripper;
import com.consullo.bridge.text.LineClassifier;
import com.consullo.bridge.text.LineType;
import com.consullo.bridge.text.TextNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-session aggregation point between the process reader threads and the delivery sink.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Every line is normalized and classified on arrival, then appended to a ring buffer and the pending queue.</li>
 * <li>Error and success lines, prompts, a pending queue over its limit, or a buffer untouched for twice the flush
 * interval request an immediate flush.</li>
 * <li>A loop on the shared scheduler flushes once the flush interval has passed; under the smart strategy it polls
 * faster while lines arrive in bursts.</li>
 * <li>A flush groups the pending lines ({@link LineGrouper}), chunks each group ({@link MessageChunker}) and hands
 * the ordered batch to the {@link ChunkSink}.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Two locks: the state lock guards the queues and burst tracking and is never held while formatting or delivering;
 * the flush lock serializes flushes so batches reach the sink in order.
 * </p>
 *
 * @since 1.0
 */
public final class OutputBuffer {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputBuffer.class);

  static final Duration IDLE_POLL = Duration.ofMillis(500);
  static final Duration BURST_POLL = Duration.ofMillis(100);
  static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);
  static final int BURST_THRESHOLD = 5;
  static final Duration BURST_WINDOW = Duration.ofSeconds(2);
  static final Duration BURST_EXIT = Duration.ofSeconds(5);

  private final String sessionId;
  private final OutputBufferConfig config;
  private final MessageChunker chunker;
  private final LineClassifier classifier;
  private final ScheduledExecutorService scheduler;
  private final ChunkSink sink;
  private final Clock clock;

  private final ReentrantLock stateLock = new ReentrantLock();
  private final ReentrantLock flushLock = new ReentrantLock();

  // Guarded by stateLock
  private final Deque<OutputLine> recent = new ArrayDeque<>();
  private final List<OutputLine> pending = new ArrayList<>();
  private Instant lastFlush;
  private LineType lastLineType;
  private int consecutiveSimilar;
  private Instant similarRunStart;
  private Instant lastLineAt;
  private boolean burstMode;

  private volatile boolean running;
  private volatile boolean stopped;
  private volatile ScheduledFuture<?> loopFuture;

  /**
   * Creates a buffer. Call {@link #start()} to run the flush loop.
   *
   * @param sessionId owning session id
   * @param config buffer configuration
   * @param chunker chunker applied on flush
   * @param classifier line classifier
   * @param scheduler scheduler running the flush loop and requested flushes
   * @param sink receiver of chunk batches
   * @param clock time source
   */
  public OutputBuffer(
      final String sessionId,
      final OutputBufferConfig config,
      final MessageChunker chunker,
      final LineClassifier classifier,
      final ScheduledExecutorService scheduler,
      final ChunkSink sink,
      final Clock clock) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(chunker, "chunker must not be null");
    Validate.notNull(classifier, "classifier must not be null");
    Validate.notNull(scheduler, "scheduler must not be null");
    Validate.notNull(sink, "sink must not be null");
    Validate.notNull(clock, "clock must not be null");
    this.sessionId = sessionId;
    this.config = config;
    this.chunker = chunker;
    this.classifier = classifier;
    this.scheduler = scheduler;
    this.sink = sink;
    this.clock = clock;
    this.lastFlush = clock.instant();
  }

  public String sessionId() {
    return sessionId;
  }

  public OutputBufferConfig config() {
    return config;
  }

  /**
   * Starts the background flush loop. Calling it again while running has no effect.
   */
  public void start() {
    if (running || stopped) {
      return;
    }
    LOGGER.info("Starting output buffer for session {} ({})", sessionId, config.strategy());
    running = true;
    scheduleTick(pollInterval());
  }

  /**
   * Cancels the flush loop and flushes whatever is still pending. No buffered output is lost.
   */
  public void stop() {
    LOGGER.info("Stopping output buffer for session {}", sessionId);
    running = false;
    stopped = true;
    final ScheduledFuture<?> future = loopFuture;
    if (future != null) {
      future.cancel(false);
    }
    flush();
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Adds a line; its type is classified.
   *
   * @param content raw line (null or empty is ignored)
   */
  public void addOutput(final String content) {
    addOutput(content, null, StreamKind.STDOUT);
  }

  /**
   * Adds a line with a caller-supplied type.
   *
   * @param content raw line (null or empty is ignored)
   * @param type line type, or null to classify
   */
  public void addOutput(final String content, final LineType type) {
    addOutput(content, type, StreamKind.STDOUT);
  }

  /**
   * Adds a line read from the given stream.
   *
   * @param content raw line (null or empty is ignored)
   * @param type line type, or null to classify
   * @param stream source stream
   */
  public void addOutput(final String content, final LineType type, final StreamKind stream) {
    if (content == null || content.isEmpty()) {
      return;
    }

    final String text = TextNormalizer.normalize(content);
    final LineType lineType = type != null ? type : classifier.classify(text);
    final boolean prompt = classifier.isInteractivePrompt(text);
    final OutputLine line = new OutputLine(
        content,
        text,
        clock.instant(),
        sessionId,
        lineType,
        stream != null ? stream : StreamKind.STDOUT,
        new OutputLine.Metadata(AnsiStripper.containsEscape(content), content.length() - text.length(), prompt));

    final boolean flushNow;
    stateLock.lock();
    try {
      recent.addLast(line);
      while (recent.size() > config.maxBufferSize()) {
        recent.removeFirst();
      }
      pending.add(line);
      updateBurstDetection(line);
      flushNow = shouldFlushImmediately(line);
    } finally {
      stateLock.unlock();
    }

    if (flushNow) {
      requestFlush();
    }
  }

  /**
   * Drains the pending queue into grouped, chunked output and delivers it to the sink.
   *
   * <p>Flushing an empty queue is a no-op. Sink failures are logged, never propagated.
   *
   * @return the delivered chunks, empty if nothing was delivered
   */
  public List<MessageChunk> flush() {
    flushLock.lock();
    try {
      final List<OutputLine> batch;
      stateLock.lock();
      try {
        if (pending.isEmpty()) {
          return List.of();
        }
        batch = new ArrayList<>(pending);
        pending.clear();
        lastFlush = clock.instant();
      } finally {
        stateLock.unlock();
      }

      final List<MessageChunk> chunks = processLines(batch);
      if (chunks.isEmpty()) {
        return chunks;
      }
      LOGGER.debug("Flushing {} lines as {} chunks for session {}", batch.size(), chunks.size(), sessionId);
      try {
        sink.deliver(sessionId, chunks);
      } catch (RuntimeException e) {
        LOGGER.error("Chunk sink failed for session {}: {}", sessionId, e.getMessage(), e);
      }
      return chunks;
    } finally {
      flushLock.unlock();
    }
  }

  /**
   * Returns up to {@code count} of the most recent lines, oldest first.
   *
   * @param count maximum number of lines
   * @return copy of the most recent lines
   */
  public List<OutputLine> recentLines(final int count) {
    stateLock.lock();
    try {
      final List<OutputLine> all = new ArrayList<>(recent);
      final int from = Math.max(0, all.size() - Math.max(0, count));
      return new ArrayList<>(all.subList(from, all.size()));
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Drops every buffered and pending line without delivering it.
   */
  public void clear() {
    stateLock.lock();
    try {
      recent.clear();
      pending.clear();
    } finally {
      stateLock.unlock();
    }
    LOGGER.info("Buffer cleared for session {}", sessionId);
  }

  public int pendingCount() {
    stateLock.lock();
    try {
      return pending.size();
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Returns true while lines arrive in a burst of the same type. Burst mode ends after {@link #BURST_EXIT} without
   * new lines.
   *
   * @return burst state
   */
  public boolean isBurstMode() {
    stateLock.lock();
    try {
      if (burstMode && lastLineAt != null
          && Duration.between(lastLineAt, clock.instant()).compareTo(BURST_EXIT) > 0) {
        burstMode = false;
        LOGGER.debug("Leaving burst mode for session {}", sessionId);
      }
      return burstMode;
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Returns a statistics snapshot.
   *
   * @return buffer statistics
   */
  public BufferStats stats() {
    final boolean burst = isBurstMode();
    stateLock.lock();
    try {
      return new BufferStats(sessionId, recent.size(), pending.size(), lastFlush, config.flushInterval(), burst,
          consecutiveSimilar, config.strategy());
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Buffer statistics.
   *
   * @param sessionId owning session
   * @param totalLines lines held in the ring buffer
   * @param pendingLines lines waiting for the next flush
   * @param lastFlush time of the last flush (or buffer creation)
   * @param flushInterval configured flush interval
   * @param burstMode current burst state
   * @param consecutiveSimilar length of the current same-type run
   * @param strategy buffering strategy
   */
  public record BufferStats(
      String sessionId,
      int totalLines,
      int pendingLines,
      Instant lastFlush,
      Duration flushInterval,
      boolean burstMode,
      int consecutiveSimilar,
      BufferStrategy strategy) {
  }

  private List<MessageChunk> processLines(final List<OutputLine> lines) {
    final List<MessageChunk> out = new ArrayList<>();
    for (List<OutputLine> group : LineGrouper.group(lines)) {
      final String combined = LineGrouper.combine(group);
      if (combined.isBlank()) {
        continue;
      }
      out.addAll(chunker.format(combined, LineGrouper.aggregateType(group)));
    }
    return out;
  }

  // Caller holds stateLock.
  private void updateBurstDetection(final OutputLine line) {
    final Instant ts = line.timestamp();
    if (line.type() == lastLineType
        && similarRunStart != null
        && Duration.between(similarRunStart, ts).compareTo(BURST_WINDOW) <= 0) {
      consecutiveSimilar++;
    } else {
      consecutiveSimilar = 0;
      lastLineType = line.type();
      similarRunStart = ts;
    }
    lastLineAt = ts;

    if (!burstMode && consecutiveSimilar > BURST_THRESHOLD) {
      burstMode = true;
      LOGGER.debug("Entering burst mode for session {}", sessionId);
    }
  }

  // Caller holds stateLock.
  private boolean shouldFlushImmediately(final OutputLine line) {
    final BufferStrategy strategy = config.strategy();
    if (strategy == BufferStrategy.IMMEDIATE) {
      return true;
    }
    if (line.type().isHighPriority()) {
      return true;
    }
    if (line.metadata().interactivePrompt()) {
      return true;
    }
    if (pending.size() > config.maxPendingLines()) {
      return true;
    }
    if (strategy == BufferStrategy.LINE_BUFFERED && pending.size() >= config.lineFlushThreshold()) {
      return true;
    }
    return Duration.between(lastFlush, line.timestamp()).compareTo(config.flushInterval().multipliedBy(2)) > 0;
  }

  private void requestFlush() {
    if (stopped) {
      return;
    }
    try {
      scheduler.execute(this::flushFromScheduler);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Scheduler rejected flush for session {}: {}", sessionId, e.getMessage());
    }
  }

  private void flushFromScheduler() {
    try {
      flush();
    } catch (RuntimeException e) {
      LOGGER.error("Flush failed for session {}: {}", sessionId, e.getMessage(), e);
    }
  }

  private void tick() {
    if (!running) {
      return;
    }
    Duration next;
    try {
      if (isDue()) {
        flush();
      }
      next = pollInterval();
    } catch (RuntimeException e) {
      LOGGER.error("Error in buffer loop for session {}: {}", sessionId, e.getMessage(), e);
      next = ERROR_BACKOFF;
    }
    if (running) {
      scheduleTick(next);
    }
  }

  private boolean isDue() {
    stateLock.lock();
    try {
      return !pending.isEmpty()
          && Duration.between(lastFlush, clock.instant()).compareTo(config.flushInterval()) >= 0;
    } finally {
      stateLock.unlock();
    }
  }

  private Duration pollInterval() {
    if (config.strategy() == BufferStrategy.SMART && isBurstMode()) {
      return BURST_POLL;
    }
    return IDLE_POLL;
  }

  private void scheduleTick(final Duration delay) {
    try {
      loopFuture = scheduler.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Scheduler rejected buffer loop for session {}; stopping loop", sessionId);
      running = false;
    }
  }
}
