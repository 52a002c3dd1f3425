package com.consullo.bridge.demo;

import com.consullo.bridge.config.BridgeConfig;
import com.consullo.bridge.format.ChunkDeliveryQueue;
import com.consullo.bridge.format.MessageChunk;
import com.consullo.bridge.session.Session;
import com.consullo.bridge.session.SessionEventListener;
import com.consullo.bridge.session.SessionManager;
import com.consullo.bridge.session.SessionSnapshot;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that runs {@link BridgeFixtureApp} in a session and prints the chunk stream to stdout, paced through a
 * {@link ChunkDeliveryQueue} the way a rate-limited chat transport would send it.
 *
 * @since 1.0
 */
public final class SessionBridgeDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionBridgeDemo.class);

  private SessionBridgeDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
    final List<String> cmd = List.of(javaBin, "-cp", System.getProperty("java.class.path"),
        BridgeFixtureApp.class.getName());

    final BridgeConfig config = BridgeConfig.defaults()
        .withCommand(cmd)
        .withFlushInterval(Duration.ofMillis(300));

    final SessionManager manager = new SessionManager(config);
    final ChunkDeliveryQueue outbox = new ChunkDeliveryQueue(Duration.ofMillis(100), Clock.systemUTC());
    manager.addListener(new SessionEventListener() {
      @Override
      public void onSessionCreated(final SessionSnapshot session) {
        System.out.println("=== Session " + session.id() + " created ===");
      }

      @Override
      public void onOutput(final String sessionId, final List<MessageChunk> chunks) {
        outbox.addAll(chunks);
      }

      @Override
      public void onSessionTerminated(final SessionSnapshot session) {
        System.out.println("=== Session " + session.id() + " terminated (" + session.commandCount()
            + " commands) ===");
      }
    });
    manager.start();

    try {
      final Session session = manager.createSession();
      if (session == null) {
        LOGGER.error("Demo session could not be started");
        return;
      }
      LOGGER.info("Started demo session {} PID={}", session.id(), session.controller().pid());

      drain(outbox, 1000L);
      manager.sendCommand(session.id(), "y");
      manager.sendCommand(session.id(), "hello from the bridge");
      drain(outbox, 800L);
      manager.sendCommand(session.id(), "exit");
      drain(outbox, 500L);

      LOGGER.info("Stats: {}", manager.getSessionStats());
    } finally {
      manager.stop();
    }
    LOGGER.info("Demo completed");
  }

  private static void drain(final ChunkDeliveryQueue outbox, final long millis) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    while (System.nanoTime() < deadline) {
      final Optional<MessageChunk> next = outbox.poll();
      if (next.isPresent()) {
        final MessageChunk chunk = next.get();
        System.out.println("[" + chunk.type() + "/" + chunk.metadata().format() + " p=" + chunk.priority() + "] "
            + chunk.content());
      } else {
        TimeUnit.MILLISECONDS.sleep(Math.max(20L, outbox.untilNextSend().toMillis()));
      }
    }
    if (!outbox.isEmpty()) {
      LOGGER.info("{} chunks still queued, about {} to send", outbox.size(), outbox.estimateSendTime());
    }
  }
}
