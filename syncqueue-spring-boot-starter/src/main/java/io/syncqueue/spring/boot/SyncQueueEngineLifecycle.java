package io.syncqueue.spring.boot;

import io.syncqueue.SyncQueueEngine;
import io.syncqueue.config.QueueConfig;

import org.springframework.context.SmartLifecycle;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ties the engine to the application context: initializes it on context refresh, starts
 * processing when {@code syncqueue.auto-start} is true, and stops it on shutdown.
 *
 * <p>A failed initialization is logged and leaves the engine stopped; the application
 * keeps running and can retry through {@link SyncQueueEngine#initialize(QueueConfig)}.
 */
public class SyncQueueEngineLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(SyncQueueEngineLifecycle.class.getName());

  private final SyncQueueEngine engine;
  private final QueueConfig config;
  private final boolean autoStart;
  private volatile boolean running;

  public SyncQueueEngineLifecycle(SyncQueueEngine engine, QueueConfig config, boolean autoStart) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.config = Objects.requireNonNull(config, "config");
    this.autoStart = autoStart;
  }

  @Override
  public void start() {
    if (!engine.initialize(config)) {
      logger.log(Level.SEVERE, "Sync queue engine failed to initialize; processing not started");
      return;
    }
    if (autoStart) {
      engine.start();
    }
    running = true;
  }

  @Override
  public void stop() {
    engine.stop();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
