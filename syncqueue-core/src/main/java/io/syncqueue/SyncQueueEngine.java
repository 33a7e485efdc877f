package io.syncqueue;

import io.syncqueue.config.QueueConfig;
import io.syncqueue.dispatch.BatchExecutor;
import io.syncqueue.dispatch.DefaultInFlightTracker;
import io.syncqueue.dispatch.EventWorker;
import io.syncqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.syncqueue.dispatch.FailureHandler;
import io.syncqueue.dispatch.InFlightTracker;
import io.syncqueue.dispatch.PriorityDispatcher;
import io.syncqueue.dispatch.RetryPolicy;
import io.syncqueue.model.Priority;
import io.syncqueue.model.QueueStatistics;
import io.syncqueue.purge.CleanupResult;
import io.syncqueue.purge.CleanupSweeper;
import io.syncqueue.ratelimit.RateLimiter;
import io.syncqueue.ratelimit.TokenBucketRateLimiter;
import io.syncqueue.scheduler.TickScheduler;
import io.syncqueue.spi.EventProcessor;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;
import io.syncqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the dispatcher, tick loop and cleanup sweeper around an
 * {@link EventStore} and an {@link EventProcessor}.
 *
 * <p>Lifecycle: build, {@link #initialize(QueueConfig)}, {@link #start()}, {@link #stop()},
 * and finally {@link #close()}. {@code start} and {@code stop} may alternate freely.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SyncQueueEngine engine = SyncQueueEngine.builder()
 *     .store(store)
 *     .processor(event -> EventResult.ok())
 *     .build()) {
 *   engine.initialize(QueueConfig.defaults());
 *   engine.start();
 *   ...
 * }
 * }</pre>
 *
 * @see PriorityDispatcher
 * @see CleanupSweeper
 */
public final class SyncQueueEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncQueueEngine.class.getName());

  private final EventStore store;
  private final EventProcessor processor;
  private final CompositeQueueListener listener;
  private final MetricsExporter metrics;
  private final RetryPolicy retryPolicy;
  private final InFlightTracker inFlightTracker;
  private final Clock clock;
  private final QueueConfig defaultConfig;
  private final RunStats stats;
  private final ErrorRecorder errors;
  private final ExecutorService workerExecutor;
  private final ExecutorService processorExecutor;

  private volatile QueueConfig config;
  private volatile RateLimiter rateLimiter = RateLimiter.UNLIMITED;
  private volatile PriorityDispatcher dispatcher;
  private volatile TickScheduler tickScheduler;
  private volatile CleanupSweeper cleanupSweeper;
  private volatile boolean initialized;
  private volatile boolean processing;
  private volatile boolean closed;

  private SyncQueueEngine(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.listener = new CompositeQueueListener(builder.listeners);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.inFlightTracker = builder.inFlightTracker != null ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.defaultConfig = builder.config != null ? builder.config : QueueConfig.defaults();
    this.stats = new RunStats(clock);
    this.errors = new ErrorRecorder(stats, metrics, listener);
    this.workerExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("syncqueue-worker-"));
    this.processorExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("syncqueue-processor-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Initializes with the builder's configuration, or the defaults when none was given.
   */
  public boolean initialize() {
    return initialize(defaultConfig);
  }

  /**
   * Verifies store connectivity and builds the runtime components for {@code config}.
   * May be called again while stopped to apply a new configuration.
   *
   * @return {@code true} on success; failures are logged and recorded
   * @throws IllegalStateException if the engine is processing or closed
   */
  public synchronized boolean initialize(QueueConfig config) {
    if (closed) {
      throw new IllegalStateException("SyncQueueEngine has been closed");
    }
    if (processing) {
      throw new IllegalStateException("Cannot initialize while processing; call stop() first");
    }
    Objects.requireNonNull(config, "config");
    try {
      store.verifyConnectivity();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to initialize sync queue engine", e);
      errors.record("initialization", e);
      initialized = false;
      return false;
    }
    closeSchedulers();

    RateLimiter limiter = TokenBucketRateLimiter.from(config.rateLimit(), clock);
    FailureHandler failureHandler = new FailureHandler(
        store, config, retryPolicy, stats, metrics, listener, errors, clock);
    EventWorker worker = new EventWorker(
        store, processor, config, inFlightTracker, failureHandler, stats, metrics, listener,
        errors, processorExecutor);
    BatchExecutor batchExecutor = new BatchExecutor(
        worker, config, inFlightTracker, stats, metrics, listener, errors, workerExecutor);

    this.config = config;
    this.rateLimiter = limiter;
    this.dispatcher = new PriorityDispatcher(
        store, config, limiter, inFlightTracker, batchExecutor, worker, stats, metrics, errors);
    this.tickScheduler = TickScheduler.builder()
        .name("syncqueue-tick")
        .task(this::tick)
        .intervalMs(config.tickIntervalMs())
        .initialDelayMs(0)
        .errorHandler(t -> errors.record("processing_loop", t))
        .build();
    this.cleanupSweeper = CleanupSweeper.builder()
        .store(store)
        .completedRetentionDays(config.completedRetentionDays())
        .deadLetter(config.deadLetter())
        .intervalMs(config.cleanupIntervalMs())
        .errors(errors)
        .build();
    stats.markStarted();
    initialized = true;
    logger.log(Level.INFO, "Sync queue engine initialized: {0}", config);
    return true;
  }

  /**
   * Starts the tick loop and the cleanup sweeper. Calling again while running has no effect.
   *
   * @throws IllegalStateException if the engine is not initialized
   */
  public synchronized void start() {
    if (!initialized) {
      throw new IllegalStateException("SyncQueueEngine is not initialized");
    }
    if (processing) {
      return;
    }
    tickScheduler.start();
    cleanupSweeper.start();
    processing = true;
    logger.log(Level.INFO, "Sync queue processing started (tick every {0} ms)", config.tickIntervalMs());
    listener.onProcessingStarted();
  }

  /**
   * Cancels the tick loop and the cleanup sweeper. Workers already running finish on their own.
   */
  public synchronized void stop() {
    if (!processing) {
      return;
    }
    tickScheduler.stop();
    cleanupSweeper.stop();
    processing = false;
    logger.log(Level.INFO, "Sync queue processing stopped");
    listener.onProcessingStopped();
  }

  public boolean isInitialized() {
    return initialized;
  }

  public boolean isProcessing() {
    return processing;
  }

  /**
   * Runs one dispatch tick on the calling thread.
   *
   * @return number of events completed
   * @throws IllegalStateException if the engine is not initialized
   */
  public int tick() {
    return requireDispatcher().tick();
  }

  /**
   * Runs one cleanup sweep on the calling thread.
   *
   * @throws IllegalStateException if the engine is not initialized
   */
  public CleanupResult runCleanup() {
    if (!initialized) {
      throw new IllegalStateException("SyncQueueEngine is not initialized");
    }
    return cleanupSweeper.runOnce();
  }

  public EngineStatus getStatus() {
    QueueConfig current = config;
    Map<Priority, WorkerPoolStatus> pools = new EnumMap<>(Priority.class);
    for (Priority priority : Priority.values()) {
      pools.put(priority, new WorkerPoolStatus(
          inFlightTracker.activeCount(priority), inFlightTracker.startedCount(priority)));
    }
    return new EngineStatus(
        initialized,
        processing,
        inFlightTracker.activeCount(),
        current != null ? current.maxConcurrentWorkers() : defaultConfig.maxConcurrentWorkers(),
        current,
        stats.snapshot(),
        rateLimiter.availableTokens(),
        pools);
  }

  /**
   * Returns aggregate counts from the store.
   *
   * @throws RuntimeException the store's failure, after logging it
   */
  public QueueStatistics getQueueStatistics() {
    try {
      return store.getQueueStatistics();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read queue statistics", e);
      throw e;
    }
  }

  /**
   * Fetches up to {@code limit} events of one priority and processes them one after another,
   * outside the tick loop and without consuming rate-limit tokens.
   *
   * @throws IllegalStateException    if the engine is not initialized
   * @throws IllegalArgumentException if {@code limit < 1}
   */
  public ManualRunResult runPriorityManually(Priority priority, int limit) {
    Objects.requireNonNull(priority, "priority");
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    PriorityDispatcher current = requireDispatcher();
    try {
      ManualRunResult result = current.runManually(priority, limit);
      logger.log(Level.INFO, "Manual {0} run processed {1} of {2} events",
          new Object[]{priority.wireName(), result.processed(), result.total()});
      return result;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Manual " + priority.wireName() + " run failed", e);
      errors.record("manual_run", e);
      return ManualRunResult.failed(e.getMessage() != null ? e.getMessage() : e.toString());
    }
  }

  /**
   * Returns failed events to pending with a zero retry count.
   *
   * @param priority    only reset this priority, or {@code null} for all
   * @param maxAgeHours only reset events that failed within this many hours
   * @return number of events reset, or {@code 0} if the store failed
   */
  public int resetFailedEvents(Priority priority, int maxAgeHours) {
    if (maxAgeHours < 1) {
      throw new IllegalArgumentException("maxAgeHours must be >= 1");
    }
    try {
      int reset = store.resetFailedEvents(priority, maxAgeHours);
      logger.log(Level.INFO, "Reset {0} failed events", reset);
      return reset;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to reset failed events", e);
      errors.record("reset_failed", e);
      return 0;
    }
  }

  /**
   * Stops processing, shuts down the worker pools and marks the engine uninitialized.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    stop();
    closeSchedulers();
    closed = true;
    initialized = false;
    shutdown(workerExecutor);
    shutdown(processorExecutor);
    logger.log(Level.INFO, "Sync queue engine closed");
  }

  private PriorityDispatcher requireDispatcher() {
    PriorityDispatcher current = dispatcher;
    if (!initialized || current == null) {
      throw new IllegalStateException("SyncQueueEngine is not initialized");
    }
    return current;
  }

  private void closeSchedulers() {
    if (tickScheduler != null) {
      tickScheduler.close();
    }
    if (cleanupSweeper != null) {
      cleanupSweeper.close();
    }
  }

  private static void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link SyncQueueEngine}. */
  public static final class Builder {
    private EventStore store;
    private EventProcessor processor;
    private final List<QueueListener> listeners = new ArrayList<>();
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private InFlightTracker inFlightTracker;
    private Clock clock;
    private QueueConfig config;

    private Builder() {}

    /**
     * Sets the event store.
     *
     * <p><b>Required.</b>
     */
    public Builder store(EventStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the processor that syncs each event.
     *
     * <p><b>Required.</b>
     */
    public Builder processor(EventProcessor processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Appends a lifecycle listener.
     */
    public Builder listener(QueueListener listener) {
      this.listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public Builder listeners(List<? extends QueueListener> listeners) {
      listeners.forEach(this::listener);
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the retry delay policy.
     *
     * <p>Optional. Defaults to uncapped {@link ExponentialBackoffRetryPolicy}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the in-flight tracker.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the clock used for retry schedules, rate limiting and statistics.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the configuration used by {@link SyncQueueEngine#initialize()}.
     *
     * <p>Optional. Defaults to {@link QueueConfig#defaults()}.
     */
    public Builder config(QueueConfig config) {
      this.config = config;
      return this;
    }

    /**
     * @throws NullPointerException if {@code store} or {@code processor} is null
     */
    public SyncQueueEngine build() {
      return new SyncQueueEngine(this);
    }
  }
}
