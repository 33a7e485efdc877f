package io.syncqueue.dispatch;

import io.syncqueue.ManualRunResult;
import io.syncqueue.config.PriorityPolicy;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.Priority;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.ratelimit.RateLimiter;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One dispatch tick: visits priorities from {@link Priority#CRITICAL} to
 * {@link Priority#LOW}, fetching and executing each level's due events.
 *
 * <p>The highest priority is serviced first on every tick, so under sustained overload
 * lower priorities can starve. The tick stops early once the shared worker cap is
 * reached. A denied rate-limit permit or a failing fetch skips only that priority.
 */
public final class PriorityDispatcher {
  private static final Logger logger = Logger.getLogger(PriorityDispatcher.class.getName());

  private final EventStore store;
  private final QueueConfig config;
  private final RateLimiter rateLimiter;
  private final InFlightTracker inFlightTracker;
  private final BatchExecutor batchExecutor;
  private final EventWorker worker;
  private final RunStats stats;
  private final MetricsExporter metrics;
  private final ErrorRecorder errors;

  public PriorityDispatcher(EventStore store, QueueConfig config, RateLimiter rateLimiter,
      InFlightTracker inFlightTracker, BatchExecutor batchExecutor, EventWorker worker,
      RunStats stats, MetricsExporter metrics, ErrorRecorder errors) {
    this.store = Objects.requireNonNull(store, "store");
    this.config = Objects.requireNonNull(config, "config");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.inFlightTracker = Objects.requireNonNull(inFlightTracker, "inFlightTracker");
    this.batchExecutor = Objects.requireNonNull(batchExecutor, "batchExecutor");
    this.worker = Objects.requireNonNull(worker, "worker");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  /**
   * Runs a single tick. Called by the scheduler, but may also be invoked directly.
   *
   * @return number of events completed during this tick
   */
  public int tick() {
    long startNanos = System.nanoTime();
    int processed = 0;
    for (Priority priority : Priority.values()) {
      if (inFlightTracker.activeCount() >= config.maxConcurrentWorkers()) {
        logger.log(Level.FINE, "Worker cap {0} reached, ending tick before {1}",
            new Object[]{config.maxConcurrentWorkers(), priority.wireName()});
        break;
      }
      processed += dispatchPriority(priority);
    }
    if (processed > 0) {
      stats.recordTick(processed, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
    return processed;
  }

  private int dispatchPriority(Priority priority) {
    if (!rateLimiter.tryConsume()) {
      metrics.incrementRateLimited();
      logger.log(Level.FINE, "Rate limited, skipping {0} this tick", priority.wireName());
      return 0;
    }
    List<SyncEvent> events;
    try {
      events = fetch(priority, config.batchSize());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch " + priority.wireName() + " priority events", e);
      errors.record(priority.wireName() + "_queue", e);
      return 0;
    }
    if (events.isEmpty()) {
      return 0;
    }
    logger.log(Level.FINE, "Processing {0} {1} priority events",
        new Object[]{events.size(), priority.wireName()});
    return batchExecutor.execute(events, priority);
  }

  /**
   * Fetches up to {@code limit} events of one priority and runs them one after another,
   * bypassing the rate limiter. Store failures propagate to the caller.
   *
   * @return processed and fetched counts
   */
  public ManualRunResult runManually(Priority priority, int limit) {
    List<SyncEvent> events = fetch(priority, limit);
    int processed = 0;
    for (SyncEvent event : events) {
      if (worker.run(event)) {
        processed++;
      }
    }
    return ManualRunResult.completed(processed, events.size());
  }

  private List<SyncEvent> fetch(Priority priority, int limit) {
    PriorityPolicy policy = config.policy(priority);
    List<SyncEvent> events = store.fetchPendingByPriority(priority, limit, policy.maxRetries());
    return events == null ? List.of() : events;
  }
}
