package io.syncqueue.support;

import io.syncqueue.QueueListener;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.dispatch.BatchExecutor;
import io.syncqueue.dispatch.DefaultInFlightTracker;
import io.syncqueue.dispatch.EventWorker;
import io.syncqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.syncqueue.dispatch.FailureHandler;
import io.syncqueue.dispatch.PriorityDispatcher;
import io.syncqueue.ratelimit.RateLimiter;
import io.syncqueue.spi.EventProcessor;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;
import io.syncqueue.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Dispatch components wired the way the engine wires them, for tests that exercise one
 * layer directly.
 */
public final class Pipeline implements AutoCloseable {
  public final RunStats stats;
  public final ErrorRecorder errors;
  public final DefaultInFlightTracker tracker = new DefaultInFlightTracker();
  public final FailureHandler failureHandler;
  public final EventWorker worker;
  public final BatchExecutor batchExecutor;
  public final PriorityDispatcher dispatcher;

  private final ExecutorService workerExecutor =
      Executors.newCachedThreadPool(new DaemonThreadFactory("test-worker-"));
  private final ExecutorService processorExecutor =
      Executors.newCachedThreadPool(new DaemonThreadFactory("test-processor-"));

  public Pipeline(EventStore store, EventProcessor processor, QueueConfig config, Clock clock,
      RateLimiter rateLimiter, MetricsExporter metrics, QueueListener listener) {
    this.stats = new RunStats(clock);
    this.errors = new ErrorRecorder(stats, metrics, listener);
    this.failureHandler = new FailureHandler(store, config, new ExponentialBackoffRetryPolicy(),
        stats, metrics, listener, errors, clock);
    this.worker = new EventWorker(store, processor, config, tracker, failureHandler, stats,
        metrics, listener, errors, processorExecutor);
    this.batchExecutor = new BatchExecutor(worker, config, tracker, stats, metrics, listener,
        errors, workerExecutor);
    this.dispatcher = new PriorityDispatcher(store, config, rateLimiter, tracker, batchExecutor,
        worker, stats, metrics, errors);
  }

  public Pipeline(EventStore store, EventProcessor processor, QueueConfig config, Clock clock) {
    this(store, processor, config, clock, RateLimiter.UNLIMITED, MetricsExporter.NOOP, new QueueListener() { });
  }

  @Override
  public void close() {
    workerExecutor.shutdownNow();
    processorExecutor.shutdownNow();
  }
}
