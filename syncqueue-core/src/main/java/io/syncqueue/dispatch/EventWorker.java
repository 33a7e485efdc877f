package io.syncqueue.dispatch;

import io.syncqueue.EventResult;
import io.syncqueue.QueueListener;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.EventStatus;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.spi.EventProcessor;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes one event: marks it processing, invokes the {@link EventProcessor} under the
 * priority's deadline, then marks it completed or hands it to the {@link FailureHandler}.
 *
 * <p>The processor call runs on a separate executor so the deadline can be enforced.
 * A timed-out call is cancelled with interruption; if the processor ignores the
 * interrupt it may keep running, and the store's sticky terminal states guard the row.
 */
public final class EventWorker {
  private static final Logger logger = Logger.getLogger(EventWorker.class.getName());

  static final String TIMEOUT_ERROR = "Processing timeout";

  private final EventStore store;
  private final EventProcessor processor;
  private final QueueConfig config;
  private final InFlightTracker inFlightTracker;
  private final FailureHandler failureHandler;
  private final RunStats stats;
  private final MetricsExporter metrics;
  private final QueueListener listener;
  private final ErrorRecorder errors;
  private final ExecutorService processorExecutor;

  public EventWorker(EventStore store, EventProcessor processor, QueueConfig config,
      InFlightTracker inFlightTracker, FailureHandler failureHandler, RunStats stats,
      MetricsExporter metrics, QueueListener listener, ErrorRecorder errors,
      ExecutorService processorExecutor) {
    this.store = Objects.requireNonNull(store, "store");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.config = Objects.requireNonNull(config, "config");
    this.inFlightTracker = Objects.requireNonNull(inFlightTracker, "inFlightTracker");
    this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.processorExecutor = Objects.requireNonNull(processorExecutor, "processorExecutor");
  }

  /**
   * Runs the event to an outcome. Never throws.
   *
   * @return {@code true} if the event completed successfully
   */
  public boolean run(SyncEvent event) {
    if (!inFlightTracker.tryAcquire(event.id(), event.priority())) {
      logger.log(Level.FINE, "Event {0} already in flight, skipping", event.id());
      return false;
    }
    metrics.recordActiveWorkers(inFlightTracker.activeCount());
    long startNanos = System.nanoTime();
    try {
      logger.log(Level.FINE, "Worker processing event {0} ({1})",
          new Object[]{event.id(), event.priority().wireName()});
      store.updateStatus(event.id(), EventStatus.PROCESSING, null);

      EventResult result = invoke(event);
      if (!result.success()) {
        failureHandler.handle(event, result.error());
        return false;
      }
      return complete(event, startNanos);
    } catch (Exception e) {
      failureHandler.handle(event, messageOf(e));
      return false;
    } finally {
      inFlightTracker.release(event.id(), event.priority());
      metrics.recordActiveWorkers(inFlightTracker.activeCount());
    }
  }

  /**
   * Hands a claimed event that will not run in this tick back to {@code pending}, which also
   * clears its claim so the next fetch picks it up. Never throws.
   */
  public void release(SyncEvent event) {
    try {
      store.updateStatus(event.id(), EventStatus.PENDING, null);
      logger.log(Level.FINE, "Released unprocessed event {0}", event.id());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release eventId=" + event.id()
          + "; it becomes claimable again when its lock expires", e);
      errors.record("status_update", e.getMessage(), event.id(), e);
    }
  }

  private EventResult invoke(SyncEvent event) {
    long timeoutMs = config.policy(event.priority()).timeoutMs();
    Future<EventResult> future;
    try {
      future = processorExecutor.submit(() -> processor.process(event));
    } catch (RejectedExecutionException e) {
      return EventResult.failure("Processor executor rejected event: " + e.getMessage());
    }
    try {
      EventResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
      return result != null ? result : EventResult.failure("Processor returned no result");
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.log(Level.WARNING, "Event {0} timed out after {1} ms",
          new Object[]{event.id(), timeoutMs});
      return EventResult.failure(TIMEOUT_ERROR);
    } catch (ExecutionException e) {
      return EventResult.failure(messageOf(e.getCause() != null ? e.getCause() : e));
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return EventResult.failure("Worker interrupted");
    }
  }

  private boolean complete(SyncEvent event, long startNanos) {
    try {
      store.updateStatus(event.id(), EventStatus.COMPLETED, null);
    } catch (RuntimeException e) {
      // Processed but not marked: the claim expires and the event is re-fetched
      logger.log(Level.SEVERE, "Failed to mark completed for eventId=" + event.id(), e);
      errors.record("status_update", e.getMessage(), event.id(), e);
      return false;
    }
    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    stats.recordProcessed(durationMs);
    metrics.incrementProcessed(event.priority());
    metrics.recordProcessingTimeMs(event.priority(), durationMs);
    logger.log(Level.FINE, "Event {0} completed ({1} ms)", new Object[]{event.id(), durationMs});
    listener.onEventProcessed(event, durationMs);
    return true;
  }

  private static String messageOf(Throwable t) {
    String message = t.getMessage();
    return message != null ? message : t.getClass().getName();
  }
}
