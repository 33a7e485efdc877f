package io.syncqueue.dispatch;

import io.syncqueue.QueueListener;
import io.syncqueue.config.PriorityPolicy;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.model.EventStatus;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;
import io.syncqueue.stats.ErrorRecorder;
import io.syncqueue.stats.RunStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides between retry and dead-letter for a failed event and persists the decision.
 *
 * <p>While {@code retryCount < maxRetries} the event is rescheduled with backoff and the
 * store increments its retry count. Once exhausted it is moved to dead-letter, or parked
 * as {@link EventStatus#FAILED} when dead-lettering is disabled.
 */
public final class FailureHandler {
  private static final Logger logger = Logger.getLogger(FailureHandler.class.getName());

  /** Latest schedule a retry may receive; keeps the instant representable by any store. */
  static final long MAX_SCHEDULE_DELAY_MS = Duration.ofDays(3650).toMillis();

  private final EventStore store;
  private final QueueConfig config;
  private final RetryPolicy retryPolicy;
  private final RunStats stats;
  private final MetricsExporter metrics;
  private final QueueListener listener;
  private final ErrorRecorder errors;
  private final Clock clock;

  public FailureHandler(EventStore store, QueueConfig config, RetryPolicy retryPolicy,
      RunStats stats, MetricsExporter metrics, QueueListener listener,
      ErrorRecorder errors, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.config = Objects.requireNonNull(config, "config");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Handles one failed attempt. Store failures are logged and recorded, never thrown.
   *
   * @param event        the event as fetched (its {@code retryCount} drives the decision)
   * @param errorMessage failure description; becomes the event's last error
   */
  public void handle(SyncEvent event, String errorMessage) {
    PriorityPolicy policy = config.policy(event.priority());
    String error = errorMessage == null ? "Unknown error" : errorMessage;
    errors.record("event_processing", error, event.id(), null);

    try {
      if (event.retryCount() < policy.maxRetries()) {
        scheduleRetry(event, error, policy);
      } else {
        deadLetter(event, error, policy);
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to persist failure outcome for eventId=" + event.id(), e);
      errors.record("retry_scheduling", e.getMessage(), event.id(), e);
    }
  }

  private void scheduleRetry(SyncEvent event, String error, PriorityPolicy policy) {
    long delayMs = Math.min(MAX_SCHEDULE_DELAY_MS,
        retryPolicy.computeDelayMs(policy, event.retryCount()));
    Instant scheduledAt = clock.instant().plusMillis(delayMs);
    store.scheduleRetry(event.id(), error, scheduledAt);
    stats.recordRetried();
    metrics.incrementRetried(event.priority());
    logger.log(Level.WARNING, "Event {0} failed: {1} (retry {2}/{3}, next attempt at {4})",
        new Object[]{event.id(), error, event.retryCount() + 1, policy.maxRetries(), scheduledAt});
  }

  private void deadLetter(SyncEvent event, String error, PriorityPolicy policy) {
    boolean toDeadLetter = config.deadLetter().enabled();
    if (toDeadLetter) {
      store.moveToDeadLetter(event.id(), error);
    } else {
      store.updateStatus(event.id(), EventStatus.FAILED, error);
    }
    stats.recordDeadLettered();
    metrics.incrementDeadLettered(event.priority());
    logger.log(Level.SEVERE, "Event {0} exhausted {1} retries, moved to {2}: {3}",
        new Object[]{event.id(), policy.maxRetries(),
            toDeadLetter ? "dead letter" : "failed", error});
    if (toDeadLetter) {
      listener.onEventDeadLettered(event, error);
    }
  }
}
