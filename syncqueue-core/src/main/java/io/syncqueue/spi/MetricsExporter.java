package io.syncqueue.spi;

import io.syncqueue.model.Priority;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events completed successfully.
   */
  void incrementProcessed(Priority priority);

  /**
   * Increments the count of events rescheduled for retry.
   */
  void incrementRetried(Priority priority);

  /**
   * Increments the count of events that exhausted their retries.
   */
  void incrementDeadLettered(Priority priority);

  /**
   * Increments the count of recorded errors of any kind.
   */
  void incrementFailed();

  /**
   * Increments the count of processed batches.
   */
  void incrementBatches();

  /**
   * Increments the count of priority fetches skipped by the rate limiter.
   */
  default void incrementRateLimited() {
  }

  /**
   * Records the number of workers currently running.
   */
  void recordActiveWorkers(int active);

  /**
   * Records the time spent on one successful event, processor call included.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordProcessingTimeMs(Priority priority, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementProcessed(Priority priority) {
    }

    @Override
    public void incrementRetried(Priority priority) {
    }

    @Override
    public void incrementDeadLettered(Priority priority) {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementBatches() {
    }

    @Override
    public void recordActiveWorkers(int active) {
    }
  }
}
