package io.syncqueue;

import io.syncqueue.dispatch.BatchSummary;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.stats.ErrorRecord;

/**
 * Observer for engine notifications. All methods default to no-ops.
 *
 * <p>Callbacks run on engine threads (tick, worker or cleanup). Implementations should
 * return quickly; exceptions they throw are logged and otherwise ignored.
 */
public interface QueueListener {

  default void onProcessingStarted() {
  }

  default void onProcessingStopped() {
  }

  /**
   * Called after an event was processed and marked completed.
   */
  default void onEventProcessed(SyncEvent event, long durationMs) {
  }

  default void onBatchProcessed(BatchSummary summary) {
  }

  /**
   * Called after an event exhausted its retries and left the retry cycle.
   */
  default void onEventDeadLettered(SyncEvent event, String error) {
  }

  default void onError(ErrorRecord error) {
  }
}
