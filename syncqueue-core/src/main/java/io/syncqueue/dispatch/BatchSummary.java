package io.syncqueue.dispatch;

import io.syncqueue.model.Priority;

/**
 * Result of one batch, delivered to {@link io.syncqueue.QueueListener#onBatchProcessed}.
 *
 * @param batchId          identifier for log correlation
 * @param priority         priority the batch was fetched for
 * @param events           number of events in the batch
 * @param processed        number of events that completed successfully
 * @param processingTimeMs wall time of the whole batch
 */
public record BatchSummary(String batchId, Priority priority, int events, int processed, long processingTimeMs) {
}
