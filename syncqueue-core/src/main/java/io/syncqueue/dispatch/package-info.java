/**
 * Dispatch pipeline: priority iteration, batch grouping, bounded-concurrency worker
 * execution and the retry/dead-letter decision.
 *
 * @see io.syncqueue.dispatch.PriorityDispatcher
 * @see io.syncqueue.dispatch.BatchExecutor
 * @see io.syncqueue.dispatch.EventWorker
 * @see io.syncqueue.dispatch.FailureHandler
 */
package io.syncqueue.dispatch;
