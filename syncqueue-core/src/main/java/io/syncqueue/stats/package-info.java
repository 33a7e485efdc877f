/**
 * In-memory run statistics read by {@link io.syncqueue.SyncQueueEngine#getStatus()}.
 */
package io.syncqueue.stats;
