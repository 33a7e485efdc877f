/**
 * Domain model of the sync queue: the persisted event snapshot, its lifecycle status,
 * its dispatch priority and store-side aggregates.
 *
 * @see io.syncqueue.model.SyncEvent
 * @see io.syncqueue.model.EventStatus
 */
package io.syncqueue.model;
