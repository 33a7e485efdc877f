/**
 * Priority-driven processing of a durable sync-event queue.
 *
 * <p>{@link io.syncqueue.SyncQueueEngine} is the entry point. It polls an
 * {@link io.syncqueue.spi.EventStore} on a fixed tick, runs due events through an
 * {@link io.syncqueue.spi.EventProcessor}, retries failures with exponential backoff and
 * dead-letters events that exhaust their retries.
 */
package io.syncqueue;
