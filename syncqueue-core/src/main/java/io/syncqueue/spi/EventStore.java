package io.syncqueue.spi;

import io.syncqueue.model.EventStatus;
import io.syncqueue.model.Priority;
import io.syncqueue.model.QueueStatistics;
import io.syncqueue.model.SyncEvent;

import java.time.Instant;
import java.util.List;

/**
 * Persistence contract for the durable sync-event queue, managing status transitions
 * through the lifecycle: pending → processing → completed, pending (retry),
 * dead_letter, or failed (dead-lettering disabled).
 *
 * <p>The engine is a pure client of this contract. Two guarantees belong to the
 * implementation, not to the engine:
 * <ul>
 *   <li><b>Atomic claim.</b> {@link #fetchPendingByPriority} must select and mark rows
 *       in one step, skipping rows already claimed by another caller.</li>
 *   <li><b>Sticky terminal states.</b> Writes to an event already in
 *       {@link EventStatus#COMPLETED} or {@link EventStatus#DEAD_LETTER} must be ignored,
 *       so a late write from a timed-out worker cannot resurrect it.</li>
 * </ul>
 *
 * <p>Implementations report infrastructure failures with unchecked exceptions.
 *
 * @see io.syncqueue.jdbc.AbstractJdbcEventStore
 */
public interface EventStore {

  /**
   * Claims and returns up to {@code batchSize} due pending events of the given priority
   * whose retry count is at or under {@code maxRetryCount}.
   *
   * @param priority      priority level to fetch
   * @param batchSize     maximum number of events to claim
   * @param maxRetryCount events with a higher retry count are excluded
   * @return claimed events, oldest schedule first; never {@code null}
   */
  List<SyncEvent> fetchPendingByPriority(Priority priority, int batchSize, int maxRetryCount);

  /**
   * Sets the status of an event, recording {@code errorMessage} as its last error when non-null.
   */
  void updateStatus(String eventId, EventStatus status, String errorMessage);

  /**
   * Returns an event to pending with a future schedule.
   *
   * <p>Implementations <strong>must</strong> increment the event's retry count as part of
   * this operation; the engine reads the stored count to decide dead-lettering.
   *
   * @param eventId      the event to reschedule
   * @param errorMessage error from the failed attempt
   * @param scheduledAt  earliest time of the next attempt
   */
  void scheduleRetry(String eventId, String errorMessage, Instant scheduledAt);

  /**
   * Moves an event to the terminal dead-letter state.
   */
  void moveToDeadLetter(String eventId, String finalError);

  /**
   * Deletes completed events last updated before {@code now - retentionDays}.
   *
   * @return number of rows deleted
   */
  int cleanupOldEvents(int retentionDays);

  /**
   * Deletes dead-lettered events last updated before {@code now - retentionDays}.
   *
   * @return number of rows deleted
   */
  int cleanupDeadLetter(int retentionDays);

  /**
   * Aggregates row counts by status and pending counts by priority.
   */
  QueueStatistics getQueueStatistics();

  /**
   * Returns events parked in {@link EventStatus#FAILED} within the last {@code maxAgeHours}
   * to pending with a zero retry count.
   *
   * @param priorityFilter only reset this priority, or {@code null} for all
   * @param maxAgeHours    only reset events that failed within this many hours
   * @return number of events reset
   */
  int resetFailedEvents(Priority priorityFilter, int maxAgeHours);

  /**
   * Checks that the backing store is reachable. Called once from
   * {@link io.syncqueue.SyncQueueEngine#initialize}.
   */
  default void verifyConnectivity() {
  }
}
