package io.syncqueue.dispatch;

import io.syncqueue.model.Priority;

/**
 * Tracks running workers: which event ids are held in this process and how many
 * workers are active, globally and per priority.
 *
 * <p>One tracker is shared by every tick and manual run of an engine, so the global
 * concurrency cap holds even when they overlap.
 */
public interface InFlightTracker {

  /**
   * Registers a worker for {@code eventId}.
   *
   * @return {@code false} if the event is already held by another worker
   */
  boolean tryAcquire(String eventId, Priority priority);

  void release(String eventId, Priority priority);

  int activeCount();

  int activeCount(Priority priority);

  /**
   * Workers started for {@code priority} since the tracker was created.
   */
  long startedCount(Priority priority);
}
