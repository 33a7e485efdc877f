package io.syncqueue.spi;

import io.syncqueue.EventResult;
import io.syncqueue.model.SyncEvent;

/**
 * Performs the side-effecting work for a single event.
 *
 * <p>The engine calls this under a per-priority deadline. On timeout the calling
 * thread is interrupted, but cancellation is not guaranteed: implementations should
 * either honour interruption or be safe to complete after the engine has already
 * rescheduled the event.
 *
 * <p>Returning {@link EventResult#failure(String)} and throwing are equivalent;
 * both enter the retry path.
 */
@FunctionalInterface
public interface EventProcessor {

  EventResult process(SyncEvent event) throws Exception;
}
