package io.syncqueue;

import io.syncqueue.dispatch.BatchSummary;
import io.syncqueue.model.SyncEvent;
import io.syncqueue.stats.ErrorRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans notifications out to registered listeners in registration order, isolating
 * each callback so a failing listener cannot disturb dispatch.
 */
public final class CompositeQueueListener implements QueueListener {
  private static final Logger logger = Logger.getLogger(CompositeQueueListener.class.getName());

  private final List<QueueListener> listeners;

  public CompositeQueueListener(List<QueueListener> listeners) {
    Objects.requireNonNull(listeners, "listeners");
    List<QueueListener> copy = new ArrayList<>(listeners.size());
    for (QueueListener listener : listeners) {
      copy.add(Objects.requireNonNull(listener, "listener"));
    }
    this.listeners = Collections.unmodifiableList(copy);
  }

  public List<QueueListener> listeners() {
    return listeners;
  }

  @Override
  public void onProcessingStarted() {
    fire("onProcessingStarted", QueueListener::onProcessingStarted);
  }

  @Override
  public void onProcessingStopped() {
    fire("onProcessingStopped", QueueListener::onProcessingStopped);
  }

  @Override
  public void onEventProcessed(SyncEvent event, long durationMs) {
    fire("onEventProcessed", l -> l.onEventProcessed(event, durationMs));
  }

  @Override
  public void onBatchProcessed(BatchSummary summary) {
    fire("onBatchProcessed", l -> l.onBatchProcessed(summary));
  }

  @Override
  public void onEventDeadLettered(SyncEvent event, String error) {
    fire("onEventDeadLettered", l -> l.onEventDeadLettered(event, error));
  }

  @Override
  public void onError(ErrorRecord error) {
    fire("onError", l -> l.onError(error));
  }

  private void fire(String callback, Consumer<QueueListener> action) {
    for (QueueListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Listener " + callback + " failed", ex);
      }
    }
  }
}
