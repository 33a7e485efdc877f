package io.syncqueue.dispatch;

import io.syncqueue.model.Priority;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with atomic active counters.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Priority> inflight = new ConcurrentHashMap<>();
  private final AtomicInteger active = new AtomicInteger();
  private final Map<Priority, AtomicInteger> activeByPriority = new EnumMap<>(Priority.class);
  private final Map<Priority, AtomicLong> startedByPriority = new EnumMap<>(Priority.class);

  public DefaultInFlightTracker() {
    for (Priority p : Priority.values()) {
      activeByPriority.put(p, new AtomicInteger());
      startedByPriority.put(p, new AtomicLong());
    }
  }

  @Override
  public boolean tryAcquire(String eventId, Priority priority) {
    if (inflight.putIfAbsent(eventId, priority) != null) {
      return false;
    }
    active.incrementAndGet();
    activeByPriority.get(priority).incrementAndGet();
    startedByPriority.get(priority).incrementAndGet();
    return true;
  }

  @Override
  public void release(String eventId, Priority priority) {
    if (inflight.remove(eventId, priority)) {
      active.decrementAndGet();
      activeByPriority.get(priority).decrementAndGet();
    }
  }

  @Override
  public int activeCount() {
    return active.get();
  }

  @Override
  public int activeCount(Priority priority) {
    return activeByPriority.get(priority).get();
  }

  @Override
  public long startedCount(Priority priority) {
    return startedByPriority.get(priority).get();
  }
}
