package io.syncqueue.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Store-side aggregate counts, independent of the engine's in-memory counters
 * (which reset on restart).
 *
 * @param countsByStatus     number of rows per status (absent statuses map to 0)
 * @param pendingByPriority  number of pending rows per priority
 * @param oldestPendingAt    {@code scheduledAt} of the oldest pending row, or {@code null}
 */
public record QueueStatistics(
    Map<EventStatus, Long> countsByStatus,
    Map<Priority, Long> pendingByPriority,
    Instant oldestPendingAt
) {

  public QueueStatistics {
    countsByStatus = Collections.unmodifiableMap(fill(EventStatus.class, countsByStatus));
    pendingByPriority = Collections.unmodifiableMap(fill(Priority.class, pendingByPriority));
  }

  public long count(EventStatus status) {
    return countsByStatus.get(status);
  }

  public long total() {
    long total = 0;
    for (long n : countsByStatus.values()) {
      total += n;
    }
    return total;
  }

  private static <E extends Enum<E>> Map<E, Long> fill(Class<E> type, Map<E, Long> source) {
    EnumMap<E, Long> map = new EnumMap<>(type);
    for (E key : type.getEnumConstants()) {
      Long value = source == null ? null : source.get(key);
      map.put(key, value == null ? 0L : value);
    }
    return map;
  }
}
