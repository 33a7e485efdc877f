package io.syncqueue.model;

import java.util.Locale;

/**
 * Dispatch priority of a {@link SyncEvent}.
 *
 * <p>Declaration order is dispatch order: every tick services {@link #CRITICAL} first and
 * {@link #LOW} last.
 */
public enum Priority {
  CRITICAL("critical", 10),
  HIGH("high", 7),
  NORMAL("normal", 5),
  LOW("low", 2);

  private final String wireName;
  private final int level;

  Priority(String wireName, int level) {
    this.wireName = wireName;
    this.level = level;
  }

  /** Lower-case name as stored in the {@code priority} column. */
  public String wireName() {
    return wireName;
  }

  public int level() {
    return level;
  }

  public static Priority fromWireName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("priority name must not be null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (Priority p : values()) {
      if (p.wireName.equals(normalized)) {
        return p;
      }
    }
    throw new IllegalArgumentException("Unknown priority: " + name);
  }
}
