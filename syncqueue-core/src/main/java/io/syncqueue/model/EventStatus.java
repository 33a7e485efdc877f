package io.syncqueue.model;

import java.util.Locale;

public enum EventStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed"),
  DEAD_LETTER("dead_letter");

  private final String wireName;

  EventStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Terminal states are sticky: once reached, stores ignore further status writes.
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == DEAD_LETTER;
  }

  public static EventStatus fromWireName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("status name must not be null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (EventStatus s : values()) {
      if (s.wireName.equals(normalized)) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown event status: " + name);
  }
}
