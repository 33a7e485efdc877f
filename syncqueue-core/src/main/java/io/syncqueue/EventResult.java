package io.syncqueue;

/**
 * Outcome of one {@link io.syncqueue.spi.EventProcessor#process} call.
 *
 * @param success whether the event was handled
 * @param error   failure description; {@code null} on success
 */
public record EventResult(boolean success, String error) {

  private static final EventResult SUCCESS = new EventResult(true, null);

  public static EventResult ok() {
    return SUCCESS;
  }

  public static EventResult failure(String error) {
    return new EventResult(false, error == null ? "Unknown error" : error);
  }
}
